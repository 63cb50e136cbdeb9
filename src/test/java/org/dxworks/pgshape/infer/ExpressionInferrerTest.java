package org.dxworks.pgshape.infer;

import org.dxworks.pgshape.error.ColumnNotFoundException;
import org.dxworks.pgshape.error.UnknownTypeException;
import org.dxworks.pgshape.error.UnsupportedConstructException;
import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.Field;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExpressionInferrerTest {

    private final InferenceFixture fixture = new InferenceFixture();

    @Test
    void literalsAreAnonymousAndTypedByValue() {
        List<Field> fields = fixture.fields("SELECT 1, 3000000000, 99999999999999999999, 1.5, 'x', NULL");
        assertEquals("?column?", fields.get(0).getName());
        assertEquals(BuiltinTypes.INT4, fields.get(0).getTypeOid());
        assertEquals(BuiltinTypes.INT8, fields.get(1).getTypeOid());
        assertEquals(BuiltinTypes.NUMERIC, fields.get(2).getTypeOid());
        assertEquals(BuiltinTypes.NUMERIC, fields.get(3).getTypeOid());
        assertEquals(BuiltinTypes.TEXT, fields.get(4).getTypeOid());
        assertFalse(fields.get(4).isNullable());
        assertEquals(BuiltinTypes.UNKNOWN, fields.get(5).getTypeOid());
        assertTrue(fields.get(5).isNullable());
    }

    @Test
    void columnsKeepTheirDeclaredTypeAndNullability() {
        List<Field> fields = fixture.fields("SELECT id, name, t1.name AS display FROM t1");
        assertEquals("id", fields.get(0).getName());
        assertFalse(fields.get(0).isNullable());
        assertTrue(fields.get(1).isNullable());
        assertEquals("display", fields.get(2).getName());
        assertEquals("text", fixture.typeName(fields.get(2)));
    }

    @Test
    void starExpandsEveryBoundRelation() {
        assertEquals(2, fixture.fields("SELECT * FROM t1").size());
        assertEquals(5, fixture.fields("SELECT * FROM t1 JOIN t2 ON t2.t1_id = t1.id").size());
        assertEquals(3, fixture.fields("SELECT t2.* FROM t1 JOIN t2 ON t2.t1_id = t1.id").size());
        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT *"));
    }

    @Test
    void castsKeepOperandNamesAndNullability() {
        List<Field> fields = fixture.fields("SELECT name::varchar(10), '1'::int, CAST(id AS bigint) FROM t1");
        assertEquals("name", fields.get(0).getName());
        assertEquals("varchar", fixture.typeName(fields.get(0)));
        assertTrue(fields.get(0).isNullable());
        assertEquals("int4", fields.get(1).getName());
        assertEquals(BuiltinTypes.INT4, fields.get(1).getTypeOid());
        assertEquals("id", fields.get(2).getName());
        assertEquals(BuiltinTypes.INT8, fields.get(2).getTypeOid());
    }

    @Test
    void arrayConstructorsAddADimension() {
        Field array = fixture.field("SELECT ARRAY[1, 2]");
        assertEquals("array", array.getName());
        assertEquals(BuiltinTypes.INT4, array.getTypeOid());
        assertEquals(1, array.getDims());
        assertFalse(array.isNullable());

        Field nested = fixture.field("SELECT ARRAY[tags, tags] FROM posts");
        assertEquals(BuiltinTypes.TEXT, nested.getTypeOid());
        assertEquals(2, nested.getDims());
    }

    @Test
    void builtinFunctionsResolveTheirReturnTypes() {
        List<Field> fields = fixture.fields("SELECT count(*), sum(a), max(b), coalesce(b, 'none'), lower(b), now() FROM foo");
        assertEquals("count", fields.get(0).getName());
        assertEquals(BuiltinTypes.INT8, fields.get(0).getTypeOid());
        assertFalse(fields.get(0).isNullable());
        assertEquals(BuiltinTypes.INT4, fields.get(1).getTypeOid());
        assertTrue(fields.get(1).isNullable());
        assertEquals(BuiltinTypes.TEXT, fields.get(2).getTypeOid());
        assertFalse(fields.get(3).isNullable());
        assertTrue(fields.get(4).isNullable());
        assertEquals("timestamptz", fixture.typeName(fields.get(5)));
    }

    @Test
    void coalesceTakesTheFirstResolvedArgumentType() {
        Field field = fixture.field("SELECT coalesce(NULL, t2.label, 'none') FROM t2");
        assertEquals("varchar", fixture.typeName(field));
        assertFalse(field.isNullable());
    }

    @Test
    void unknownFunctionsAreReported() {
        assertThrows(UnknownTypeException.class, () -> fixture.fields("SELECT no_such_function(1)"));
    }

    @Test
    void arithmeticWidensNumericOperands() {
        List<Field> fields = fixture.fields("SELECT a + 1, a * 1.5, 2 - 3000000000, a / 2 AS half FROM foo");
        assertEquals(BuiltinTypes.INT4, fields.get(0).getTypeOid());
        assertTrue(fields.get(0).isNullable());
        assertEquals(BuiltinTypes.NUMERIC, fields.get(1).getTypeOid());
        assertEquals(BuiltinTypes.INT8, fields.get(2).getTypeOid());
        assertFalse(fields.get(2).isNullable());
        assertEquals("half", fields.get(3).getName());
    }

    @Test
    void predicatesAreBoolean() {
        List<Field> fields = fixture.fields("SELECT id = 1, name IS NULL, name LIKE 'a%', NOT (id > 2) FROM t1");
        for (Field field : fields) {
            assertEquals(BuiltinTypes.BOOL, field.getTypeOid());
        }
        assertFalse(fields.get(0).isNullable());
        assertFalse(fields.get(1).isNullable());
        assertTrue(fields.get(2).isNullable());
        assertFalse(fields.get(3).isNullable());
    }

    @Test
    void concatenationYieldsText() {
        Field field = fixture.field("SELECT name || '!' FROM t1");
        assertEquals(BuiltinTypes.TEXT, field.getTypeOid());
        assertTrue(field.isNullable());
    }

    @Test
    void caseTakesTheFirstTypedBranch() {
        Field noElse = fixture.field("SELECT CASE WHEN a > 0 THEN 'pos' END FROM foo");
        assertEquals("case", noElse.getName());
        assertEquals(BuiltinTypes.TEXT, noElse.getTypeOid());
        assertTrue(noElse.isNullable());

        Field withElse = fixture.field("SELECT CASE WHEN a > 0 THEN NULL WHEN a < 0 THEN 1 ELSE 2 END FROM foo");
        assertEquals(BuiltinTypes.INT4, withElse.getTypeOid());
        assertTrue(withElse.isNullable());

        assertFalse(fixture.field("SELECT CASE WHEN a > 0 THEN 1 ELSE 2 END FROM foo").isNullable());
    }

    @Test
    void jsonAccessOperators() {
        List<Field> fields = fixture.fields("SELECT meta->>'k', meta->'k' FROM posts");
        assertEquals(BuiltinTypes.TEXT, fields.get(0).getTypeOid());
        assertTrue(fields.get(0).isNullable());
        assertEquals(BuiltinTypes.JSONB, fields.get(1).getTypeOid());
    }

    @Test
    void scalarSubqueriesYieldTheirFirstColumn() {
        Field field = fixture.field("SELECT (SELECT title FROM posts LIMIT 1) AS latest");
        assertEquals("latest", field.getName());
        assertEquals(BuiltinTypes.TEXT, field.getTypeOid());
    }

    @Test
    void missingColumnsAreReported() {
        ColumnNotFoundException e = assertThrows(ColumnNotFoundException.class,
                () -> fixture.fields("SELECT missing FROM t1"));
        assertFalse(e.isAmbiguous());
        assertEquals("missing", e.getColumnName());

        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT x.id FROM t1"));
    }

    @Test
    void arraySubscriptsAreUnsupported() {
        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT tags[1] FROM posts"));
        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT tags[1] AS first_tag FROM posts"));
        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT upper(tags[1]) FROM posts"));
    }

    @Test
    void setOperationsMergeNullability() {
        Field field = fixture.field("SELECT id FROM t1 UNION SELECT NULL");
        assertEquals("id", field.getName());
        assertTrue(field.isNullable());

        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT 1 UNION SELECT 1, 2"));
    }

    @Test
    void recognizesTextJsonOperators() {
        assertTrue(ExpressionInferrer.lastJsonOperatorIsText("meta -> 'a' ->> 'b'"));
        assertFalse(ExpressionInferrer.lastJsonOperatorIsText("meta ->> 'a' -> 'b'"));
        assertFalse(ExpressionInferrer.lastJsonOperatorIsText("meta -> '->>'"));
        assertTrue(ExpressionInferrer.lastJsonOperatorIsText("meta #>> '{a,b}'"));
    }
}
