package org.dxworks.pgshape.infer;

import org.dxworks.pgshape.error.ColumnNotFoundException;
import org.dxworks.pgshape.error.RelationNotFoundException;
import org.dxworks.pgshape.error.UnsupportedConstructException;
import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.Field;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ScopeResolverTest {

    private final InferenceFixture fixture = new InferenceFixture();

    private static List<String> names(List<Field> fields) {
        List<String> names = new ArrayList<>();
        for (Field field : fields) {
            names.add(field.getName());
        }
        return names;
    }

    @Test
    void ctesSeeEarlierCtes() {
        List<Field> fields = fixture.fields("WITH a AS (SELECT 1 AS x), b AS (SELECT x FROM a) SELECT x FROM b");
        assertEquals(List.of("x"), names(fields));
        assertEquals(BuiltinTypes.INT4, fields.get(0).getTypeOid());
    }

    @Test
    void ctesDoNotSeeLaterCtes() {
        RelationNotFoundException e = assertThrows(RelationNotFoundException.class,
                () -> fixture.fields("WITH b AS (SELECT x FROM a), a AS (SELECT 1 AS x) SELECT x FROM b"));
        assertEquals("public.a", e.getRelationName());
    }

    @Test
    void cteColumnAliasesRenameFields() {
        assertEquals(List.of("n"), names(fixture.fields("WITH c(n) AS (SELECT id FROM t1) SELECT n FROM c")));
    }

    @Test
    void ctesAreVisibleInsideScalarSubqueries() {
        Field total = fixture.field("WITH c AS (SELECT id FROM t1) SELECT (SELECT count(*) FROM c) AS total");
        assertEquals("total", total.getName());
        assertEquals(BuiltinTypes.INT8, total.getTypeOid());
        assertFalse(total.isNullable());
    }

    @Test
    void tableAliasColumnsRenameFields() {
        assertEquals(List.of("x", "y"), names(fixture.fields("SELECT * FROM foo AS f(x, y)")));
        assertEquals(List.of("x", "b"), names(fixture.fields("SELECT f.* FROM foo AS f(x)")));
    }

    @Test
    void tableAliasColumnsWorkWithoutAs() {
        List<Field> fields = fixture.fields("SELECT * FROM foo f(x, y)");
        assertEquals(List.of("x", "y"), names(fields));
        assertEquals(BuiltinTypes.INT4, fields.get(0).getTypeOid());
        assertEquals(List.of("y"), names(fixture.fields("SELECT f.y FROM foo f(x, y)")));
    }

    @Test
    void tooManyAliasColumnsAreRejected() {
        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT * FROM foo AS f(x, y, z)"));
    }

    @Test
    void sharedColumnNamesAreAmbiguous() {
        ColumnNotFoundException e = assertThrows(ColumnNotFoundException.class,
                () -> fixture.fields("SELECT id FROM t1 JOIN t2 ON t1.id = t2.t1_id"));
        assertTrue(e.isAmbiguous());
        assertEquals("id", e.getColumnName());

        assertEquals(List.of("id", "label"), names(fixture.fields("SELECT t1.id, label FROM t1 JOIN t2 ON t1.id = t2.t1_id")));
    }

    @Test
    void aliasHidesTheTableName() {
        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT t1.id FROM t1 AS x"));
        assertEquals(List.of("id"), names(fixture.fields("SELECT x.id FROM t1 AS x")));
    }

    @Test
    void duplicateRangeNamesAreRejected() {
        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT 1 FROM t1, t1"));
    }

    @Test
    void unknownRelationsAreReported() {
        RelationNotFoundException e = assertThrows(RelationNotFoundException.class,
                () -> fixture.fields("SELECT * FROM nope"));
        assertEquals("public.nope", e.getRelationName());
    }

    @Test
    void subqueriesInFromNeedAnAlias() {
        assertThrows(UnsupportedConstructException.class, () -> fixture.fields("SELECT * FROM (SELECT 1)"));
        assertEquals(List.of("one"), names(fixture.fields("SELECT * FROM (SELECT 1 AS one) s")));
    }

    @Test
    void rangeFunctionsAreUnsupported() {
        assertThrows(UnsupportedConstructException.class,
                () -> fixture.fields("SELECT * FROM generate_series(1, 3)"));
    }

    @Test
    void outerJoinsMakeTheOptionalSideNullable() {
        List<Field> left = fixture.fields("SELECT t1.id, t2.id AS t2_id FROM t1 LEFT JOIN t2 ON t2.t1_id = t1.id");
        assertFalse(left.get(0).isNullable());
        assertTrue(left.get(1).isNullable());

        List<Field> right = fixture.fields("SELECT t1.id, t2.id AS t2_id FROM t1 RIGHT JOIN t2 ON t2.t1_id = t1.id");
        assertTrue(right.get(0).isNullable());
        assertFalse(right.get(1).isNullable());
    }

    @Test
    void viewsExposeTheirInferredColumns() {
        assertEquals(List.of("id", "label"), names(fixture.fields("SELECT * FROM named_t1")));
        assertEquals(List.of("ref_id", "name"), names(fixture.fields("SELECT * FROM renamed_t1")));
    }
}
