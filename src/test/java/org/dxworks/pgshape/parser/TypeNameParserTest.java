package org.dxworks.pgshape.parser;

import org.dxworks.pgshape.model.TypeName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TypeNameParserTest {

    @Test
    void resolvesSqlSpellingsToCatalogNames() {
        assertEquals("pg_catalog.int4", TypeNameParser.parse("INTEGER", "public").getId().toString());
        assertEquals("pg_catalog.timestamptz",
                TypeNameParser.parse("timestamp with time zone", "public").getId().toString());
        assertEquals("pg_catalog.float8", TypeNameParser.parse("double  precision", "public").getId().toString());
        assertEquals("pg_catalog.bool", TypeNameParser.parse("pg_catalog.boolean", "public").getId().toString());
    }

    @Test
    void extractsModifiersAndArrayDimensions() {
        TypeName type = TypeNameParser.parse("character varying(255)[][]", "public");
        assertEquals("pg_catalog.varchar", type.getId().toString());
        assertEquals(List.of(255), type.getModifiers());
        assertEquals(2, type.getArrayDims());

        TypeName numeric = TypeNameParser.parse("numeric (10, 2)", "public");
        assertEquals(List.of(10, 2), numeric.getModifiers());
        assertEquals(0, numeric.getArrayDims());
    }

    @Test
    void arrayKeywordAddsOneDimension() {
        assertEquals(1, TypeNameParser.parse("text ARRAY", "public").getArrayDims());
        assertEquals(1, TypeNameParser.parse("int array[4]", "public").getArrayDims());
    }

    @Test
    void userTypesKeepTheirSchema() {
        assertEquals("public.mood", TypeNameParser.parse("mood", "public").getId().toString());
        assertEquals("app.mood", TypeNameParser.parse("mood[]", "app").getId().toString());
        assertEquals("audit.Level", TypeNameParser.parse("audit.\"Level\"", "public").getId().toString());
    }

    @Test
    void recognizesBuiltinNames() {
        assertTrue(TypeNameParser.isBuiltinTypeName("bigint"));
        assertTrue(TypeNameParser.isBuiltinTypeName("double precision"));
        assertFalse(TypeNameParser.isBuiltinTypeName("user_id integer"));
        assertFalse(TypeNameParser.isBuiltinTypeName("mood"));
    }
}
