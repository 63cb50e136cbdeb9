package org.dxworks.pgshape.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class IdentifierTest {

    @Test
    void missingSchemaDefaultsToPublic() {
        assertEquals("public.users", Identifier.of("users").toString());
        assertEquals(Identifier.of("users"), new Identifier("", "users"));
    }

    @Test
    void parseSplitsOnLastDot() {
        Identifier id = Identifier.parse("audit.log", "public");
        assertEquals("audit", id.getSchema());
        assertEquals("log", id.getName());
        assertEquals("app", Identifier.parse("log", "app").getSchema());
    }

    @Test
    void equalityIsCaseSensitive() {
        assertNotEquals(Identifier.of("Users"), Identifier.of("users"));
    }

    @Test
    void ordersBySchemaThenName() {
        List<Identifier> ids = new ArrayList<>(List.of(
                new Identifier("public", "b"),
                new Identifier("audit", "z"),
                new Identifier("public", "a")));
        Collections.sort(ids);
        assertEquals("[audit.z, public.a, public.b]", ids.toString());
    }

    @Test
    void rejectsEmptyName() {
        assertThrows(IllegalArgumentException.class, () -> new Identifier("public", ""));
    }
}
