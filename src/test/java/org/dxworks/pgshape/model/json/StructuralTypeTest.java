package org.dxworks.pgshape.model.json;

import org.dxworks.pgshape.model.TypeCategory;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StructuralTypeTest {

    private static final PrimitiveType NUMBER = new PrimitiveType(TypeCategory.NUMBER, false);
    private static final PrimitiveType STRING = new PrimitiveType(TypeCategory.STRING, false);

    private static ObjectType object(String key1, StructuralType value1, String key2, StructuralType value2) {
        Map<String, StructuralType> fields = new LinkedHashMap<>();
        fields.put(key1, value1);
        fields.put(key2, value2);
        return new ObjectType(fields, false);
    }

    @Test
    void objectHashIgnoresKeyOrder() {
        ObjectType ab = object("a", NUMBER, "b", STRING);
        ObjectType ba = object("b", STRING, "a", NUMBER);
        assertEquals(ab.contentHash(), ba.contentHash());
        assertEquals(ab, ba);
    }

    @Test
    void keysContainingSeparatorsDoNotCollide() {
        ObjectType twoKeys = object("x", STRING, "y", NUMBER);
        Map<String, StructuralType> fields = new LinkedHashMap<>();
        fields.put("x:string,y", NUMBER);
        ObjectType oneKey = new ObjectType(fields, false);

        assertNotEquals(twoKeys.contentHash(), oneKey.contentHash());
        StructuralType union = StructuralType.union(twoKeys, oneKey);
        assertInstanceOf(UnionType.class, union);
        assertEquals(2, ((UnionType) union).getMembers().size());
    }

    @Test
    void nestedObjectsDoNotMergeWithSiblings() {
        Map<String, StructuralType> inner = new LinkedHashMap<>();
        inner.put("b", NUMBER);
        ObjectType nested = object("a", new ObjectType(inner, false), "c", STRING);

        Map<String, StructuralType> wider = new LinkedHashMap<>();
        wider.put("b", NUMBER);
        wider.put("c", STRING);
        Map<String, StructuralType> outer = new LinkedHashMap<>();
        outer.put("a", new ObjectType(wider, false));

        assertNotEquals(nested.contentHash(), new ObjectType(outer, false).contentHash());
    }

    @Test
    void hashIgnoresNullability() {
        assertEquals(NUMBER.contentHash(), NUMBER.withNullable(true).contentHash());
        assertNotEquals(NUMBER, NUMBER.withNullable(true));
    }

    @Test
    void unionHashIgnoresMemberOrder() {
        StructuralType left = StructuralType.union(NUMBER, STRING);
        StructuralType right = StructuralType.union(STRING, NUMBER);
        assertEquals(left.contentHash(), right.contentHash());
    }

    @Test
    void unionFlattensAndDeduplicates() {
        StructuralType nested = StructuralType.union(StructuralType.union(NUMBER, STRING), NUMBER.withNullable(true));
        assertInstanceOf(UnionType.class, nested);
        List<StructuralType> members = ((UnionType) nested).getMembers();
        assertEquals(2, members.size());
        assertTrue(members.get(0).isNullable());
        assertEquals("number | string | null", JsonTypeRenderer.render(nested));
    }

    @Test
    void unionOfIdenticalShapesCollapses() {
        StructuralType union = StructuralType.union(NUMBER, new PrimitiveType(TypeCategory.NUMBER, false));
        assertInstanceOf(PrimitiveType.class, union);
    }

    @Test
    void unionWithMissingSideIsTheOtherSide() {
        assertSame(NUMBER, StructuralType.union(null, NUMBER));
        assertSame(STRING, StructuralType.union(STRING, null));
    }

    @Test
    void emptyUnionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> UnionType.of(List.of()));
    }

    @Test
    void arrayHashDiffersFromElementHash() {
        assertNotEquals(NUMBER.contentHash(), new ArrayType(NUMBER, false).contentHash());
    }
}
