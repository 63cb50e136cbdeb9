package org.dxworks.pgshape.model.json;

import org.dxworks.pgshape.model.TypeCategory;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class JsonTypeRendererTest {

    @Test
    void rendersPrimitives() {
        assertEquals("number", JsonTypeRenderer.render(new PrimitiveType(TypeCategory.NUMBER, false)));
        assertEquals("JSON | null", JsonTypeRenderer.render(PrimitiveType.json(true)));
    }

    @Test
    void rendersObjectsInDeclarationOrder() {
        Map<String, StructuralType> fields = new LinkedHashMap<>();
        fields.put("name", new PrimitiveType(TypeCategory.STRING, true));
        fields.put("id", new PrimitiveType(TypeCategory.NUMBER, false));
        assertEquals("{ name: string | null, id: number }", JsonTypeRenderer.render(new ObjectType(fields, false)));
        assertEquals("{} | null", JsonTypeRenderer.render(new ObjectType(Map.of(), true)));
    }

    @Test
    void parenthesizesNullableAndUnionElements() {
        ArrayType nullableElements = new ArrayType(new PrimitiveType(TypeCategory.STRING, true), false);
        assertEquals("(string | null)[]", JsonTypeRenderer.render(nullableElements));

        StructuralType union = StructuralType.union(new PrimitiveType(TypeCategory.NUMBER, false),
                new PrimitiveType(TypeCategory.BOOLEAN, false));
        assertEquals("(number | boolean)[] | null", JsonTypeRenderer.render(new ArrayType(union, true)));
    }

    @Test
    void unionMembersKeepNestedNulls() {
        Map<String, StructuralType> a = new LinkedHashMap<>();
        a.put("a", new PrimitiveType(TypeCategory.NUMBER, true));
        Map<String, StructuralType> b = new LinkedHashMap<>();
        b.put("b", new PrimitiveType(TypeCategory.NUMBER, false));

        StructuralType union = StructuralType.union(new ObjectType(a, false), new ObjectType(b, true));
        assertEquals("{ a: number | null } | { b: number } | null", JsonTypeRenderer.render(union));
        assertEquals("{ a: number } | { b: number }", JsonTypeRenderer.render(union, false));
    }

    @Test
    void quotesKeysThatAreNotIdentifiers() {
        Map<String, StructuralType> fields = new LinkedHashMap<>();
        fields.put("first name", new PrimitiveType(TypeCategory.STRING, false));
        assertEquals("{ \"first name\": string }", JsonTypeRenderer.render(new ObjectType(fields, false)));
    }

    @Test
    void canOmitNulls() {
        ArrayType array = new ArrayType(new PrimitiveType(TypeCategory.STRING, true), true);
        assertEquals("string[]", JsonTypeRenderer.render(array, false));
    }
}
