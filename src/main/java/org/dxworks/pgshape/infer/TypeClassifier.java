package org.dxworks.pgshape.infer;

import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.TypeCategory;
import org.dxworks.pgshape.model.TypeName;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps scalar types to the category their values take in JSON output. Types outside
 * {@code pg_catalog}, and builtin types not listed here, are opaque JSON.
 */
public final class TypeClassifier {

    private static final Map<String, TypeCategory> CATEGORIES = new HashMap<>();

    static {
        for (String name : List.of("int2", "int4", "int8", "float4", "float8", "numeric", "oid")) {
            CATEGORIES.put(name, TypeCategory.NUMBER);
        }
        for (String name : List.of("text", "varchar", "bpchar", "char", "name", "uuid", "citext", "date", "time",
                "timetz", "timestamp", "timestamptz", "interval", "bytea", "money", "inet", "cidr", "xml", "bit",
                "varbit", "tsvector", "unknown")) {
            CATEGORIES.put(name, TypeCategory.STRING);
        }
        CATEGORIES.put("bool", TypeCategory.BOOLEAN);
        CATEGORIES.put("json", TypeCategory.JSON);
        CATEGORIES.put("jsonb", TypeCategory.JSON);
    }

    private TypeClassifier() {
        // utility class
    }

    public static TypeCategory classify(TypeName type) {
        if (!BuiltinTypes.SCHEMA.equals(type.getId().getSchema())) {
            return TypeCategory.JSON;
        }
        return CATEGORIES.getOrDefault(type.getId().getName(), TypeCategory.JSON);
    }

    /**
     * Whether the type is {@code json} or {@code jsonb}, i.e. its values can carry a shape.
     */
    public static boolean isJson(TypeName type) {
        String name = type.getId().getName();
        return BuiltinTypes.SCHEMA.equals(type.getId().getSchema()) && ("json".equals(name) || "jsonb".equals(name));
    }
}
