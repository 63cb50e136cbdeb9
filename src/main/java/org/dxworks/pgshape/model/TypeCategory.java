package org.dxworks.pgshape.model;

/**
 * Primitive JSON-facing category of a SQL type.
 */
public enum TypeCategory {
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean"),
    JSON("JSON");

    private final String label;

    TypeCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
