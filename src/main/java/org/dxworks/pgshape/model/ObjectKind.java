package org.dxworks.pgshape.model;

public enum ObjectKind {
    TABLE("table"),
    VIEW("view"),
    COMPOSITE_TYPE("composite type"),
    ENUM_TYPE("enum type"),
    ROUTINE("routine");

    private final String label;

    ObjectKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Kinds that can appear in a FROM clause or be used as a row type.
     */
    public boolean isRelation() {
        return this == TABLE || this == VIEW || this == COMPOSITE_TYPE;
    }

    /**
     * Kinds that introduce a type name.
     */
    public boolean isType() {
        return this != ROUTINE;
    }
}
