package org.dxworks.pgshape.model;

public class ColumnDefinition {
    public String name;
    public TypeName type;
    public boolean nullable = true;
    public String defaultExpression;

    public ColumnDefinition() {
    }

    public ColumnDefinition(String name, TypeName type, boolean nullable) {
        this.name = name;
        this.type = type;
        this.nullable = nullable;
    }
}
