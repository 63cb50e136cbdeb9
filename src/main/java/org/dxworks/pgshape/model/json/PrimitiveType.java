package org.dxworks.pgshape.model.json;

import org.dxworks.pgshape.model.TypeCategory;

public final class PrimitiveType extends StructuralType {

    private final TypeCategory category;
    private final boolean nullable;

    public PrimitiveType(TypeCategory category, boolean nullable) {
        this.category = category;
        this.nullable = nullable;
    }

    public static PrimitiveType json(boolean nullable) {
        return new PrimitiveType(TypeCategory.JSON, nullable);
    }

    public TypeCategory getCategory() {
        return category;
    }

    @Override
    public boolean isNullable() {
        return nullable;
    }

    @Override
    public PrimitiveType withNullable(boolean nullable) {
        return nullable == this.nullable ? this : new PrimitiveType(category, nullable);
    }

    @Override
    protected void appendCanonical(StringBuilder out) {
        out.append(category.getLabel());
    }
}
