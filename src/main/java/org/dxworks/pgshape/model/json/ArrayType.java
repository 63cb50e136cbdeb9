package org.dxworks.pgshape.model.json;

import java.util.Objects;

public final class ArrayType extends StructuralType {

    private final StructuralType elementType;
    private final boolean nullable;

    public ArrayType(StructuralType elementType, boolean nullable) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
        this.nullable = nullable;
    }

    public StructuralType getElementType() {
        return elementType;
    }

    @Override
    public boolean isNullable() {
        return nullable;
    }

    @Override
    public ArrayType withNullable(boolean nullable) {
        return nullable == this.nullable ? this : new ArrayType(elementType, nullable);
    }

    @Override
    protected void appendCanonical(StringBuilder out) {
        out.append('<');
        elementType.appendCanonical(out);
        out.append('>');
    }
}
