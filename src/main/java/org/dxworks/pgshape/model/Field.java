package org.dxworks.pgshape.model;

import org.dxworks.pgshape.model.json.StructuralType;

/**
 * One output column of a relation or expression. {@code typeOid} is the OID of the
 * element type when {@code dims > 0}. {@code jsonType} is only set for JSON-producing
 * expressions whose shape could be inferred.
 */
public final class Field {

    private final String name;
    private final int typeOid;
    private final boolean nullable;
    private final int dims;
    private final StructuralType jsonType;

    public Field(String name, int typeOid, boolean nullable, int dims, StructuralType jsonType) {
        this.name = name;
        this.typeOid = typeOid;
        this.nullable = nullable;
        this.dims = dims;
        this.jsonType = jsonType;
    }

    public Field(String name, int typeOid, boolean nullable) {
        this(name, typeOid, nullable, 0, null);
    }

    public String getName() {
        return name;
    }

    public int getTypeOid() {
        return typeOid;
    }

    public boolean isNullable() {
        return nullable;
    }

    public int getDims() {
        return dims;
    }

    public StructuralType getJsonType() {
        return jsonType;
    }

    public Field withName(String name) {
        return new Field(name, typeOid, nullable, dims, jsonType);
    }

    public Field withNullable(boolean nullable) {
        return new Field(name, typeOid, nullable, dims, jsonType);
    }

    public Field withDims(int dims) {
        return new Field(name, typeOid, nullable, dims, jsonType);
    }

    public Field withType(int typeOid, int dims) {
        return new Field(name, typeOid, nullable, dims, jsonType);
    }

    public Field withJsonType(StructuralType jsonType) {
        return new Field(name, typeOid, nullable, dims, jsonType);
    }

    @Override
    public String toString() {
        return name + ":" + typeOid + "[]".repeat(dims) + (nullable ? "?" : "");
    }
}
