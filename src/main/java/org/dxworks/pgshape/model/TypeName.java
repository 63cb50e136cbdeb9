package org.dxworks.pgshape.model;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a SQL type by name, e.g. {@code pg_catalog.int4} or {@code public.mood[]}.
 */
public final class TypeName {

    private final Identifier id;
    private final int arrayDims;
    private final List<Integer> modifiers;

    public TypeName(Identifier id, int arrayDims, List<Integer> modifiers) {
        this.id = Objects.requireNonNull(id, "id");
        this.arrayDims = arrayDims;
        this.modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    }

    public TypeName(Identifier id) {
        this(id, 0, List.of());
    }

    public static TypeName builtin(String name) {
        return new TypeName(new Identifier("pg_catalog", name));
    }

    public Identifier getId() {
        return id;
    }

    public int getArrayDims() {
        return arrayDims;
    }

    public List<Integer> getModifiers() {
        return modifiers;
    }

    public boolean isArray() {
        return arrayDims > 0;
    }

    public TypeName elementType() {
        return arrayDims == 0 ? this : new TypeName(id, 0, modifiers);
    }

    public TypeName withArrayDims(int dims) {
        return new TypeName(id, dims, modifiers);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeName)) return false;
        TypeName that = (TypeName) o;
        return arrayDims == that.arrayDims && id.equals(that.id) && modifiers.equals(that.modifiers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, arrayDims, modifiers);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(id.toString());
        if (!modifiers.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < modifiers.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(modifiers.get(i));
            }
            sb.append(')');
        }
        sb.append("[]".repeat(arrayDims));
        return sb.toString();
    }
}
