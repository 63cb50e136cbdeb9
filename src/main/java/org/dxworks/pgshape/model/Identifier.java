package org.dxworks.pgshape.model;

import java.util.Objects;

/**
 * Schema-qualified name of a catalog object. A missing schema defaults to {@code public}.
 * Ordering is by schema, then name, using plain string comparison.
 */
public final class Identifier implements Comparable<Identifier> {

    public static final String DEFAULT_SCHEMA = "public";

    private final String schema;
    private final String name;

    public Identifier(String schema, String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Identifier name must not be empty");
        }
        this.schema = schema == null || schema.isEmpty() ? DEFAULT_SCHEMA : schema;
        this.name = name;
    }

    public static Identifier of(String name) {
        return new Identifier(null, name);
    }

    /**
     * Parses {@code name} or {@code schema.name}. Quoting is expected to be resolved already.
     */
    public static Identifier parse(String qualified, String defaultSchema) {
        int dot = qualified.lastIndexOf('.');
        if (dot <= 0) {
            return new Identifier(defaultSchema, qualified);
        }
        return new Identifier(qualified.substring(0, dot), qualified.substring(dot + 1));
    }

    public String getSchema() {
        return schema;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(Identifier other) {
        int bySchema = schema.compareTo(other.schema);
        return bySchema != 0 ? bySchema : name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier)) return false;
        Identifier that = (Identifier) o;
        return schema.equals(that.schema) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, name);
    }

    @Override
    public String toString() {
        return schema + "." + name;
    }
}
