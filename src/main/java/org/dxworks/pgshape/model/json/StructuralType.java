package org.dxworks.pgshape.model.json;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.HexFormat;

/**
 * Shape of a JSON value produced by a SQL expression.
 * <p>
 * Identity is structural: {@link #contentHash()} covers the shape but not nullability,
 * object keys are hashed in sorted order and union member hashes are sorted before
 * being combined. Instances are immutable.
 */
public abstract class StructuralType {

    private String hash;

    public abstract boolean isNullable();

    public abstract StructuralType withNullable(boolean nullable);

    /**
     * Appends the hash input of this shape. Nullability never contributes.
     */
    protected abstract void appendCanonical(StringBuilder out);

    public final String contentHash() {
        if (hash == null) {
            StringBuilder sb = new StringBuilder();
            appendCanonical(sb);
            hash = sha256(sb.toString());
        }
        return hash;
    }

    /**
     * Two shapes are equal when their content matches and they agree on nullability.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructuralType)) return false;
        StructuralType that = (StructuralType) o;
        return isNullable() == that.isNullable() && contentHash().equals(that.contentHash());
    }

    @Override
    public int hashCode() {
        return contentHash().hashCode() * 31 + (isNullable() ? 1 : 0);
    }

    @Override
    public String toString() {
        return JsonTypeRenderer.render(this);
    }

    /**
     * Union of two optional shapes. Either side may be {@code null}, in which case the
     * other is returned. Nested unions are flattened and members with the same content
     * hash collapse into one, keeping the first occurrence and merging nullability.
     * A union left with a single member is that member.
     */
    public static StructuralType union(StructuralType left, StructuralType right) {
        if (left == null) return right;
        if (right == null) return left;
        List<StructuralType> members = new ArrayList<>();
        collect(left, members);
        collect(right, members);
        return UnionType.of(members);
    }

    static List<StructuralType> dedupe(List<StructuralType> members) {
        Map<String, StructuralType> unique = new LinkedHashMap<>();
        for (StructuralType member : members) {
            StructuralType existing = unique.get(member.contentHash());
            if (existing == null) {
                unique.put(member.contentHash(), member);
            } else if (member.isNullable() && !existing.isNullable()) {
                unique.put(member.contentHash(), existing.withNullable(true));
            }
        }
        return new ArrayList<>(unique.values());
    }

    private static void collect(StructuralType type, List<StructuralType> sink) {
        if (type instanceof UnionType) {
            sink.addAll(((UnionType) type).getMembers());
        } else {
            sink.add(type);
        }
    }

    static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
