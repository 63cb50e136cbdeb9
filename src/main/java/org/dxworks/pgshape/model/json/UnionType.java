package org.dxworks.pgshape.model.json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Union of two or more distinct non-union shapes. Build through
 * {@link StructuralType#union(StructuralType, StructuralType)} or {@link #of(List)}.
 */
public final class UnionType extends StructuralType {

    private final List<StructuralType> members;

    private UnionType(List<StructuralType> members) {
        this.members = Collections.unmodifiableList(members);
    }

    /**
     * Flattens nested unions and removes duplicates. Returns the sole member when only
     * one remains.
     */
    public static StructuralType of(List<StructuralType> candidates) {
        List<StructuralType> flat = new ArrayList<>();
        for (StructuralType candidate : candidates) {
            if (candidate instanceof UnionType) {
                flat.addAll(((UnionType) candidate).members);
            } else if (candidate != null) {
                flat.add(candidate);
            }
        }
        List<StructuralType> unique = dedupe(flat);
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("A union needs at least one member");
        }
        return unique.size() == 1 ? unique.get(0) : new UnionType(unique);
    }

    public List<StructuralType> getMembers() {
        return members;
    }

    @Override
    public boolean isNullable() {
        for (StructuralType member : members) {
            if (member.isNullable()) return true;
        }
        return false;
    }

    /**
     * Nullability of a union is carried by its members; making it nullable marks the
     * first member nullable, making it non-null clears every member.
     */
    @Override
    public UnionType withNullable(boolean nullable) {
        if (nullable == isNullable()) return this;
        List<StructuralType> updated = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            StructuralType member = members.get(i);
            updated.add(nullable ? (i == 0 ? member.withNullable(true) : member) : member.withNullable(false));
        }
        return new UnionType(updated);
    }

    @Override
    protected void appendCanonical(StringBuilder out) {
        List<String> hashes = new ArrayList<>(members.size());
        for (StructuralType member : members) {
            hashes.add(member.contentHash());
        }
        Collections.sort(hashes);
        out.append(String.join("|", hashes));
    }
}
