package org.dxworks.pgshape.infer;

import org.dxworks.pgshape.error.RelationNotFoundException;
import org.dxworks.pgshape.error.UnknownTypeException;
import org.dxworks.pgshape.error.UnsupportedConstructException;
import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.TypeName;
import org.dxworks.pgshape.parser.SqlTextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names visible while inferring one SELECT.
 * <p>
 * A scope owns its range references (FROM items) and the CTEs declared by its WITH
 * clause. A forked scope starts with no references of its own; it sees the CTEs of its
 * ancestors and shares their type-name cache, but never their references.
 */
public class InferenceScope {

    private final MetadataResolver metadata;
    private final List<String> searchPath;
    private final InferenceScope parent;
    private final Map<Integer, TypeName> typeNames;
    private final Map<String, RelationBinding> references = new LinkedHashMap<>();
    private final Map<String, RelationBinding> ctes = new LinkedHashMap<>();
    private final Map<String, Field> parameters = new LinkedHashMap<>();

    public InferenceScope(MetadataResolver metadata, List<String> searchPath) {
        this(metadata, searchPath, null, new HashMap<>());
    }

    private InferenceScope(MetadataResolver metadata, List<String> searchPath, InferenceScope parent,
                           Map<Integer, TypeName> typeNames) {
        this.metadata = metadata;
        this.searchPath = List.copyOf(searchPath);
        this.parent = parent;
        this.typeNames = typeNames;
    }

    public InferenceScope fork() {
        return new InferenceScope(metadata, searchPath, this, typeNames);
    }

    public MetadataResolver getMetadata() {
        return metadata;
    }

    public Map<String, RelationBinding> getReferences() {
        return Collections.unmodifiableMap(references);
    }

    public RelationBinding getReference(String name) {
        return references.get(name);
    }

    public void bind(String name, RelationBinding relation, String construct) {
        if (references.containsKey(name)) {
            throw new UnsupportedConstructException("Table name \"" + name + "\" specified more than once", construct);
        }
        references.put(name, relation);
    }

    void rebind(String name, RelationBinding relation) {
        references.replace(name, relation);
    }

    public void defineCte(String name, RelationBinding relation) {
        ctes.put(name, relation);
    }

    /**
     * CTE visible under {@code name}, looking outwards through enclosing scopes.
     */
    public RelationBinding findCte(String name) {
        for (InferenceScope scope = this; scope != null; scope = scope.parent) {
            RelationBinding cte = scope.ctes.get(name);
            if (cte != null) return cte;
        }
        return null;
    }

    /**
     * Declares the named parameters of the routine whose body is inferred in this scope.
     */
    public void defineParameters(List<Field> fields) {
        for (Field field : fields) {
            if (field.getName() != null) {
                parameters.put(field.getName(), field);
            }
        }
    }

    public Field findParameter(String name) {
        for (InferenceScope scope = this; scope != null; scope = scope.parent) {
            Field parameter = scope.parameters.get(name);
            if (parameter != null) return parameter;
        }
        return null;
    }

    /**
     * Fields addressable by bare name: every field of every bound relation, except names
     * exposed by more than one relation (or twice by the same one).
     */
    public Map<String, Field> uniqueFields() {
        Map<String, Field> unique = new LinkedHashMap<>();
        Set<String> duplicates = new HashSet<>();
        for (RelationBinding relation : references.values()) {
            for (Field field : relation.getFields()) {
                if (unique.containsKey(field.getName())) {
                    duplicates.add(field.getName());
                } else {
                    unique.put(field.getName(), field);
                }
            }
        }
        for (String duplicate : duplicates) {
            unique.remove(duplicate);
        }
        return unique;
    }

    /**
     * Table or view named by a possibly unqualified name; unqualified names go through the search path.
     */
    public RelationBinding resolveRelation(String qualifiedName, String construct) {
        List<Identifier> candidates = candidates(qualifiedName);
        for (Identifier candidate : candidates) {
            try {
                return metadata.resolveRelation(candidate);
            } catch (RelationNotFoundException e) {
                // a failure located inside a view body is not about this name
                if (e.getObjectId() != null) throw e;
            }
        }
        throw new RelationNotFoundException(candidates.size() == 1 ? candidates.get(0).toString() : qualifiedName, construct);
    }

    /**
     * Row type named by a possibly unqualified name, or {@code null}.
     */
    public List<Field> resolveRowType(TypeName type) {
        return metadata.resolveRowType(type.getId());
    }

    public Field getReturnType(String qualifiedName, List<Field> args, String construct) {
        List<Identifier> candidates = candidates(qualifiedName);
        UnknownTypeException last = null;
        for (Identifier candidate : candidates) {
            try {
                return metadata.getReturnType(candidate, args);
            } catch (UnknownTypeException e) {
                last = e;
            }
        }
        throw new UnknownTypeException(last != null ? last.getMessage() : "Unknown function: " + qualifiedName, construct);
    }

    public TypeName getTypeName(int oid) {
        TypeName cached = typeNames.get(oid);
        if (cached == null) {
            cached = metadata.getTypeName(oid);
            typeNames.put(oid, cached);
        }
        return cached;
    }

    public int getTypeOid(TypeName type) {
        return metadata.getTypeOid(type);
    }

    public String getDefaultSchema() {
        return searchPath.get(0);
    }

    private List<Identifier> candidates(String qualifiedName) {
        List<String> parts = SqlTextUtils.splitQualified(qualifiedName);
        List<Identifier> candidates = new ArrayList<>();
        if (parts.size() > 1) {
            candidates.add(new Identifier(parts.get(parts.size() - 2), parts.get(parts.size() - 1)));
        } else {
            for (String schema : searchPath) {
                candidates.add(new Identifier(schema, parts.get(0)));
            }
        }
        return candidates;
    }
}
