package org.dxworks.pgshape.infer;

import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.TypeName;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Memoizes successful lookups of another resolver for the duration of one analysis run.
 * Failures are not cached.
 */
public class CachingMetadataResolver implements MetadataResolver {

    private final MetadataResolver delegate;
    private final Map<Identifier, RelationBinding> relations = new HashMap<>();
    private final Map<Identifier, List<Field>> rowTypes = new HashMap<>();
    private final Map<Integer, TypeName> typeNames = new HashMap<>();
    private final Map<TypeName, Integer> typeOids = new HashMap<>();
    private final Map<String, Field> returnTypes = new HashMap<>();

    public CachingMetadataResolver(MetadataResolver delegate) {
        this.delegate = delegate;
    }

    @Override
    public RelationBinding resolveRelation(Identifier id) {
        RelationBinding cached = relations.get(id);
        if (cached == null) {
            cached = delegate.resolveRelation(id);
            relations.put(id, cached);
        }
        return cached;
    }

    @Override
    public List<Field> resolveRowType(Identifier id) {
        if (rowTypes.containsKey(id)) {
            return rowTypes.get(id);
        }
        List<Field> fields = delegate.resolveRowType(id);
        rowTypes.put(id, fields);
        return fields;
    }

    @Override
    public TypeName getTypeName(int oid) {
        TypeName cached = typeNames.get(oid);
        if (cached == null) {
            cached = delegate.getTypeName(oid);
            typeNames.put(oid, cached);
        }
        return cached;
    }

    @Override
    public int getTypeOid(TypeName type) {
        TypeName key = type.elementType();
        Integer cached = typeOids.get(key);
        if (cached == null) {
            cached = delegate.getTypeOid(key);
            typeOids.put(key, cached);
        }
        return cached;
    }

    @Override
    public Field getReturnType(Identifier function, List<Field> args) {
        StringBuilder key = new StringBuilder(function.toString()).append('(');
        for (Field arg : args) {
            key.append(arg.getTypeOid()).append("[]".repeat(arg.getDims())).append(arg.isNullable() ? "?" : "").append(',');
        }
        String signature = key.append(')').toString();
        Field cached = returnTypes.get(signature);
        if (cached == null) {
            cached = delegate.getReturnType(function, args);
            returnTypes.put(signature, cached);
        }
        return cached;
    }
}
