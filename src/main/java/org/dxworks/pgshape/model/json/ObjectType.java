package org.dxworks.pgshape.model.json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Object shape. Fields keep declaration order for rendering, but the content hash
 * uses sorted keys.
 */
public final class ObjectType extends StructuralType {

    private final Map<String, StructuralType> fields;
    private final boolean nullable;

    public ObjectType(Map<String, StructuralType> fields, boolean nullable) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.nullable = nullable;
    }

    public Map<String, StructuralType> getFields() {
        return fields;
    }

    @Override
    public boolean isNullable() {
        return nullable;
    }

    @Override
    public ObjectType withNullable(boolean nullable) {
        return nullable == this.nullable ? this : new ObjectType(fields, nullable);
    }

    @Override
    protected void appendCanonical(StringBuilder out) {
        List<String> keys = new ArrayList<>(fields.keySet());
        Collections.sort(keys);
        out.append('#');
        for (String key : keys) {
            // length prefix keeps keys containing separators apart
            out.append(key.length()).append('"').append(key).append(':');
            fields.get(key).appendCanonical(out);
            out.append(',');
        }
        out.append('}');
    }
}
