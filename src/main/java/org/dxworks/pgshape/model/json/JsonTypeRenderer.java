package org.dxworks.pgshape.model.json;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders shapes as type declarations, e.g. {@code { id: number, tags: string[] } | null}.
 */
public final class JsonTypeRenderer {

    private static final Pattern PLAIN_KEY = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private JsonTypeRenderer() {
        // utility class
    }

    public static String render(StructuralType type) {
        return render(type, true);
    }

    public static String render(StructuralType type, boolean includeNulls) {
        if (type instanceof PrimitiveType) {
            return ((PrimitiveType) type).getCategory().getLabel() + nullSuffix(type, includeNulls);
        }
        if (type instanceof ArrayType) {
            StructuralType element = ((ArrayType) type).getElementType();
            String rendered = render(element, includeNulls);
            if (element instanceof UnionType || (includeNulls && element.isNullable())) {
                rendered = "(" + rendered + ")";
            }
            return rendered + "[]" + nullSuffix(type, includeNulls);
        }
        if (type instanceof ObjectType) {
            if (((ObjectType) type).getFields().isEmpty()) {
                return "{}" + nullSuffix(type, includeNulls);
            }
            StringBuilder sb = new StringBuilder("{ ");
            Iterator<Map.Entry<String, StructuralType>> it = ((ObjectType) type).getFields().entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, StructuralType> e = it.next();
                sb.append(key(e.getKey())).append(": ").append(render(e.getValue(), includeNulls));
                if (it.hasNext()) sb.append(", ");
            }
            return sb.append(" }").append(nullSuffix(type, includeNulls)).toString();
        }
        if (type instanceof UnionType) {
            StringBuilder sb = new StringBuilder();
            for (StructuralType member : ((UnionType) type).getMembers()) {
                if (sb.length() > 0) sb.append(" | ");
                // the union's own suffix covers its members; nested nullability still shows
                sb.append(render(member.withNullable(false), includeNulls));
            }
            return sb.append(nullSuffix(type, includeNulls)).toString();
        }
        throw new IllegalArgumentException("Unknown shape: " + type.getClass().getSimpleName());
    }

    /**
     * Object key, quoted unless it is a plain identifier.
     */
    public static String key(String name) {
        return PLAIN_KEY.matcher(name).matches() ? name : quote(name);
    }

    public static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String nullSuffix(StructuralType type, boolean includeNulls) {
        return includeNulls && type.isNullable() ? " | null" : "";
    }
}
