package org.dxworks.pgshape.parser;

import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.TypeName;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a type as written in DDL ({@code character varying(255)[]}, {@code public.mood},
 * {@code timestamp with time zone}) into a catalog-spelled {@link TypeName}.
 */
public final class TypeNameParser {

    private static final Pattern TRAILING_DIM = Pattern.compile("\\[\\s*\\d*\\s*]$");
    private static final Pattern TRAILING_ARRAY_KEYWORD = Pattern.compile("(?i)\\s+array(\\s*\\[\\s*\\d*\\s*])?$");

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("integer", "int4"),
            Map.entry("int", "int4"),
            Map.entry("serial", "int4"),
            Map.entry("serial4", "int4"),
            Map.entry("smallint", "int2"),
            Map.entry("smallserial", "int2"),
            Map.entry("serial2", "int2"),
            Map.entry("bigint", "int8"),
            Map.entry("bigserial", "int8"),
            Map.entry("serial8", "int8"),
            Map.entry("real", "float4"),
            Map.entry("float", "float8"),
            Map.entry("double precision", "float8"),
            Map.entry("double", "float8"),
            Map.entry("boolean", "bool"),
            Map.entry("decimal", "numeric"),
            Map.entry("character varying", "varchar"),
            Map.entry("char varying", "varchar"),
            Map.entry("character", "bpchar"),
            Map.entry("char", "bpchar"),
            Map.entry("timestamp with time zone", "timestamptz"),
            Map.entry("timestamp without time zone", "timestamp"),
            Map.entry("time with time zone", "timetz"),
            Map.entry("time without time zone", "time"),
            Map.entry("bit varying", "varbit")
    );

    private TypeNameParser() {
        // utility class
    }

    public static TypeName parse(String raw, String defaultSchema) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Empty type name");
        }
        String s = raw.trim();

        int dims = 0;
        Matcher arrayKeyword = TRAILING_ARRAY_KEYWORD.matcher(s);
        if (arrayKeyword.find()) {
            dims++;
            s = s.substring(0, arrayKeyword.start()).trim();
        }
        Matcher dim = TRAILING_DIM.matcher(s);
        while (dim.find()) {
            dims++;
            s = s.substring(0, dim.start()).trim();
            dim = TRAILING_DIM.matcher(s);
        }

        List<Integer> modifiers = new ArrayList<>();
        int open = s.indexOf('(');
        if (open >= 0) {
            int close = SqlTextUtils.findMatchingParen(s, open);
            if (close > open) {
                for (String mod : SqlTextUtils.splitTopLevel(s.substring(open + 1, close), ',')) {
                    try {
                        modifiers.add(Integer.parseInt(mod.trim()));
                    } catch (NumberFormatException ignored) {
                        // non-numeric modifiers (e.g. interval fields) carry no shape information
                    }
                }
                s = (s.substring(0, open) + " " + s.substring(close + 1)).trim();
            }
        }

        List<String> parts;
        if (s.indexOf('"') >= 0) {
            parts = SqlTextUtils.splitQualified(s);
        } else {
            parts = SqlTextUtils.splitQualified(s.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT));
        }

        String name = parts.get(parts.size() - 1);
        String schema = parts.size() > 1 ? parts.get(parts.size() - 2) : null;

        if (schema == null || BuiltinTypes.SCHEMA.equals(schema)) {
            String canonical = ALIASES.getOrDefault(name, name);
            if (BuiltinTypes.isBuiltin(canonical)) {
                return new TypeName(new Identifier(BuiltinTypes.SCHEMA, canonical), dims, modifiers);
            }
        }
        return new TypeName(new Identifier(schema != null ? schema : defaultSchema, name), dims, modifiers);
    }

    /**
     * Whether the text, as a whole, names a builtin type.
     */
    public static boolean isBuiltinTypeName(String raw) {
        try {
            return BuiltinTypes.SCHEMA.equals(parse(raw, Identifier.DEFAULT_SCHEMA).getId().getSchema());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
