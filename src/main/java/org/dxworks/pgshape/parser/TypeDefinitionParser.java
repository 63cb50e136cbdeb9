package org.dxworks.pgshape.parser;

import org.dxworks.pgshape.model.ColumnDefinition;
import org.dxworks.pgshape.model.CompositeTypeObject;
import org.dxworks.pgshape.model.EnumTypeObject;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.SchemaObject;
import org.dxworks.pgshape.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code CREATE TYPE name AS (...)} and {@code CREATE TYPE name AS ENUM (...)}.
 * Other {@code CREATE TYPE} forms (range, base, shell types) are not recognized.
 */
final class TypeDefinitionParser {

    private static final Pattern HEAD = Pattern.compile(
            "(?is)^\\s*create\\s+type\\s+((?:\"[^\"]+\"|[\\w$]+)(?:\\s*\\.\\s*(?:\"[^\"]+\"|[\\w$]+))?)\\s+as\\s*(enum\\s*)?\\(");
    private static final Pattern COLLATE = Pattern.compile("(?i)\\s+collate\\s+.*$");

    private TypeDefinitionParser() {
        // utility class
    }

    static boolean matches(String statement) {
        return HEAD.matcher(statement).find();
    }

    static SchemaObject parse(String statement, SourceSpan span, String defaultSchema) {
        String s = statement.trim();
        Matcher m = HEAD.matcher(s);
        if (!m.find()) {
            throw new IllegalArgumentException("Not a composite or enum type declaration");
        }
        List<String> nameParts = SqlTextUtils.splitQualified(m.group(1).replaceAll("\\s+", ""));
        Identifier id = nameParts.size() > 1
                ? new Identifier(nameParts.get(0), nameParts.get(1))
                : new Identifier(defaultSchema, nameParts.get(0));

        int open = m.end() - 1;
        int close = SqlTextUtils.findMatchingParen(s, open);
        if (close < 0) {
            throw new IllegalArgumentException("Unbalanced type body");
        }
        List<String> items = SqlTextUtils.splitTopLevel(s.substring(open + 1, close), ',');

        if (m.group(2) != null) {
            List<String> labels = new ArrayList<>();
            for (String item : items) {
                String label = item.trim();
                if (label.length() >= 2 && label.startsWith("'") && label.endsWith("'")) {
                    label = label.substring(1, label.length() - 1).replace("''", "'");
                }
                labels.add(label);
            }
            return new EnumTypeObject(id, span, labels);
        }

        List<ColumnDefinition> attributes = new ArrayList<>();
        for (String item : items) {
            String attr = COLLATE.matcher(item.trim()).replaceFirst("");
            String[] toks = attr.split("\\s+", 2);
            if (toks.length < 2) {
                throw new IllegalArgumentException("Attribute without type: " + attr);
            }
            attributes.add(new ColumnDefinition(SqlTextUtils.normalizeIdentifier(toks[0]),
                    TypeNameParser.parse(toks[1], defaultSchema), true));
        }
        return new CompositeTypeObject(id, span, attributes);
    }
}
