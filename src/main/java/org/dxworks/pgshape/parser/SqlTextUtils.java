package org.dxworks.pgshape.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class SqlTextUtils {

    private SqlTextUtils() {
        // utility class
    }

    public static String stripQuotes(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        if (trimmed.length() >= 2 && trimmed.charAt(0) == '"' && trimmed.charAt(trimmed.length() - 1) == '"') {
            return trimmed.substring(1, trimmed.length() - 1).replace("\"\"", "\"");
        }
        return trimmed;
    }

    /**
     * Postgres identifier folding: quoted identifiers keep their case, unquoted ones are lower-cased.
     */
    public static String normalizeIdentifier(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("\"")) {
            return stripQuotes(trimmed);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Splits a dotted name into normalized parts, honoring quoted parts that contain dots.
     */
    public static List<String> splitQualified(String raw) {
        List<String> parts = new ArrayList<>();
        if (raw == null) {
            return parts;
        }
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '"') {
                quoted = !quoted;
                current.append(c);
            } else if (c == '.' && !quoted) {
                parts.add(normalizeIdentifier(current.toString()));
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(normalizeIdentifier(current.toString()));
        }
        return parts;
    }

    /**
     * Index of the parenthesis closing the one at {@code openIdx}, skipping string literals
     * and quoted identifiers, or -1.
     */
    public static int findMatchingParen(String text, int openIdx) {
        if (text == null || openIdx < 0 || openIdx >= text.length()) {
            return -1;
        }
        int depth = 0;
        char quote = 0;
        for (int i = openIdx; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        if (text == null) {
            return parts;
        }
        int depth = 0;
        char quote = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                current.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == '(') {
                depth++;
                current.append(c);
            } else if (c == ')') {
                depth--;
                current.append(c);
            } else if (c == separator && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.toString().trim().length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }

    /**
     * Leading line and block comments removed, used to classify a statement by its head.
     */
    public static String stripLeadingComments(String sql) {
        String s = sql;
        while (true) {
            s = s.stripLeading();
            if (s.startsWith("--")) {
                int nl = s.indexOf('\n');
                s = nl < 0 ? "" : s.substring(nl + 1);
            } else if (s.startsWith("/*")) {
                int end = s.indexOf("*/");
                s = end < 0 ? "" : s.substring(end + 2);
            } else {
                return s;
            }
        }
    }
}
