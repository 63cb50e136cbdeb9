package org.dxworks.pgshape.parser;

import org.dxworks.pgshape.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a Postgres script into statements on top-level semicolons. Semicolons inside
 * string literals, quoted identifiers, comments and dollar-quoted bodies are ignored.
 * Each statement is tagged with the line of its first significant character. A
 * {@code BEGIN ATOMIC ... END} routine body is kept in one statement.
 */
public final class SqlStatementSplitter {

    private SqlStatementSplitter() {
        // utility class
    }

    public static List<SqlStatement> split(String sql, String file) {
        List<SqlStatement> statements = new ArrayList<>();
        if (sql == null) {
            return statements;
        }

        int line = 1;
        int start = -1;
        int atomicDepth = 0;
        int startLine = 1;
        int i = 0;
        int n = sql.length();

        while (i < n) {
            char c = sql.charAt(i);

            if (c == '\n') {
                line++;
                i++;
                continue;
            }
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                while (i < n && sql.charAt(i) != '\n') i++;
                continue;
            }
            if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                int stop = end < 0 ? n : end + 2;
                line += countLines(sql, i, stop);
                i = stop;
                continue;
            }
            if (c == ';' && atomicDepth == 0) {
                if (start >= 0) {
                    statements.add(new SqlStatement(sql.substring(start, i).trim(), new SourceSpan(file, startLine)));
                    start = -1;
                }
                i++;
                continue;
            }

            if (start < 0) {
                start = i;
                startLine = line;
            }

            int stop;
            if (c == '\'' || c == '"') {
                stop = skipQuoted(sql, i, c);
            } else if (c == '$') {
                stop = skipDollarQuoted(sql, i);
            } else if (Character.isLetter(c) || c == '_') {
                stop = wordEnd(sql, i);
                String word = sql.substring(i, stop);
                if (word.equalsIgnoreCase("atomic") && previousWordIs(sql, i, "begin")) {
                    atomicDepth++;
                } else if (atomicDepth > 0 && word.equalsIgnoreCase("case")) {
                    atomicDepth++;
                } else if (atomicDepth > 0 && word.equalsIgnoreCase("end")) {
                    atomicDepth--;
                }
            } else {
                stop = i + 1;
            }
            line += countLines(sql, i, stop);
            i = stop;
        }

        if (start >= 0) {
            String tail = sql.substring(start).trim();
            if (!tail.isEmpty()) {
                statements.add(new SqlStatement(tail, new SourceSpan(file, startLine)));
            }
        }
        return statements;
    }

    private static int skipQuoted(String sql, int open, char quote) {
        int i = open + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                // doubled quote is an escaped quote
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    /**
     * Skips a {@code $tag$ ... $tag$} literal. A lone {@code $} (e.g. a positional
     * parameter like {@code $1}) is consumed as a single character.
     */
    private static int skipDollarQuoted(String sql, int open) {
        int close = open + 1;
        while (close < sql.length()) {
            char ch = sql.charAt(close);
            if (ch == '$') break;
            if (!Character.isLetterOrDigit(ch) && ch != '_') return open + 1;
            close++;
        }
        if (close >= sql.length()) {
            return open + 1;
        }
        String tag = sql.substring(open, close + 1);
        if (tag.length() > 2 && Character.isDigit(tag.charAt(1))) {
            return open + 1;
        }
        int end = sql.indexOf(tag, close + 1);
        return end < 0 ? sql.length() : end + tag.length();
    }

    private static int wordEnd(String sql, int from) {
        int i = from;
        while (i < sql.length() && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_' || sql.charAt(i) == '$')) {
            i++;
        }
        return i;
    }

    private static boolean previousWordIs(String sql, int wordStart, String expected) {
        int end = wordStart;
        while (end > 0 && Character.isWhitespace(sql.charAt(end - 1))) end--;
        int begin = end;
        while (begin > 0 && Character.isLetter(sql.charAt(begin - 1))) begin--;
        return end > begin && sql.substring(begin, end).equalsIgnoreCase(expected);
    }

    private static int countLines(String sql, int from, int to) {
        int count = 0;
        for (int i = from; i < to && i < sql.length(); i++) {
            if (sql.charAt(i) == '\n') count++;
        }
        return count;
    }
}
