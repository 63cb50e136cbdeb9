package org.dxworks.pgshape.parser;

import org.dxworks.pgshape.model.ColumnDefinition;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.ParameterDefinition;
import org.dxworks.pgshape.model.RoutineObject;
import org.dxworks.pgshape.model.SourceSpan;
import org.dxworks.pgshape.model.TypeName;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code CREATE [OR REPLACE] FUNCTION|PROCEDURE} statements from their text.
 * Extracts name, parameters, return type or column list, language and body.
 */
final class RoutineSignatureParser {

    private static final Pattern HEAD = Pattern.compile(
            "(?is)^\\s*create\\s+(?:or\\s+replace\\s+)?(function|procedure)\\s+((?:\"[^\"]+\"|[\\w$]+)(?:\\s*\\.\\s*(?:\"[^\"]+\"|[\\w$]+))?)\\s*\\(");
    private static final Pattern DOLLAR_BODY = Pattern.compile("(?s)\\bAS\\s+(\\$[A-Za-z_]*\\$)(.*?)\\1", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED_BODY = Pattern.compile("(?s)\\bAS\\s+'((?:[^']|'')*)'", Pattern.CASE_INSENSITIVE);
    private static final Pattern ATOMIC_BODY = Pattern.compile("(?is)\\bBEGIN\\s+ATOMIC\\b(.*)\\bEND\\s*$");
    private static final Pattern LANGUAGE = Pattern.compile("(?i)\\bLANGUAGE\\s+'?([\\w]+)'?");
    private static final Pattern RETURNS_TABLE = Pattern.compile("(?i)\\bRETURNS\\s+TABLE\\s*\\(");
    private static final Pattern RETURNS = Pattern.compile("(?i)\\bRETURNS\\s+(SETOF\\s+)?");
    private static final Pattern RETURN_TYPE_END = Pattern.compile(
            "(?i)\\s(?:LANGUAGE|AS|IMMUTABLE|STABLE|VOLATILE|STRICT|CALLED|RETURNS\\s+NULL|SECURITY|EXTERNAL|PARALLEL|COST|ROWS|SUPPORT|SET|WINDOW|LEAKPROOF|NOT\\s+LEAKPROOF|TRANSFORM|BEGIN)\\b");

    private RoutineSignatureParser() {
        // utility class
    }

    static boolean matches(String statement) {
        return HEAD.matcher(statement).find();
    }

    static RoutineObject parse(String statement, SourceSpan span, String defaultSchema) {
        String s = statement.trim();
        Matcher m = HEAD.matcher(s);
        if (!m.find()) {
            throw new IllegalArgumentException("Not a routine declaration");
        }
        boolean procedure = "procedure".equalsIgnoreCase(m.group(1));
        Identifier id = toIdentifier(m.group(2), defaultSchema);

        int startParams = m.end() - 1;
        int endParams = SqlTextUtils.findMatchingParen(s, startParams);
        if (endParams < 0) {
            throw new IllegalArgumentException("Unbalanced parameter list");
        }

        List<ParameterDefinition> params = new ArrayList<>();
        List<ColumnDefinition> returnColumns = new ArrayList<>();
        for (String p : SqlTextUtils.splitTopLevel(s.substring(startParams + 1, endParams), ',')) {
            ParameterDefinition param = parseParameter(p, defaultSchema);
            if (param.isInput()) {
                params.add(param);
            }
            if (param.isOutput()) {
                returnColumns.add(new ColumnDefinition(param.name, param.type, true));
            }
        }

        // Everything after the parameter list, with the body cut out so that keywords
        // inside the body are not mistaken for routine options.
        String tail = s.substring(endParams + 1);
        String body = null;
        Matcher bm = DOLLAR_BODY.matcher(tail);
        if (bm.find()) {
            body = bm.group(2);
            tail = tail.substring(0, bm.start()) + " " + tail.substring(bm.end());
        } else {
            Matcher qm = QUOTED_BODY.matcher(tail);
            if (qm.find()) {
                body = qm.group(1).replace("''", "'");
                tail = tail.substring(0, qm.start()) + " " + tail.substring(qm.end());
            } else {
                Matcher am = ATOMIC_BODY.matcher(tail);
                if (am.find()) {
                    body = am.group(1);
                    tail = tail.substring(0, am.start());
                }
            }
        }

        Matcher lm = LANGUAGE.matcher(tail);
        String language = lm.find() ? lm.group(1).toLowerCase(Locale.ROOT) : (body == null ? null : "sql");

        TypeName returnType = null;
        boolean returnSet = false;
        if (!procedure) {
            Matcher tm = RETURNS_TABLE.matcher(tail);
            if (tm.find()) {
                returnSet = true;
                int open = tm.end() - 1;
                int close = SqlTextUtils.findMatchingParen(tail, open);
                if (close < 0) {
                    throw new IllegalArgumentException("Unbalanced RETURNS TABLE column list");
                }
                returnColumns.clear();
                for (String col : SqlTextUtils.splitTopLevel(tail.substring(open + 1, close), ',')) {
                    ParameterDefinition column = parseParameter(col, defaultSchema);
                    returnColumns.add(new ColumnDefinition(column.name, column.type, true));
                }
            } else {
                Matcher rm = RETURNS.matcher(tail);
                if (rm.find()) {
                    returnSet = rm.group(1) != null;
                    String rest = tail.substring(rm.end());
                    Matcher end = RETURN_TYPE_END.matcher(" " + rest);
                    String typeText = end.find() ? rest.substring(0, Math.max(0, end.start() - 1)) : rest;
                    TypeName declared = TypeNameParser.parse(typeText, defaultSchema);
                    // with OUT parameters, RETURNS only restates the row type
                    if (returnColumns.isEmpty()) {
                        returnType = declared;
                    }
                }
            }
        }

        return new RoutineObject(id, span, params, returnType, returnColumns, returnSet, procedure,
                language, "sql".equals(language) ? body : null);
    }

    private static ParameterDefinition parseParameter(String raw, String defaultSchema) {
        String pt = stripDefault(raw.trim());
        ParameterDefinition pd = new ParameterDefinition();

        String lower = pt.toLowerCase(Locale.ROOT);
        if (lower.startsWith("out ")) { pd.mode = ParameterDefinition.Mode.OUT; pt = pt.substring(4).trim(); }
        else if (lower.startsWith("inout ")) { pd.mode = ParameterDefinition.Mode.INOUT; pt = pt.substring(6).trim(); }
        else if (lower.startsWith("variadic ")) { pd.mode = ParameterDefinition.Mode.VARIADIC; pt = pt.substring(9).trim(); }
        else if (lower.startsWith("in ")) { pd.mode = ParameterDefinition.Mode.IN; pt = pt.substring(3).trim(); }

        String[] toks = pt.split("\\s+", 2);
        if (toks.length == 1 || TypeNameParser.isBuiltinTypeName(pt)) {
            pd.type = TypeNameParser.parse(pt, defaultSchema);
        } else {
            pd.name = SqlTextUtils.normalizeIdentifier(toks[0]);
            pd.type = TypeNameParser.parse(toks[1], defaultSchema);
        }
        return pd;
    }

    private static String stripDefault(String param) {
        Matcher m = Pattern.compile("(?i)\\s+default\\s+|\\s*=\\s*").matcher(param);
        return m.find() ? param.substring(0, m.start()).trim() : param;
    }

    private static Identifier toIdentifier(String qualified, String defaultSchema) {
        List<String> parts = SqlTextUtils.splitQualified(qualified.replaceAll("\\s+", ""));
        return parts.size() > 1
                ? new Identifier(parts.get(0), parts.get(1))
                : new Identifier(defaultSchema, parts.get(0));
    }
}
