package org.dxworks.pgshape.parser;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import org.dxworks.pgshape.error.SchemaParseException;
import org.dxworks.pgshape.model.RoutineObject;

import java.util.List;

/**
 * Extracts the result query of a {@code LANGUAGE sql} routine: the last statement of its body.
 */
public final class RoutineBodyParser {

    private RoutineBodyParser() {
        // utility class
    }

    /**
     * @return the final SELECT of the body, or {@code null} if the routine has no SQL body
     *         or its body does not end in a SELECT
     * @throws SchemaParseException if the final statement cannot be parsed
     */
    public static Select resultQuery(RoutineObject routine) {
        if (!routine.isSqlLanguage() || routine.getBody() == null) {
            return null;
        }
        List<SqlStatement> statements = SqlStatementSplitter.split(routine.getBody(), null);
        if (statements.isEmpty()) {
            return null;
        }
        String last = SqlTextUtils.stripLeadingComments(statements.get(statements.size() - 1).text);
        if (last.regionMatches(true, 0, "return ", 0, 7)) {
            last = last.substring(7).trim();
        }
        String lower = last.toLowerCase();
        if (!lower.startsWith("select") && !lower.startsWith("with") && !lower.startsWith("(")) {
            return null;
        }
        Statement parsed;
        try {
            parsed = CCJSqlParserUtil.parse(last, p -> p.withAllowComplexParsing(true));
        } catch (JSQLParserException | RuntimeException e) {
            throw new SchemaParseException("Cannot parse routine body: " + e.getMessage(), routine.getSpan(), last, e);
        }
        return parsed instanceof Select ? (Select) parsed : null;
    }
}
