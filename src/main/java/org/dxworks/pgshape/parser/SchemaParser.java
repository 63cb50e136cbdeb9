package org.dxworks.pgshape.parser;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.UnsupportedStatement;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.view.CreateView;
import org.dxworks.pgshape.error.SchemaParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Reads schema sources into {@link org.dxworks.pgshape.model.SchemaObject}s.
 * <p>
 * Tables and views go through JSqlParser. Composite/enum types and routines are
 * parsed from their text since JSqlParser does not model them. Statements that
 * declare nothing of interest (indexes, grants, comments, ...) are skipped.
 */
public class SchemaParser {

    private static final Pattern SKIPPED_HEAD = Pattern.compile(
            "(?is)^(?:create\\s+(?:unique\\s+)?index"
                    + "|create\\s+(?:or\\s+replace\\s+)?(?:constraint\\s+)?(?:trigger|rule|policy|aggregate|operator|cast|event\\s+trigger)"
                    + "|create\\s+(?:extension|schema|sequence|domain|role|user|group|publication|subscription|type|collation|server|foreign"
                    + "|database|tablespace|statistics|conversion|transform|text\\s+search|access\\s+method)"
                    + "|create\\s+(?:or\\s+replace\\s+)?(?:trusted\\s+)?(?:procedural\\s+)?language"
                    + "|alter|drop|comment|grant|revoke|insert|update|delete|set|select|do|begin|commit|end|rollback"
                    + "|analyze|vacuum|truncate|copy|refresh|notify|reset|discard|call)\\b");

    private static final Pattern RELATION_HEAD = Pattern.compile(
            "(?is)^create\\s+(?:or\\s+replace\\s+)?(?:(?:global|local)\\s+)?"
                    + "(?:(?:temp|temporary|unlogged|materialized|recursive)\\s+)?(?:table|view)\\b");

    private final String defaultSchema;
    private final DdlStatementHandler ddlHandler;

    public SchemaParser(String defaultSchema) {
        this.defaultSchema = defaultSchema;
        this.ddlHandler = new DdlStatementHandler(defaultSchema);
    }

    public ParsedSchema parseFile(Path file, String displayName) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), displayName);
    }

    public ParsedSchema parse(String sql, String file) {
        ParsedSchema out = new ParsedSchema();
        for (SqlStatement statement : SqlStatementSplitter.split(sql, file)) {
            parseStatement(statement, out);
        }
        return out;
    }

    private void parseStatement(SqlStatement statement, ParsedSchema out) {
        String head = SqlTextUtils.stripLeadingComments(statement.text);
        try {
            if (RoutineSignatureParser.matches(head)) {
                out.objects.add(RoutineSignatureParser.parse(head, statement.span, defaultSchema));
                return;
            }
            if (TypeDefinitionParser.matches(head)) {
                out.objects.add(TypeDefinitionParser.parse(head, statement.span, defaultSchema));
                return;
            }
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException("Cannot parse statement: " + e.getMessage(), statement.span, firstLine(head), e);
        }
        if (SKIPPED_HEAD.matcher(head).find()) {
            out.skipped.add(statement);
            return;
        }

        Statement parsed;
        try {
            parsed = CCJSqlParserUtil.parse(head, p -> p.withAllowComplexParsing(true));
        } catch (JSQLParserException | RuntimeException e) {
            throw new SchemaParseException("Cannot parse statement: " + rootMessage(e), statement.span, firstLine(head), e);
        }

        // complex parsing hands back malformed DDL as an UnsupportedStatement
        if (parsed instanceof UnsupportedStatement) {
            throw new SchemaParseException("Cannot parse statement: unrecognized syntax", statement.span, firstLine(head), null);
        }
        if (parsed instanceof CreateTable) {
            out.objects.add(ddlHandler.handleCreateTable((CreateTable) parsed, statement));
        } else if (parsed instanceof CreateView) {
            out.objects.add(ddlHandler.handleCreateView((CreateView) parsed, statement));
        } else if (RELATION_HEAD.matcher(head).find()) {
            throw new SchemaParseException("Cannot parse statement: expected CREATE TABLE or CREATE VIEW, got "
                    + parsed.getClass().getSimpleName(), statement.span, firstLine(head), null);
        } else {
            out.skipped.add(statement);
        }
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl).trim();
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null) {
            return root.getClass().getSimpleName();
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
