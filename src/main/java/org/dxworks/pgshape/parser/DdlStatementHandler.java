package org.dxworks.pgshape.parser;

import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.table.ForeignKeyIndex;
import net.sf.jsqlparser.statement.create.table.Index;
import net.sf.jsqlparser.statement.create.view.CreateView;
import org.dxworks.pgshape.model.ColumnDefinition;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.TableObject;
import org.dxworks.pgshape.model.ViewObject;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles DDL statements parsed by JSqlParser: CREATE TABLE and CREATE [MATERIALIZED] VIEW.
 */
final class DdlStatementHandler {

    private static final Pattern MATERIALIZED = Pattern.compile("(?is)^\\s*create\\s+(?:or\\s+replace\\s+)?materialized\\s+view\\b");
    private static final Pattern VIEW_COLUMNS = Pattern.compile(
            "(?is)^\\s*create\\s+(?:or\\s+replace\\s+)?(?:materialized\\s+)?(?:recursive\\s+)?view\\s+(?:if\\s+not\\s+exists\\s+)?(?:\"[^\"]+\"|[\\w$]+)(?:\\s*\\.\\s*(?:\"[^\"]+\"|[\\w$]+))?\\s*\\(");

    private final String defaultSchema;

    DdlStatementHandler(String defaultSchema) {
        this.defaultSchema = defaultSchema;
    }

    TableObject handleCreateTable(CreateTable ct, SqlStatement statement) {
        Identifier id = toIdentifier(ct.getTable());
        List<ColumnDefinition> columns = new ArrayList<>();
        Set<Identifier> refs = new LinkedHashSet<>();
        Set<String> primaryKeys = new LinkedHashSet<>();

        // Table-level constraints first, so primary key columns can be marked non-null
        List<Index> indexes = ct.getIndexes();
        if (indexes != null) {
            for (Index idx : indexes) {
                String type = idx.getType();
                if (type != null && type.equalsIgnoreCase("primary key")) {
                    for (String col : safeList(idx.getColumnsNames())) {
                        primaryKeys.add(SqlTextUtils.normalizeIdentifier(col));
                    }
                }
                if (idx instanceof ForeignKeyIndex) {
                    Table ref = ((ForeignKeyIndex) idx).getTable();
                    if (ref != null) {
                        refs.add(toIdentifier(ref));
                    }
                }
            }
        }

        List<net.sf.jsqlparser.statement.create.table.ColumnDefinition> cols = ct.getColumnDefinitions();
        if (cols != null) {
            for (net.sf.jsqlparser.statement.create.table.ColumnDefinition cd : cols) {
                ColumnDefinition column = new ColumnDefinition();
                column.name = SqlTextUtils.normalizeIdentifier(cd.getColumnName());
                column.type = TypeNameParser.parse(cd.getColDataType().toString(), defaultSchema);

                List<String> specs = normalize(cd.getColumnSpecs());
                if (containsSequence(specs, "not", "null") || specs.contains("not null")
                        || containsSequence(specs, "primary", "key")
                        || primaryKeys.contains(column.name)) {
                    column.nullable = false;
                }
                int defaultIdx = specs.indexOf("default");
                if (defaultIdx >= 0 && defaultIdx + 1 < specs.size()) {
                    column.defaultExpression = specs.get(defaultIdx + 1);
                }
                int refIdx = specs.indexOf("references");
                if (refIdx >= 0 && refIdx + 1 < specs.size()) {
                    refs.add(referencedTable(cd.getColumnSpecs().get(refIdx + 1)));
                }
                columns.add(column);
            }
        }

        return new TableObject(id, statement.span, columns, new ArrayList<>(refs));
    }

    ViewObject handleCreateView(CreateView cv, SqlStatement statement) {
        Identifier id = toIdentifier(cv.getView());
        boolean materialized = MATERIALIZED.matcher(statement.text).find();
        List<Identifier> refs = ViewReferenceCollector.collect(cv.getSelect(), id.getSchema());
        return new ViewObject(id, statement.span, cv.getSelect(), cv.getSelect().toString(),
                materialized, columnNames(statement.text), refs);
    }

    private List<String> columnNames(String text) {
        List<String> names = new ArrayList<>();
        Matcher m = VIEW_COLUMNS.matcher(text);
        if (m.find()) {
            int open = m.end() - 1;
            int close = SqlTextUtils.findMatchingParen(text, open);
            if (close > open) {
                for (String name : SqlTextUtils.splitTopLevel(text.substring(open + 1, close), ',')) {
                    names.add(SqlTextUtils.normalizeIdentifier(name));
                }
            }
        }
        return names;
    }

    /**
     * The token after REFERENCES may carry the column list, e.g. {@code users(id)}.
     */
    private Identifier referencedTable(String token) {
        String name = token;
        int paren = name.indexOf('(');
        if (paren >= 0) {
            name = name.substring(0, paren);
        }
        List<String> parts = SqlTextUtils.splitQualified(name.trim());
        return parts.size() > 1
                ? new Identifier(parts.get(0), parts.get(1))
                : new Identifier(defaultSchema, parts.get(0));
    }

    private Identifier toIdentifier(Table table) {
        String schema = table.getSchemaName() != null ? SqlTextUtils.normalizeIdentifier(table.getSchemaName()) : defaultSchema;
        return new Identifier(schema, SqlTextUtils.normalizeIdentifier(table.getName()));
    }

    private static List<String> normalize(List<String> specs) {
        List<String> out = new ArrayList<>();
        if (specs == null) return out;
        for (String s : specs) {
            if (s != null) out.add(s.toLowerCase(Locale.ROOT));
        }
        return out;
    }

    private static boolean containsSequence(List<String> list, String a, String b) {
        for (int i = 0; i + 1 < list.size(); i++) {
            if (a.equals(list.get(i)) && b.equals(list.get(i + 1))) {
                return true;
            }
        }
        return false;
    }

    private static <T> List<T> safeList(List<T> list) {
        return list == null ? List.of() : list;
    }
}
