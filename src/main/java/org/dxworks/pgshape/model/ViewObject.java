package org.dxworks.pgshape.model;

import net.sf.jsqlparser.statement.select.Select;

import java.util.ArrayList;
import java.util.List;

public class ViewObject extends SchemaObject {

    private final Select query;
    private final String queryText;
    private final boolean materialized;
    /** Column names from {@code CREATE VIEW v (a, b)}, empty when not given. */
    private final List<String> columnNames;
    /** Relations, routines and types mentioned anywhere in the query. */
    private final List<Identifier> references;

    public ViewObject(Identifier id, SourceSpan span, Select query, String queryText,
                      boolean materialized, List<String> columnNames, List<Identifier> references) {
        super(id, span);
        this.query = query;
        this.queryText = queryText;
        this.materialized = materialized;
        this.columnNames = List.copyOf(columnNames);
        this.references = new ArrayList<>(references);
    }

    @Override
    public ObjectKind getKind() {
        return ObjectKind.VIEW;
    }

    public Select getQuery() {
        return query;
    }

    public String getQueryText() {
        return queryText;
    }

    public boolean isMaterialized() {
        return materialized;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public List<Identifier> getReferences() {
        return references;
    }
}
