package org.dxworks.pgshape.model;

import java.util.ArrayList;
import java.util.List;

public class TableObject extends SchemaObject {

    private final List<ColumnDefinition> columns;
    /** Relations referenced by foreign keys. */
    private final List<Identifier> references;

    public TableObject(Identifier id, SourceSpan span, List<ColumnDefinition> columns, List<Identifier> references) {
        super(id, span);
        this.columns = new ArrayList<>(columns);
        this.references = new ArrayList<>(references);
    }

    @Override
    public ObjectKind getKind() {
        return ObjectKind.TABLE;
    }

    public List<ColumnDefinition> getColumns() {
        return columns;
    }

    public List<Identifier> getReferences() {
        return references;
    }
}
