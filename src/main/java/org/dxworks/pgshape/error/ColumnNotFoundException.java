package org.dxworks.pgshape.error;

/**
 * A column reference does not resolve. Ambiguous unqualified references land here
 * too, because ambiguous names are left out of the unqualified lookup index.
 */
public class ColumnNotFoundException extends SchemaAnalysisException {

    private final String columnName;
    private final boolean ambiguous;

    public ColumnNotFoundException(String message, String columnName, boolean ambiguous, String construct) {
        super(message, construct);
        this.columnName = columnName;
        this.ambiguous = ambiguous;
    }

    public String getColumnName() {
        return columnName;
    }

    public boolean isAmbiguous() {
        return ambiguous;
    }
}
