package org.dxworks.pgshape.error;

/**
 * A recognized SQL shape the analyzer does not model (indirection, non-SELECT CTE
 * bodies, range functions in FROM, subqueries without alias, ...).
 */
public class UnsupportedConstructException extends SchemaAnalysisException {

    public UnsupportedConstructException(String message, String construct) {
        super(message, construct);
    }
}
