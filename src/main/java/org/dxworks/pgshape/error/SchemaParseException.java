package org.dxworks.pgshape.error;

import org.dxworks.pgshape.model.SourceSpan;

/**
 * A schema statement could not be parsed. Fatal for the whole run.
 */
public class SchemaParseException extends SchemaAnalysisException {

    public SchemaParseException(String message, SourceSpan span, String statement, Throwable cause) {
        super(message, statement, cause);
        locate(null, span);
    }
}
