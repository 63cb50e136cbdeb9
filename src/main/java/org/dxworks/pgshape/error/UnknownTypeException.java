package org.dxworks.pgshape.error;

public class UnknownTypeException extends SchemaAnalysisException {

    public UnknownTypeException(String message) {
        super(message);
    }

    public UnknownTypeException(String message, String construct) {
        super(message, construct);
    }
}
