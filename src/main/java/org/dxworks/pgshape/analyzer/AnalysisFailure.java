package org.dxworks.pgshape.analyzer;

import org.dxworks.pgshape.error.SchemaAnalysisException;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.SchemaObject;

/**
 * An object whose analysis failed. When the failure was raised while inferring another
 * object (a view this one selects from), {@link #getOrigin()} names that object.
 */
public class AnalysisFailure {

    private final SchemaObject object;
    private final SchemaAnalysisException error;

    public AnalysisFailure(SchemaObject object, SchemaAnalysisException error) {
        this.object = object;
        this.error = error;
    }

    public SchemaObject getObject() {
        return object;
    }

    public SchemaAnalysisException getError() {
        return error;
    }

    public Identifier getOrigin() {
        Identifier origin = error.getObjectId();
        return origin == null || origin.equals(object.getId()) ? null : origin;
    }

    public String describe() {
        Identifier origin = getOrigin();
        String message = error.getMessage();
        if (origin != null) {
            message = "depends on " + origin + ": " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append(object.getSpan()).append(": ").append(object.getId()).append(": ").append(message);
        if (error.getConstruct() != null) {
            sb.append(" (at: ").append(error.getConstruct()).append(')');
        }
        return sb.toString();
    }
}
