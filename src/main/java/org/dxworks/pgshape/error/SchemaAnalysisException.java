package org.dxworks.pgshape.error;

import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.SourceSpan;

/**
 * Base type of every failure surfaced by the analyzer.
 * <p>
 * Exceptions are usually raised deep inside scope resolution, where the owning
 * schema object is not known yet. The top-level pass attaches the object's
 * identifier and source span before reporting, so callers can render a located
 * diagnostic.
 */
public abstract class SchemaAnalysisException extends RuntimeException {

    private Identifier objectId;
    private SourceSpan span;
    private final String construct;

    protected SchemaAnalysisException(String message) {
        this(message, null, null);
    }

    protected SchemaAnalysisException(String message, String construct) {
        this(message, construct, null);
    }

    protected SchemaAnalysisException(String message, String construct, Throwable cause) {
        super(message, cause);
        this.construct = construct;
    }

    /**
     * Qualified identifier of the schema object being analyzed, if known.
     */
    public Identifier getObjectId() {
        return objectId;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * SQL text of the construct that caused the failure, if derivable from the AST.
     */
    public String getConstruct() {
        return construct;
    }

    /**
     * Attaches the owning object and its location. An already attached object is kept,
     * since the innermost owner is the most precise one.
     */
    public SchemaAnalysisException locate(Identifier objectId, SourceSpan span) {
        if (this.objectId == null) {
            this.objectId = objectId;
            this.span = span;
        }
        return this;
    }

    /**
     * Message prefixed with the object and location, e.g.
     * {@code schema/views.sql:12: public.active_users: Unknown relation: public.userz}.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (span != null) sb.append(span).append(": ");
        if (objectId != null) sb.append(objectId).append(": ");
        sb.append(getMessage());
        if (construct != null && !construct.isEmpty()) {
            sb.append(" (at: ").append(construct).append(')');
        }
        return sb.toString();
    }
}
