package org.dxworks.pgshape.error;

import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.ObjectKind;
import org.dxworks.pgshape.model.SourceSpan;

/**
 * Two statements declare the same (kind, identifier) pair.
 */
public class DuplicateObjectException extends SchemaAnalysisException {

    private final ObjectKind kind;
    private final SourceSpan firstDeclaration;

    public DuplicateObjectException(ObjectKind kind, Identifier id, SourceSpan firstDeclaration, SourceSpan secondDeclaration) {
        super("Duplicate " + kind.getLabel() + " " + id
                + (firstDeclaration != null ? " (first declared at " + firstDeclaration + ")" : ""));
        this.kind = kind;
        this.firstDeclaration = firstDeclaration;
        locate(id, secondDeclaration);
    }

    public ObjectKind getKind() {
        return kind;
    }

    public SourceSpan getFirstDeclaration() {
        return firstDeclaration;
    }
}
