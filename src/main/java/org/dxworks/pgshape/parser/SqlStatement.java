package org.dxworks.pgshape.parser;

import org.dxworks.pgshape.model.SourceSpan;

/**
 * One statement of a schema source, without its terminating semicolon.
 */
public class SqlStatement {
    public final String text;
    public final SourceSpan span;

    public SqlStatement(String text, SourceSpan span) {
        this.text = text;
        this.span = span;
    }

    @Override
    public String toString() {
        return span + ": " + text;
    }
}
