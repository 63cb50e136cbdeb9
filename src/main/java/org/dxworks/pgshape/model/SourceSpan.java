package org.dxworks.pgshape.model;

/**
 * Location of a statement within the schema sources (1-based line).
 */
public final class SourceSpan {

    private final String file;
    private final int line;

    public SourceSpan(String file, int line) {
        this.file = file;
        this.line = line;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return (file != null ? file : "<input>") + ":" + line;
    }
}
