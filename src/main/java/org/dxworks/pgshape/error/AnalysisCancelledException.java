package org.dxworks.pgshape.error;

/**
 * The analysis pass was interrupted between two top-level objects.
 */
public class AnalysisCancelledException extends SchemaAnalysisException {

    public AnalysisCancelledException(int analyzed, int total) {
        super("Analysis cancelled after " + analyzed + " of " + total + " objects");
    }
}
