package org.dxworks.pgshape.analyzer;

/**
 * Decides, after analysis, whether a result is emitted.
 */
public interface OutputFilter {
    boolean accepts(ObjectResult result);
}
