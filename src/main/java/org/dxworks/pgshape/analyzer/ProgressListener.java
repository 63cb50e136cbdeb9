package org.dxworks.pgshape.analyzer;

import org.dxworks.pgshape.model.SchemaObject;

public interface ProgressListener {

    ProgressListener NONE = (current, total, object) -> { };

    /**
     * Called before each object is analyzed; {@code current} is 1-based.
     */
    void onObject(int current, int total, SchemaObject object);
}
