package org.dxworks.pgshape.analyzer;

import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.SchemaObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one analysis run: a result or a failure for every object, in execution order.
 */
public class AnalysisReport {

    private final List<SchemaObject> order;
    private final List<ObjectResult> results;
    private final List<AnalysisFailure> failures;

    public AnalysisReport(List<SchemaObject> order, List<ObjectResult> results, List<AnalysisFailure> failures) {
        this.order = Collections.unmodifiableList(new ArrayList<>(order));
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public List<SchemaObject> getOrder() {
        return order;
    }

    public List<ObjectResult> getResults() {
        return results;
    }

    public List<AnalysisFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public ObjectResult getResult(Identifier id) {
        for (ObjectResult result : results) {
            if (result.getObject().getId().equals(id)) return result;
        }
        return null;
    }

    public AnalysisFailure getFailure(Identifier id) {
        for (AnalysisFailure failure : failures) {
            if (failure.getObject().getId().equals(id)) return failure;
        }
        return null;
    }

    /**
     * Results accepted by every filter, in execution order.
     */
    public List<ObjectResult> emitted(List<OutputFilter> filters) {
        List<ObjectResult> emitted = new ArrayList<>();
        for (ObjectResult result : results) {
            boolean accepted = true;
            for (OutputFilter filter : filters) {
                accepted &= filter.accepts(result);
            }
            if (accepted) emitted.add(result);
        }
        return emitted;
    }
}
