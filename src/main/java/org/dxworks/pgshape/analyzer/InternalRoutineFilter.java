package org.dxworks.pgshape.analyzer;

import org.dxworks.pgshape.model.ObjectKind;

import java.util.List;

/**
 * Drops routines whose name starts with one of the configured prefixes, e.g. {@code _} for helpers.
 */
public class InternalRoutineFilter implements OutputFilter {

    private final List<String> prefixes;

    public InternalRoutineFilter(List<String> prefixes) {
        this.prefixes = List.copyOf(prefixes);
    }

    @Override
    public boolean accepts(ObjectResult result) {
        if (result.getObject().getKind() != ObjectKind.ROUTINE) {
            return true;
        }
        String name = result.getObject().getId().getName();
        for (String prefix : prefixes) {
            if (!prefix.isEmpty() && name.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }
}
