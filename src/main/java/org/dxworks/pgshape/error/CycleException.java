package org.dxworks.pgshape.error;

import java.util.List;

/**
 * A dependency cycle among schema objects. Members are listed in traversal order,
 * starting with the object the cycle was entered through.
 */
public class CycleException extends SchemaAnalysisException {

    private final List<String> members;

    public CycleException(List<String> members) {
        super("Dependency cycle: " + String.join(" -> ", members) + " -> " + members.get(0));
        this.members = List.copyOf(members);
    }

    public List<String> getMembers() {
        return members;
    }
}
