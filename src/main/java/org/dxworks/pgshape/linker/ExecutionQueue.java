package org.dxworks.pgshape.linker;

import org.dxworks.pgshape.error.CycleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Dependency-ordered iteration over linked nodes.
 * <p>
 * Nodes are registered in insertion order; iterating yields every dependency of a node
 * before the node itself, each node exactly once, and otherwise keeps insertion order.
 * Dependencies reachable from a registered node are yielded even if they were never
 * registered themselves.
 */
public class ExecutionQueue<T extends LinkedNode<T>> implements Iterable<T> {

    private final Set<T> roots = new LinkedHashSet<>();

    /**
     * Registers a node. Registering the same node again is a no-op.
     */
    public void add(T node) {
        roots.add(node);
    }

    public int size() {
        return roots.size();
    }

    /**
     * Computes the full order.
     *
     * @throws CycleException if a node is reachable from itself
     */
    public List<T> order() {
        List<T> ordered = new ArrayList<>();
        Set<T> done = new HashSet<>();
        for (T root : roots) {
            visit(root, done, ordered);
        }
        return Collections.unmodifiableList(ordered);
    }

    @Override
    public Iterator<T> iterator() {
        return order().iterator();
    }

    private void visit(T root, Set<T> done, List<T> ordered) {
        if (done.contains(root)) return;

        // Explicit stack of (node, remaining dependencies); path mirrors the stack for cycle reporting.
        Deque<Frame<T>> stack = new ArrayDeque<>();
        Set<T> inProgress = new HashSet<>();
        List<T> path = new ArrayList<>();

        stack.push(new Frame<>(root));
        inProgress.add(root);
        path.add(root);

        while (!stack.isEmpty()) {
            Frame<T> frame = stack.peek();
            if (frame.pending.hasNext()) {
                T next = frame.pending.next();
                if (done.contains(next)) continue;
                if (inProgress.contains(next)) {
                    throw new CycleException(describe(path.subList(path.indexOf(next), path.size())));
                }
                stack.push(new Frame<>(next));
                inProgress.add(next);
                path.add(next);
            } else {
                stack.pop();
                inProgress.remove(frame.node);
                path.remove(path.size() - 1);
                done.add(frame.node);
                ordered.add(frame.node);
            }
        }
    }

    private static List<String> describe(List<?> members) {
        List<String> names = new ArrayList<>(members.size());
        for (Object member : members) {
            names.add(String.valueOf(member));
        }
        return names;
    }

    private static final class Frame<T extends LinkedNode<T>> {
        final T node;
        final Iterator<T> pending;

        Frame(T node) {
            this.node = node;
            this.pending = node.getDependencies().iterator();
        }
    }
}
