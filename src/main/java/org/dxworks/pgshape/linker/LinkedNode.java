package org.dxworks.pgshape.linker;

import java.util.Set;

/**
 * Node of the dependency graph. Edges point from a node to the nodes it depends on.
 */
public interface LinkedNode<T extends LinkedNode<T>> {

    Set<T> getDependencies();
}
