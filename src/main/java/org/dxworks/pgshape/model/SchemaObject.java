package org.dxworks.pgshape.model;

import org.dxworks.pgshape.linker.LinkedNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A top-level object declared by the schema. Equality is identity: two statements
 * declaring the same name are still two objects (and a catalog error).
 */
public abstract class SchemaObject implements LinkedNode<SchemaObject> {

    private final Identifier id;
    private final SourceSpan span;
    private final Set<SchemaObject> dependencies = new LinkedHashSet<>();
    private final Set<SchemaObject> dependents = new LinkedHashSet<>();

    protected SchemaObject(Identifier id, SourceSpan span) {
        this.id = id;
        this.span = span;
    }

    public abstract ObjectKind getKind();

    public Identifier getId() {
        return id;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public Set<SchemaObject> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public Set<SchemaObject> getDependents() {
        return Collections.unmodifiableSet(dependents);
    }

    /**
     * Records a dependency edge in both directions. Adding the same edge twice is a no-op.
     */
    public void addDependency(SchemaObject dependency) {
        dependencies.add(dependency);
        dependency.dependents.add(this);
    }

    @Override
    public String toString() {
        return id.toString();
    }
}
