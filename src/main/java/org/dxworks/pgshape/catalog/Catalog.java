package org.dxworks.pgshape.catalog;

import org.dxworks.pgshape.error.DuplicateObjectException;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.ObjectKind;
import org.dxworks.pgshape.model.SchemaObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All objects of one analysis run, indexed by kind and identifier.
 */
public class Catalog implements Iterable<SchemaObject> {

    private final List<SchemaObject> objects = new ArrayList<>();
    private final Map<ObjectKind, Map<Identifier, SchemaObject>> byKind = new EnumMap<>(ObjectKind.class);

    public static Catalog of(List<? extends SchemaObject> objects) {
        Catalog catalog = new Catalog();
        for (SchemaObject object : objects) {
            catalog.add(object);
        }
        return catalog;
    }

    /**
     * @throws DuplicateObjectException if an object of the same kind and identifier is already present
     */
    public void add(SchemaObject object) {
        Map<Identifier, SchemaObject> index = byKind.computeIfAbsent(object.getKind(), k -> new HashMap<>());
        SchemaObject existing = index.get(object.getId());
        if (existing != null) {
            throw new DuplicateObjectException(object.getKind(), object.getId(), existing.getSpan(), object.getSpan());
        }
        index.put(object.getId(), object);
        objects.add(object);
    }

    /**
     * First object with the given identifier, in declaration order, regardless of kind.
     */
    public Optional<SchemaObject> resolve(Identifier id) {
        for (SchemaObject object : objects) {
            if (object.getId().equals(id)) {
                return Optional.of(object);
            }
        }
        return Optional.empty();
    }

    /**
     * Object with the given identifier among the given kinds, checked in argument order.
     */
    public Optional<SchemaObject> resolve(Identifier id, ObjectKind... kinds) {
        for (ObjectKind kind : kinds) {
            Map<Identifier, SchemaObject> index = byKind.get(kind);
            if (index != null && index.containsKey(id)) {
                return Optional.of(index.get(id));
            }
        }
        return Optional.empty();
    }

    public List<SchemaObject> getObjects() {
        return Collections.unmodifiableList(objects);
    }

    public int size() {
        return objects.size();
    }

    @Override
    public Iterator<SchemaObject> iterator() {
        return getObjects().iterator();
    }
}
