package org.dxworks.pgshape.linker;

import org.dxworks.pgshape.catalog.Catalog;
import org.dxworks.pgshape.model.ColumnDefinition;
import org.dxworks.pgshape.model.CompositeTypeObject;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.ObjectKind;
import org.dxworks.pgshape.model.ParameterDefinition;
import org.dxworks.pgshape.model.RoutineObject;
import org.dxworks.pgshape.model.SchemaObject;
import org.dxworks.pgshape.model.TableObject;
import org.dxworks.pgshape.model.TypeName;
import org.dxworks.pgshape.model.ViewObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns reference sites of every catalog object into dependency edges and produces the
 * execution order. References to objects outside the catalog (builtins, extensions) are
 * left unlinked.
 */
public class DependencyLinker {

    private static final ObjectKind[] TYPE_KINDS = {
            ObjectKind.ENUM_TYPE, ObjectKind.COMPOSITE_TYPE, ObjectKind.TABLE, ObjectKind.VIEW
    };
    private static final ObjectKind[] TABLE_KINDS = {ObjectKind.TABLE};
    private static final ObjectKind[] ANY_KIND = ObjectKind.values();

    private static final Comparator<SchemaObject> CATALOG_ORDER =
            Comparator.comparing(SchemaObject::getId).thenComparing(o -> o.getKind().ordinal());

    /**
     * Links the catalog and returns its execution queue.
     *
     * @throws org.dxworks.pgshape.error.CycleException if the dependency graph is not acyclic
     */
    public ExecutionQueue<SchemaObject> link(Catalog catalog) {
        List<SchemaObject> sorted = new ArrayList<>(catalog.getObjects());
        sorted.sort(CATALOG_ORDER);

        for (SchemaObject object : sorted) {
            for (ReferenceSite site : referenceSites(object)) {
                Optional<SchemaObject> target = catalog.resolve(site.id, site.kinds);
                // self-referencing foreign keys do not constrain the order
                if (target.isPresent() && target.get() != object) {
                    object.addDependency(target.get());
                }
            }
        }

        ExecutionQueue<SchemaObject> queue = new ExecutionQueue<>();
        for (SchemaObject object : sorted) {
            queue.add(object);
        }
        queue.order();
        return queue;
    }

    private List<ReferenceSite> referenceSites(SchemaObject object) {
        List<ReferenceSite> sites = new ArrayList<>();
        switch (object.getKind()) {
            case TABLE -> {
                TableObject table = (TableObject) object;
                addColumnTypes(table.getColumns(), sites);
                for (Identifier ref : table.getReferences()) {
                    sites.add(new ReferenceSite(ref, TABLE_KINDS));
                }
            }
            case VIEW -> {
                for (Identifier ref : ((ViewObject) object).getReferences()) {
                    sites.add(new ReferenceSite(ref, ANY_KIND));
                }
            }
            case COMPOSITE_TYPE -> addColumnTypes(((CompositeTypeObject) object).getAttributes(), sites);
            case ENUM_TYPE -> {
                // labels only
            }
            case ROUTINE -> {
                RoutineObject routine = (RoutineObject) object;
                for (ParameterDefinition param : routine.getParameters()) {
                    addType(param.type, sites);
                }
                addType(routine.getReturnType(), sites);
                addColumnTypes(routine.getReturnColumns(), sites);
            }
        }
        return sites;
    }

    private static void addColumnTypes(List<ColumnDefinition> columns, List<ReferenceSite> sites) {
        for (ColumnDefinition column : columns) {
            addType(column.type, sites);
        }
    }

    private static void addType(TypeName type, List<ReferenceSite> sites) {
        if (type != null && !"pg_catalog".equals(type.getId().getSchema())) {
            sites.add(new ReferenceSite(type.getId(), TYPE_KINDS));
        }
    }

    private static final class ReferenceSite {
        final Identifier id;
        final ObjectKind[] kinds;

        ReferenceSite(Identifier id, ObjectKind[] kinds) {
            this.id = id;
            this.kinds = kinds;
        }
    }
}
