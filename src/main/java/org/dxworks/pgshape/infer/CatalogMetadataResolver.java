package org.dxworks.pgshape.infer;

import org.dxworks.pgshape.catalog.Catalog;
import org.dxworks.pgshape.error.CycleException;
import org.dxworks.pgshape.error.RelationNotFoundException;
import org.dxworks.pgshape.error.SchemaAnalysisException;
import org.dxworks.pgshape.error.UnknownTypeException;
import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.ColumnDefinition;
import org.dxworks.pgshape.model.CompositeTypeObject;
import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.ObjectKind;
import org.dxworks.pgshape.model.RoutineObject;
import org.dxworks.pgshape.model.SchemaObject;
import org.dxworks.pgshape.model.TableObject;
import org.dxworks.pgshape.model.TypeName;
import org.dxworks.pgshape.model.ViewObject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Metadata answered from the analyzed catalog and the builtin {@code pg_catalog} tables,
 * without a database connection.
 * <p>
 * User-defined types get synthetic OIDs in catalog order, each followed by its array OID.
 * Types referenced by the sources but declared elsewhere (extension types such as
 * {@code citext}) get OIDs on first use. View fields are inferred from the view query on
 * first use and memoized.
 */
public class CatalogMetadataResolver implements MetadataResolver {

    static final int FIRST_USER_OID = 100_000;
    static final int FIRST_EXTERNAL_OID = 500_000;

    private final Catalog catalog;
    private final Map<Identifier, Integer> oidById = new HashMap<>();
    private final Map<Integer, TypeName> typeByOid = new HashMap<>();
    private final Map<ViewObject, List<Field>> viewFields = new HashMap<>();
    private final Set<ViewObject> inferring = new LinkedHashSet<>();
    private int nextExternalOid = FIRST_EXTERNAL_OID;
    private InferenceEngine engine;

    public CatalogMetadataResolver(Catalog catalog) {
        this.catalog = catalog;
        int next = FIRST_USER_OID;
        for (SchemaObject object : catalog) {
            if (object.getKind().isType() && !oidById.containsKey(object.getId())) {
                register(object.getId(), next);
                next += 2;
            }
        }
    }

    private void register(Identifier id, int oid) {
        oidById.put(id, oid);
        typeByOid.put(oid, new TypeName(id));
        typeByOid.put(oid + 1, new TypeName(id, 1, List.of()));
    }

    @Override
    public RelationBinding resolveRelation(Identifier id) {
        Optional<SchemaObject> object = catalog.resolve(id, ObjectKind.TABLE, ObjectKind.VIEW);
        if (object.isEmpty()) {
            throw new RelationNotFoundException(id.toString(), null);
        }
        RelationKind kind = object.get().getKind() == ObjectKind.VIEW ? RelationKind.VIEW : RelationKind.TABLE;
        return new RelationBinding(kind, resolveRowType(id));
    }

    @Override
    public List<Field> resolveRowType(Identifier id) {
        Optional<SchemaObject> object = catalog.resolve(id, ObjectKind.TABLE, ObjectKind.VIEW, ObjectKind.COMPOSITE_TYPE);
        if (object.isEmpty()) {
            return null;
        }
        SchemaObject target = object.get();
        if (target instanceof TableObject) {
            return toFields(((TableObject) target).getColumns());
        }
        if (target instanceof CompositeTypeObject) {
            return toFields(((CompositeTypeObject) target).getAttributes());
        }
        return viewFields((ViewObject) target);
    }

    private List<Field> toFields(List<ColumnDefinition> columns) {
        List<Field> fields = new ArrayList<>(columns.size());
        for (ColumnDefinition column : columns) {
            fields.add(new Field(column.name, getTypeOid(column.type), column.nullable, column.type.getArrayDims(), null));
        }
        return fields;
    }

    private List<Field> viewFields(ViewObject view) {
        List<Field> cached = viewFields.get(view);
        if (cached != null) {
            return cached;
        }
        if (!inferring.add(view)) {
            List<String> members = new ArrayList<>();
            boolean inCycle = false;
            for (ViewObject v : inferring) {
                inCycle |= v == view;
                if (inCycle) members.add(v.getId().toString());
            }
            throw new CycleException(members);
        }
        try {
            List<Field> fields = engine().inferSelect(view.getQuery(), engine().newScope(view.getId().getSchema()));
            fields = new RelationBinding(RelationKind.VIEW, fields)
                    .withColumnAliases(view.getColumnNames(), view.getId().toString())
                    .getFields();
            viewFields.put(view, fields);
            return fields;
        } catch (SchemaAnalysisException e) {
            throw e.locate(view.getId(), view.getSpan());
        } finally {
            inferring.remove(view);
        }
    }

    private InferenceEngine engine() {
        if (engine == null) {
            engine = new InferenceEngine(this);
        }
        return engine;
    }

    @Override
    public TypeName getTypeName(int oid) {
        String builtin = BuiltinTypes.nameOf(oid);
        if (builtin != null) {
            return TypeName.builtin(builtin);
        }
        int element = BuiltinTypes.elementOf(oid);
        if (element != 0) {
            return TypeName.builtin(BuiltinTypes.nameOf(element)).withArrayDims(1);
        }
        TypeName user = typeByOid.get(oid);
        if (user == null) {
            throw new UnknownTypeException("Unknown type OID: " + oid);
        }
        return user;
    }

    @Override
    public int getTypeOid(TypeName type) {
        Identifier id = type.getId();
        if (BuiltinTypes.SCHEMA.equals(id.getSchema())) {
            int oid = BuiltinTypes.oidOf(id.getName());
            if (oid == 0) {
                throw new UnknownTypeException("Unknown type: " + id);
            }
            return oid;
        }
        Integer oid = oidById.get(id);
        if (oid == null) {
            oid = nextExternalOid;
            nextExternalOid += 2;
            register(id, oid);
        }
        return oid;
    }

    @Override
    public Field getReturnType(Identifier function, List<Field> args) {
        Optional<SchemaObject> declared = catalog.resolve(function, ObjectKind.ROUTINE);
        if (declared.isPresent()) {
            RoutineObject routine = (RoutineObject) declared.get();
            if (routine.isProcedure()) {
                throw new UnknownTypeException(function + " is a procedure and has no return type");
            }
            boolean nullable = BuiltinFunctions.isNullable(BuiltinFunctions.Nulls.PROPAGATE, args);
            TypeName returnType = routine.getReturnType();
            if (returnType == null) {
                return new Field(function.getName(), BuiltinTypes.RECORD, nullable, 0, null);
            }
            return new Field(function.getName(), getTypeOid(returnType), nullable, returnType.getArrayDims(), null);
        }

        BuiltinFunctions.Rule rule = isCatalogSchema(function) ? BuiltinFunctions.lookup(function.getName()) : null;
        if (rule == null) {
            throw new UnknownTypeException("Unknown function: " + function);
        }
        boolean nullable = BuiltinFunctions.isNullable(rule.nulls, args);
        switch (rule.returns) {
            case FIXED:
                return new Field(function.getName(), rule.oid, nullable, rule.dims, null);
            case ARG:
            case ARG_ARRAY:
            case ARG_ELEMENT: {
                Field arg = argument(function, rule.argIndex, args);
                int dims = arg.getDims();
                if (rule.returns == BuiltinFunctions.Returns.ARG_ARRAY) dims++;
                if (rule.returns == BuiltinFunctions.Returns.ARG_ELEMENT) dims = Math.max(0, dims - 1);
                return new Field(function.getName(), arg.getTypeOid(), nullable, dims, null);
            }
            default:
                throw new UnknownTypeException("Unknown function: " + function);
        }
    }

    private static boolean isCatalogSchema(Identifier function) {
        return Identifier.DEFAULT_SCHEMA.equals(function.getSchema()) || BuiltinTypes.SCHEMA.equals(function.getSchema());
    }

    /**
     * Argument a polymorphic result is taken from. For the first argument, the first one
     * with a resolved type wins, the way {@code coalesce(NULL, 'x')} resolves to text.
     */
    private static Field argument(Identifier function, int index, List<Field> args) {
        if (args.size() <= index) {
            throw new UnknownTypeException("Cannot resolve " + function + " with " + args.size() + " arguments");
        }
        if (index == 0) {
            for (Field arg : args) {
                if (arg.getTypeOid() != BuiltinTypes.UNKNOWN) return arg;
            }
        }
        return args.get(index);
    }
}
