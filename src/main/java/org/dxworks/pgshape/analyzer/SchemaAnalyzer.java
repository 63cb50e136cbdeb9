package org.dxworks.pgshape.analyzer;

import net.sf.jsqlparser.statement.select.Select;
import org.dxworks.pgshape.PgShapeConfig;
import org.dxworks.pgshape.catalog.Catalog;
import org.dxworks.pgshape.error.AnalysisCancelledException;
import org.dxworks.pgshape.error.SchemaAnalysisException;
import org.dxworks.pgshape.infer.CachingMetadataResolver;
import org.dxworks.pgshape.infer.CatalogMetadataResolver;
import org.dxworks.pgshape.infer.InferenceEngine;
import org.dxworks.pgshape.infer.InferenceScope;
import org.dxworks.pgshape.infer.MetadataResolver;
import org.dxworks.pgshape.infer.TypeClassifier;
import org.dxworks.pgshape.linker.DependencyLinker;
import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.ColumnDefinition;
import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.ParameterDefinition;
import org.dxworks.pgshape.model.RoutineObject;
import org.dxworks.pgshape.model.SchemaObject;
import org.dxworks.pgshape.model.TypeCategory;
import org.dxworks.pgshape.model.TypeName;
import org.dxworks.pgshape.model.json.StructuralType;
import org.dxworks.pgshape.parser.RoutineBodyParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the result shape of every catalog object in dependency order.
 * <p>
 * A failing object is recorded in the report and does not stop the run. A dependency
 * cycle does, since no execution order exists.
 */
public class SchemaAnalyzer {

    private final PgShapeConfig config;

    public SchemaAnalyzer(PgShapeConfig config) {
        this.config = config;
    }

    public AnalysisReport analyze(Catalog catalog) {
        return analyze(catalog, ProgressListener.NONE);
    }

    /**
     * @throws org.dxworks.pgshape.error.CycleException if the catalog has a dependency cycle
     * @throws AnalysisCancelledException if the thread is interrupted between objects
     */
    public AnalysisReport analyze(Catalog catalog, ProgressListener listener) {
        List<SchemaObject> order = new DependencyLinker().link(catalog).order();
        MetadataResolver metadata = new CachingMetadataResolver(new CatalogMetadataResolver(catalog));
        InferenceEngine engine = new InferenceEngine(metadata);

        List<ObjectResult> results = new ArrayList<>();
        List<AnalysisFailure> failures = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AnalysisCancelledException(i, order.size());
            }
            SchemaObject object = order.get(i);
            listener.onObject(i + 1, order.size(), object);
            try {
                results.add(analyzeObject(object, engine));
            } catch (SchemaAnalysisException e) {
                failures.add(new AnalysisFailure(object, e.locate(object.getId(), object.getSpan())));
            }
        }
        return new AnalysisReport(order, results, failures);
    }

    private ObjectResult analyzeObject(SchemaObject object, InferenceEngine engine) {
        InferenceScope scope = engine.newScope(object.getId().getSchema());
        List<Field> fields;
        switch (object.getKind()) {
            case TABLE:
            case VIEW:
            case COMPOSITE_TYPE:
                fields = engine.getMetadata().resolveRowType(object.getId());
                break;
            case ROUTINE:
                fields = routineFields((RoutineObject) object, engine, scope);
                break;
            default:
                fields = List.of();
        }
        return describe(object, fields, engine, scope);
    }

    /**
     * Declared OUT / TABLE columns, the row of a table or composite return type, or one
     * field named after the routine. SQL routines refine JSON columns from their body and
     * take their columns from it when declared to return {@code record}.
     */
    private List<Field> routineFields(RoutineObject routine, InferenceEngine engine, InferenceScope scope) {
        List<Field> fields = declaredFields(routine, scope);
        boolean record = fields == null;
        if (!record && !hasJsonField(fields, scope)) {
            return fields;
        }
        Select query = RoutineBodyParser.resultQuery(routine);
        if (query == null) {
            return record ? List.of(new Field(routine.getId().getName(), BuiltinTypes.RECORD, true)) : fields;
        }
        scope.defineParameters(parameterFields(routine, scope));
        List<Field> inferred = engine.inferSelect(query, scope);
        if (record) {
            return inferred;
        }
        List<Field> refined = new ArrayList<>(fields);
        for (int i = 0; i < refined.size() && i < inferred.size(); i++) {
            Field field = refined.get(i);
            if (isJson(field, scope) && inferred.get(i).getJsonType() != null) {
                refined.set(i, field.withJsonType(inferred.get(i).getJsonType().withNullable(field.isNullable())));
            }
        }
        return refined;
    }

    /**
     * @return the declared result fields, or {@code null} for a bare {@code record} result
     */
    private List<Field> declaredFields(RoutineObject routine, InferenceScope scope) {
        List<Field> fields = new ArrayList<>();
        if (!routine.getReturnColumns().isEmpty()) {
            for (ColumnDefinition column : routine.getReturnColumns()) {
                fields.add(new Field(column.name, scope.getTypeOid(column.type), true, column.type.getArrayDims(), null));
            }
            return fields;
        }
        TypeName returnType = routine.getReturnType();
        if (returnType == null || "void".equals(returnType.getId().getName())) {
            return fields;
        }
        if (BuiltinTypes.SCHEMA.equals(returnType.getId().getSchema()) && "record".equals(returnType.getId().getName())) {
            return null;
        }
        if (!returnType.isArray()) {
            List<Field> row = scope.getMetadata().resolveRowType(returnType.getId());
            if (row != null) {
                return row;
            }
        }
        fields.add(new Field(routine.getId().getName(), scope.getTypeOid(returnType), true, returnType.getArrayDims(), null));
        return fields;
    }

    private List<Field> parameterFields(RoutineObject routine, InferenceScope scope) {
        List<Field> fields = new ArrayList<>();
        for (ParameterDefinition parameter : routine.getParameters()) {
            if (parameter.name != null) {
                fields.add(new Field(parameter.name, scope.getTypeOid(parameter.type), true, parameter.type.getArrayDims(), null));
            }
        }
        return fields;
    }

    private boolean hasJsonField(List<Field> fields, InferenceScope scope) {
        for (Field field : fields) {
            if (isJson(field, scope)) return true;
        }
        return false;
    }

    private static boolean isJson(Field field, InferenceScope scope) {
        return field.getDims() == 0 && TypeClassifier.isJson(scope.getTypeName(field.getTypeOid()));
    }

    private ObjectResult describe(SchemaObject object, List<Field> fields, InferenceEngine engine, InferenceScope scope) {
        List<String> typeNames = new ArrayList<>();
        List<TypeCategory> categories = new ArrayList<>();
        List<StructuralType> shapes = new ArrayList<>();
        for (Field field : fields) {
            TypeName type = scope.getTypeName(field.getTypeOid());
            String name = BuiltinTypes.SCHEMA.equals(type.getId().getSchema()) ? type.getId().getName() : type.getId().toString();
            typeNames.add(name + "[]".repeat(field.getDims() + type.getArrayDims()));
            categories.add(engine.categoryOf(field, scope));
            shapes.add(config.isIncludeJsonShapes() ? engine.shapeOf(field, scope) : null);
        }
        return new ObjectResult(object, fields, typeNames, categories, shapes);
    }
}
