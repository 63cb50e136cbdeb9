package org.dxworks.pgshape.infer;

import net.sf.jsqlparser.statement.select.Select;
import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.TypeCategory;
import org.dxworks.pgshape.model.json.StructuralType;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point to query inference. Wires the scope resolver and the expression, select
 * and JSON shape inferrers over one {@link MetadataResolver}.
 */
public class InferenceEngine {

    private final MetadataResolver metadata;
    private final ScopeResolver scopes;
    private final SelectInferrer selects;
    private final JsonShapeInferrer json;
    private final ExpressionInferrer expressions;

    public InferenceEngine(MetadataResolver metadata) {
        this.metadata = metadata;
        this.scopes = new ScopeResolver(this);
        this.selects = new SelectInferrer(this);
        this.json = new JsonShapeInferrer();
        this.expressions = new ExpressionInferrer(this, json);
    }

    /**
     * Scope searching {@code schema} first, then {@code public}.
     */
    public InferenceScope newScope(String schema) {
        List<String> searchPath = new ArrayList<>();
        searchPath.add(schema);
        if (!Identifier.DEFAULT_SCHEMA.equals(schema)) {
            searchPath.add(Identifier.DEFAULT_SCHEMA);
        }
        return new InferenceScope(metadata, searchPath);
    }

    public List<Field> inferSelect(Select select) {
        return inferSelect(select, newScope(Identifier.DEFAULT_SCHEMA));
    }

    public List<Field> inferSelect(Select select, InferenceScope scope) {
        return selects.inferSelect(select, scope);
    }

    public StructuralType shapeOf(Field field, InferenceScope scope) {
        return json.shapeOf(field, scope);
    }

    public TypeCategory categoryOf(Field field, InferenceScope scope) {
        return TypeClassifier.classify(scope.getTypeName(field.getTypeOid()));
    }

    public MetadataResolver getMetadata() {
        return metadata;
    }

    ScopeResolver scopes() {
        return scopes;
    }

    SelectInferrer selects() {
        return selects;
    }

    ExpressionInferrer expressions() {
        return expressions;
    }
}
