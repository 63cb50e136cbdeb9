package org.dxworks.pgshape.infer;

import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.JsonFunction;
import net.sf.jsqlparser.expression.JsonFunctionExpression;
import net.sf.jsqlparser.expression.JsonFunctionType;
import net.sf.jsqlparser.expression.JsonKeyValuePair;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.StringValue;
import org.dxworks.pgshape.error.UnsupportedConstructException;
import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.TypeName;
import org.dxworks.pgshape.model.json.ArrayType;
import org.dxworks.pgshape.model.json.ObjectType;
import org.dxworks.pgshape.model.json.PrimitiveType;
import org.dxworks.pgshape.model.json.StructuralType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Infers the shape of JSON values built by SQL expressions.
 */
public class JsonShapeInferrer {

    /**
     * Shape a field takes when serialized to JSON. Array dimensions are peeled one level at
     * a time; the field's nullability applies to the outermost level only.
     */
    public StructuralType shapeOf(Field field, InferenceScope scope) {
        if (field.getJsonType() != null) {
            return field.getJsonType();
        }
        TypeName type = scope.getTypeName(field.getTypeOid());
        if (!"pg_catalog".equals(type.getId().getSchema())) {
            return PrimitiveType.json(field.isNullable());
        }
        int dims = field.getDims() + type.getArrayDims();
        StructuralType shape = new PrimitiveType(TypeClassifier.classify(type), dims == 0 && field.isNullable());
        for (int i = dims; i > 0; i--) {
            shape = new ArrayType(shape, i == 1 && field.isNullable());
        }
        return shape;
    }

    /**
     * Shape produced by a call to one of the JSON constructing functions, or {@code null}
     * when the function builds no shape of its own. {@code args} are the argument
     * expressions and {@code argFields} their inferred fields, in the same order.
     */
    StructuralType shapeOfCall(String function, List<Expression> args, List<Field> argFields, Field result,
                               InferenceScope scope) {
        switch (function) {
            case "json_build_object":
            case "jsonb_build_object":
                return buildObject(args, argFields, result.isNullable(), scope);
            case "json_build_array":
            case "jsonb_build_array":
                return new ArrayType(unionOf(args, argFields, scope), result.isNullable());
            case "json_agg":
            case "jsonb_agg":
                return argFields.isEmpty() ? null : new ArrayType(shapeOf(argFields.get(0), scope), true);
            case "to_json":
            case "to_jsonb":
            case "row_to_json":
            case "array_to_json":
            case "json_strip_nulls":
            case "jsonb_strip_nulls":
                return argFields.isEmpty() ? null : shapeOf(argFields.get(0), scope).withNullable(result.isNullable());
            case "coalesce": {
                if (!isJsonResult(result, scope)) return null;
                StructuralType union = unionOf(args, argFields, scope);
                return union.withNullable(result.isNullable());
            }
            default:
                return null;
        }
    }

    /**
     * {@code JSON_OBJECT(KEY k VALUE v, ...)} and {@code JSON_ARRAY(...)}.
     */
    StructuralType shapeOfJsonFunction(JsonFunction json, ExpressionInferrer expressions,
                                       Map<String, Field> uniqueFields, InferenceScope scope) {
        JsonFunctionType type = json.getType();
        if (type == JsonFunctionType.ARRAY) {
            List<Expression> elements = new ArrayList<>();
            List<Field> fields = new ArrayList<>();
            for (JsonFunctionExpression expr : json.getExpressions()) {
                elements.add(expr.getExpression());
                fields.add(expressions.inferSingle(expr.getExpression(), uniqueFields, scope));
            }
            return new ArrayType(unionOf(elements, fields, scope), false);
        }
        Map<String, StructuralType> fields = new LinkedHashMap<>();
        for (JsonKeyValuePair pair : json.getKeyValuePairs()) {
            Object key = pair.getKey();
            Object value = pair.getValue();
            String keyName = key instanceof StringValue ? ((StringValue) key).getValue()
                    : key instanceof String ? unquote((String) key) : null;
            if (keyName == null || !(value instanceof Expression)) {
                return PrimitiveType.json(false);
            }
            fields.put(keyName, shapeOf(expressions.inferSingle((Expression) value, uniqueFields, scope), scope));
        }
        return new ObjectType(fields, false);
    }

    /**
     * Keys must be string literals; any other key makes the object opaque JSON.
     */
    private StructuralType buildObject(List<Expression> args, List<Field> argFields, boolean nullable,
                                       InferenceScope scope) {
        if (args.size() % 2 != 0) {
            throw new UnsupportedConstructException("Argument list must have even number of elements", null);
        }
        Map<String, StructuralType> fields = new LinkedHashMap<>();
        for (int i = 0; i < args.size(); i += 2) {
            Expression key = args.get(i);
            if (!(key instanceof StringValue)) {
                return PrimitiveType.json(nullable);
            }
            fields.put(((StringValue) key).getValue(), shapeOf(argFields.get(i + 1), scope));
        }
        return new ObjectType(fields, nullable);
    }

    /**
     * Union of the shapes of the given expressions. Literal NULLs only make the union
     * nullable; an input of nothing but NULLs yields opaque JSON.
     */
    private StructuralType unionOf(List<Expression> args, List<Field> argFields, InferenceScope scope) {
        StructuralType union = null;
        boolean sawNull = false;
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i) instanceof NullValue) {
                sawNull = true;
                continue;
            }
            union = StructuralType.union(union, shapeOf(argFields.get(i), scope));
        }
        if (union == null) {
            return PrimitiveType.json(sawNull);
        }
        return sawNull ? union.withNullable(true) : union;
    }

    private boolean isJsonResult(Field result, InferenceScope scope) {
        return result.getDims() == 0 && TypeClassifier.isJson(scope.getTypeName(result.getTypeOid()));
    }

    private static String unquote(String key) {
        String k = key.trim();
        if (k.length() >= 2 && k.startsWith("'") && k.endsWith("'")) {
            return k.substring(1, k.length() - 1);
        }
        return k;
    }
}
