package org.dxworks.pgshape.infer;

import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.ArrayConstructor;
import net.sf.jsqlparser.expression.ArrayExpression;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.CaseExpression;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.CollateExpression;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExtractExpression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.IntervalExpression;
import net.sf.jsqlparser.expression.JsonExpression;
import net.sf.jsqlparser.expression.JsonFunction;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.TimeKeyExpression;
import net.sf.jsqlparser.expression.WhenClause;
import net.sf.jsqlparser.expression.operators.arithmetic.Addition;
import net.sf.jsqlparser.expression.operators.arithmetic.Concat;
import net.sf.jsqlparser.expression.operators.arithmetic.Division;
import net.sf.jsqlparser.expression.operators.arithmetic.Modulo;
import net.sf.jsqlparser.expression.operators.arithmetic.Multiplication;
import net.sf.jsqlparser.expression.operators.arithmetic.Subtraction;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ComparisonOperator;
import net.sf.jsqlparser.expression.operators.relational.ExistsExpression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.expression.operators.relational.LikeExpression;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.expression.operators.relational.SimilarToExpression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.dxworks.pgshape.error.ColumnNotFoundException;
import org.dxworks.pgshape.error.UnsupportedConstructException;
import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.TypeName;
import org.dxworks.pgshape.model.json.ObjectType;
import org.dxworks.pgshape.model.json.StructuralType;
import org.dxworks.pgshape.parser.TypeNameParser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Infers the output fields of target-list entries and the type of expressions.
 * <p>
 * Each supported expression kind has its own branch in {@link #infer}; anything else
 * ends in the fallback branch and fails with {@link UnsupportedConstructException}.
 */
public class ExpressionInferrer {

    static final String ANONYMOUS = "?column?";

    private static final Set<String> NUMERIC_ORDER_NAMES = Set.of("int2", "int4", "int8", "numeric", "float4", "float8");
    private static final List<String> NUMERIC_ORDER = List.of("int2", "int4", "int8", "numeric", "float4", "float8");

    private static final BigInteger INT4_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT4_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT8_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger INT8_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final InferenceEngine engine;
    private final JsonShapeInferrer json;

    ExpressionInferrer(InferenceEngine engine, JsonShapeInferrer json) {
        this.engine = engine;
        this.json = json;
    }

    /**
     * Output fields of a target list. An aliased entry contributes exactly its first
     * inferred field under the alias; other entries contribute every inferred field.
     */
    public List<Field> inferTargetList(List<SelectItem<?>> items, InferenceScope scope) {
        Map<String, Field> uniqueFields = scope.uniqueFields();
        List<Field> fields = new ArrayList<>();
        for (SelectItem<?> item : items) {
            Expression expr = item.getExpression();
            if (isIndirection(expr)) {
                throw new UnsupportedConstructException("Indirection is not supported", item.toString());
            }
            List<Field> inferred = infer(expr, uniqueFields, scope);
            if (inferred.isEmpty()) {
                throw new UnsupportedConstructException("Expression yields no columns: "
                        + expr.getClass().getSimpleName(), item.toString());
            }
            String alias = Names.aliasName(item.getAlias());
            if (alias != null) {
                fields.add(inferred.get(0).withName(alias));
            } else {
                fields.addAll(inferred);
            }
        }
        return fields;
    }

    /**
     * Fields an expression evaluates to. Star and whole-row references expand to several
     * fields, every other expression yields one.
     */
    public List<Field> infer(Expression expr, Map<String, Field> uniqueFields, InferenceScope scope) {
        if (expr instanceof AllTableColumns) {
            String table = Names.normalize(((AllTableColumns) expr).getTable().getName());
            return new ArrayList<>(requireReference(table, scope, expr).getFields());
        }
        if (expr instanceof AllColumns) {
            if (scope.getReferences().isEmpty()) {
                throw new UnsupportedConstructException("SELECT * with no tables specified is not valid", expr.toString());
            }
            List<Field> fields = new ArrayList<>();
            for (RelationBinding relation : scope.getReferences().values()) {
                fields.addAll(relation.getFields());
            }
            return fields;
        }
        if (expr instanceof Column) {
            Column column = (Column) expr;
            if (column.getTable() == null || column.getTable().getName() == null) {
                String name = Names.normalize(column.getColumnName());
                if (!uniqueFields.containsKey(name) && scope.getReference(name) != null) {
                    return new ArrayList<>(scope.getReference(name).getFields());
                }
            }
        }
        return List.of(inferSingle(expr, uniqueFields, scope));
    }

    /**
     * Subscripts and slices. JSqlParser keeps a subscript on a plain column reference
     * inside the {@link Column} itself.
     */
    static boolean isIndirection(Expression expr) {
        return expr instanceof ArrayExpression
                || (expr instanceof Column && ((Column) expr).getArrayConstructor() != null);
    }

    /**
     * JSON shape of an expression.
     */
    public StructuralType inferJson(Expression expr, Map<String, Field> uniqueFields, InferenceScope scope) {
        return json.shapeOf(inferSingle(expr, uniqueFields, scope), scope);
    }

    /**
     * The single field an expression evaluates to.
     */
    public Field inferSingle(Expression expr, Map<String, Field> uniqueFields, InferenceScope scope) {
        if (isIndirection(expr)) {
            throw new UnsupportedConstructException("Indirection is not supported", expr.toString());
        }
        if (expr instanceof Column) {
            return inferColumn((Column) expr, uniqueFields, scope);
        }
        if (expr instanceof LongValue) {
            BigInteger value = new BigInteger(((LongValue) expr).getStringValue().trim());
            int oid = value.compareTo(INT4_MIN) >= 0 && value.compareTo(INT4_MAX) <= 0 ? BuiltinTypes.INT4
                    : value.compareTo(INT8_MIN) >= 0 && value.compareTo(INT8_MAX) <= 0 ? BuiltinTypes.INT8
                    : BuiltinTypes.NUMERIC;
            return new Field(ANONYMOUS, oid, false);
        }
        if (expr instanceof DoubleValue) {
            return new Field(ANONYMOUS, BuiltinTypes.NUMERIC, false);
        }
        if (expr instanceof StringValue) {
            return new Field(ANONYMOUS, BuiltinTypes.TEXT, false);
        }
        if (expr instanceof NullValue) {
            return new Field(ANONYMOUS, BuiltinTypes.UNKNOWN, true);
        }
        if (expr instanceof SignedExpression) {
            return inferSingle(((SignedExpression) expr).getExpression(), uniqueFields, scope).withName(ANONYMOUS);
        }
        if (expr instanceof ParenthesedExpressionList) {
            ParenthesedExpressionList<?> list = (ParenthesedExpressionList<?>) expr;
            if (list.size() == 1) {
                return inferSingle(list.get(0), uniqueFields, scope);
            }
            throw new UnsupportedConstructException("Row constructors are not supported", expr.toString());
        }
        if (expr instanceof CastExpression) {
            return inferCast((CastExpression) expr, uniqueFields, scope);
        }
        if (expr instanceof Function) {
            return inferFunction((Function) expr, uniqueFields, scope);
        }
        if (expr instanceof AnalyticExpression) {
            AnalyticExpression analytic = (AnalyticExpression) expr;
            List<Expression> args = new ArrayList<>();
            if (analytic.getExpression() != null) {
                args.add(analytic.getExpression());
            }
            return inferCall(analytic.getName(), args, uniqueFields, scope, expr.toString());
        }
        if (expr instanceof CaseExpression) {
            return inferCase((CaseExpression) expr, uniqueFields, scope);
        }
        if (expr instanceof ArrayConstructor) {
            return inferArrayConstructor((ArrayConstructor) expr, uniqueFields, scope);
        }
        if (expr instanceof ParenthesedSelect) {
            List<Field> fields = engine.selects().inferSelect((ParenthesedSelect) expr, scope.fork());
            return fields.get(0);
        }
        if (expr instanceof TimeKeyExpression) {
            return inferTimeKeyword(((TimeKeyExpression) expr).getStringValue(), expr);
        }
        if (expr instanceof ExtractExpression) {
            Field source = inferSingle(((ExtractExpression) expr).getExpression(), uniqueFields, scope);
            return new Field("extract", BuiltinTypes.NUMERIC, source.isNullable());
        }
        if (expr instanceof IntervalExpression) {
            return new Field(ANONYMOUS, BuiltinTypes.oidOf("interval"), false);
        }
        if (expr instanceof CollateExpression) {
            return inferSingle(((CollateExpression) expr).getLeftExpression(), uniqueFields, scope);
        }
        if (expr instanceof JsonExpression) {
            return inferJsonAccess((JsonExpression) expr, uniqueFields, scope);
        }
        if (expr instanceof JsonFunction) {
            StructuralType shape = json.shapeOfJsonFunction((JsonFunction) expr, this, uniqueFields, scope);
            return new Field(ANONYMOUS, BuiltinTypes.JSON, false, 0, shape);
        }
        if (expr instanceof IsNullExpression || expr instanceof ExistsExpression) {
            return new Field(ANONYMOUS, BuiltinTypes.BOOL, false);
        }
        if (expr instanceof NotExpression) {
            Field operand = inferSingle(((NotExpression) expr).getExpression(), uniqueFields, scope);
            return new Field(ANONYMOUS, BuiltinTypes.BOOL, operand.isNullable());
        }
        if (expr instanceof InExpression || expr instanceof Between) {
            return new Field(ANONYMOUS, BuiltinTypes.BOOL, true);
        }
        if (expr instanceof Concat) {
            return inferConcat((Concat) expr, uniqueFields, scope);
        }
        if (expr instanceof Addition || expr instanceof Subtraction || expr instanceof Multiplication
                || expr instanceof Division || expr instanceof Modulo) {
            return inferArithmetic((BinaryExpression) expr, uniqueFields, scope);
        }
        if (expr instanceof ComparisonOperator || expr instanceof LikeExpression || expr instanceof SimilarToExpression
                || expr instanceof AndExpression || expr instanceof OrExpression) {
            BinaryExpression binary = (BinaryExpression) expr;
            Field left = inferSingle(binary.getLeftExpression(), uniqueFields, scope);
            Field right = inferSingle(binary.getRightExpression(), uniqueFields, scope);
            return new Field(ANONYMOUS, BuiltinTypes.BOOL, left.isNullable() || right.isNullable());
        }
        String text = expr.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return new Field("bool", BuiltinTypes.BOOL, false);
        }
        throw new UnsupportedConstructException("Unsupported expression: " + expr.getClass().getSimpleName(), text);
    }

    /**
     * Like {@link #inferSingle}, except that a bare relation name stands for the whole
     * row: a record whose JSON shape is an object of the relation's fields.
     */
    Field inferArgument(Expression expr, Map<String, Field> uniqueFields, InferenceScope scope) {
        RelationBinding row = null;
        if (expr instanceof AllTableColumns) {
            row = requireReference(Names.normalize(((AllTableColumns) expr).getTable().getName()), scope, expr);
        } else if (expr instanceof Column && ((Column) expr).getTable() == null) {
            String name = Names.normalize(((Column) expr).getColumnName());
            if (!uniqueFields.containsKey(name)) {
                row = scope.getReference(name);
            }
        }
        if (row == null) {
            return inferSingle(expr, uniqueFields, scope);
        }
        Map<String, StructuralType> shape = new LinkedHashMap<>();
        for (Field field : row.getFields()) {
            shape.put(field.getName(), json.shapeOf(field, scope));
        }
        return new Field(ANONYMOUS, BuiltinTypes.RECORD, false, 0, new ObjectType(shape, false));
    }

    private Field inferColumn(Column column, Map<String, Field> uniqueFields, InferenceScope scope) {
        String name = Names.normalize(column.getColumnName());
        if (column.getTable() == null || column.getTable().getName() == null) {
            Field field = uniqueFields.get(name);
            if (field != null) {
                return field;
            }
            if ("true".equals(name) || "false".equals(name)) {
                return new Field("bool", BuiltinTypes.BOOL, false);
            }
            Field parameter = scope.findParameter(name);
            if (parameter != null) {
                return parameter;
            }
            if (TIME_KEYWORDS.contains(name)) {
                return inferTimeKeyword(name, column);
            }
            int exposures = 0;
            for (RelationBinding relation : scope.getReferences().values()) {
                for (Field candidate : relation.getFields()) {
                    if (candidate.getName().equals(name)) exposures++;
                }
            }
            if (exposures > 1) {
                throw new ColumnNotFoundException("Column reference \"" + name + "\" is ambiguous", name, true, column.toString());
            }
            throw new ColumnNotFoundException("Column \"" + name + "\" does not exist", name, false, column.toString());
        }
        String table = Names.normalize(column.getTable().getName());
        RelationBinding relation = requireReference(table, scope, column);
        Field field = relation.getField(name);
        if (field == null) {
            throw new ColumnNotFoundException("Column \"" + table + "\".\"" + name + "\" does not exist", name, false,
                    column.toString());
        }
        return field;
    }

    private RelationBinding requireReference(String name, InferenceScope scope, Expression construct) {
        RelationBinding relation = scope.getReference(name);
        if (relation == null) {
            throw new UnsupportedConstructException("Missing FROM-clause entry for table \"" + name + "\"", construct.toString());
        }
        return relation;
    }

    private static final Set<String> TIME_KEYWORDS = Set.of("current_timestamp", "current_date", "current_time",
            "localtimestamp", "localtime", "current_user", "session_user", "current_role", "user");

    private Field inferTimeKeyword(String keyword, Expression construct) {
        String name = keyword.trim().toLowerCase();
        int paren = name.indexOf('(');
        if (paren >= 0) name = name.substring(0, paren).trim();
        String type;
        switch (name) {
            case "current_timestamp":
            case "now":
                type = "timestamptz";
                break;
            case "current_date":
                type = "date";
                break;
            case "current_time":
                type = "timetz";
                break;
            case "localtimestamp":
                type = "timestamp";
                break;
            case "localtime":
                type = "time";
                break;
            case "current_user":
            case "session_user":
            case "current_role":
            case "user":
                type = "name";
                break;
            default:
                throw new UnsupportedConstructException("Unsupported keyword: " + keyword, construct.toString());
        }
        return new Field(name, BuiltinTypes.oidOf(type), false);
    }

    /**
     * A cast keeps the name of a named operand; a literal operand is named after the target type.
     */
    private Field inferCast(CastExpression cast, Map<String, Field> uniqueFields, InferenceScope scope) {
        Field operand = inferArgument(cast.getLeftExpression(), uniqueFields, scope);
        TypeName type = TypeNameParser.parse(cast.getColDataType().toString(), scope.getDefaultSchema());
        int oid = scope.getTypeOid(type.elementType());
        String name = ANONYMOUS.equals(operand.getName()) ? type.getId().getName() : operand.getName();
        StructuralType shape = TypeClassifier.isJson(type.elementType()) && type.getArrayDims() == 0
                ? operand.getJsonType() : null;
        return new Field(name, oid, operand.isNullable(), type.getArrayDims(), shape);
    }

    private Field inferFunction(Function function, Map<String, Field> uniqueFields, InferenceScope scope) {
        List<Expression> args = arguments(function.getParameters());
        String name = Names.toIdentifier(function.getName(), scope.getDefaultSchema()).getName();
        if ("array".equals(name) && args.size() == 1 && args.get(0) instanceof ParenthesedSelect) {
            return arraySublink((ParenthesedSelect) args.get(0), scope);
        }
        return inferCall(function.getName(), args, uniqueFields, scope, function.toString());
    }

    private Field inferCall(String qualifiedName, List<Expression> args, Map<String, Field> uniqueFields,
                            InferenceScope scope, String construct) {
        List<Field> argFields = new ArrayList<>(args.size());
        for (Expression arg : args) {
            argFields.add(inferArgument(arg, uniqueFields, scope));
        }
        Field result = scope.getReturnType(qualifiedName, argFields, construct);
        String name = Names.toIdentifier(qualifiedName, scope.getDefaultSchema()).getName();
        StructuralType shape = json.shapeOfCall(name, args, argFields, result, scope);
        return shape == null ? result : result.withJsonType(shape);
    }

    private static List<Expression> arguments(ExpressionList<?> parameters) {
        List<Expression> args = new ArrayList<>();
        if (parameters != null) {
            for (Expression parameter : parameters) {
                // count(*)
                if (!(parameter instanceof AllColumns) || parameter instanceof AllTableColumns) {
                    args.add(parameter);
                }
            }
        }
        return args;
    }

    /**
     * Type of the first branch with a resolved type. Nullable without an ELSE branch. A
     * JSON result carries the union of the branch shapes.
     */
    private Field inferCase(CaseExpression caseExpr, Map<String, Field> uniqueFields, InferenceScope scope) {
        List<Expression> branches = new ArrayList<>();
        for (WhenClause when : caseExpr.getWhenClauses()) {
            branches.add(when.getThenExpression());
        }
        boolean hasElse = caseExpr.getElseExpression() != null;
        if (hasElse) {
            branches.add(caseExpr.getElseExpression());
        }
        Field typed = null;
        boolean nullable = !hasElse;
        List<Field> fields = new ArrayList<>();
        for (Expression branch : branches) {
            Field field = inferArgument(branch, uniqueFields, scope);
            fields.add(field);
            nullable |= field.isNullable();
            if (typed == null && field.getTypeOid() != BuiltinTypes.UNKNOWN) {
                typed = field;
            }
        }
        if (typed == null) {
            return new Field("case", BuiltinTypes.TEXT, true);
        }
        Field result = new Field("case", typed.getTypeOid(), nullable, typed.getDims(), null);
        if (result.getDims() == 0 && TypeClassifier.isJson(scope.getTypeName(result.getTypeOid()))) {
            StructuralType union = null;
            for (int i = 0; i < branches.size(); i++) {
                if (!(branches.get(i) instanceof NullValue)) {
                    union = StructuralType.union(union, json.shapeOf(fields.get(i), scope));
                }
            }
            if (union != null) {
                result = result.withJsonType(nullable ? union.withNullable(true) : union);
            }
        }
        return result;
    }

    private Field inferArrayConstructor(ArrayConstructor array, Map<String, Field> uniqueFields, InferenceScope scope) {
        List<Expression> elements = new ArrayList<>();
        if (array.getExpressions() != null) {
            for (Expression element : array.getExpressions()) {
                elements.add(element);
            }
        }
        if (elements.size() == 1 && elements.get(0) instanceof ParenthesedSelect) {
            return arraySublink((ParenthesedSelect) elements.get(0), scope);
        }
        Field typed = null;
        for (Expression element : elements) {
            Field field = inferArgument(element, uniqueFields, scope);
            if (typed == null && field.getTypeOid() != BuiltinTypes.UNKNOWN) {
                typed = field;
            }
        }
        if (typed == null) {
            throw new UnsupportedConstructException("Cannot determine type of empty array", array.toString());
        }
        return new Field("array", typed.getTypeOid(), false, typed.getDims() + 1, null);
    }

    /**
     * {@code ARRAY(SELECT ...)} collects the first column of every row.
     */
    private Field arraySublink(ParenthesedSelect select, InferenceScope scope) {
        Field first = engine.selects().inferSelect(select, scope.fork()).get(0);
        return new Field("array", first.getTypeOid(), false, first.getDims() + 1, null);
    }

    /**
     * {@code ->>} and {@code #>>} yield text, {@code ->} and {@code #>} yield the operand's
     * JSON type; either may be null for a missing key.
     */
    private Field inferJsonAccess(JsonExpression access, Map<String, Field> uniqueFields, InferenceScope scope) {
        if (lastJsonOperatorIsText(access.toString())) {
            return new Field(ANONYMOUS, BuiltinTypes.TEXT, true);
        }
        Field base = inferSingle(access.getExpression(), uniqueFields, scope);
        return new Field(ANONYMOUS, base.getTypeOid(), true, base.getDims(), null);
    }

    static boolean lastJsonOperatorIsText(String text) {
        boolean textResult = false;
        boolean quoted = false;
        for (int i = 0; i + 1 < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && (c == '-' || c == '#') && text.charAt(i + 1) == '>') {
                textResult = i + 2 < text.length() && text.charAt(i + 2) == '>';
                i += textResult ? 2 : 1;
            }
        }
        return textResult;
    }

    private Field inferConcat(Concat concat, Map<String, Field> uniqueFields, InferenceScope scope) {
        Field left = inferSingle(concat.getLeftExpression(), uniqueFields, scope);
        Field right = inferSingle(concat.getRightExpression(), uniqueFields, scope);
        boolean nullable = left.isNullable() || right.isNullable();
        if (left.getTypeOid() == BuiltinTypes.JSONB || right.getTypeOid() == BuiltinTypes.JSONB) {
            return new Field(ANONYMOUS, BuiltinTypes.JSONB, nullable);
        }
        if (left.getDims() > 0 || right.getDims() > 0) {
            Field array = left.getDims() > 0 ? left : right;
            return new Field(ANONYMOUS, array.getTypeOid(), nullable, array.getDims(), null);
        }
        return new Field(ANONYMOUS, BuiltinTypes.TEXT, nullable);
    }

    /**
     * Mixed numeric operands widen along {@code int2 < int4 < int8 < numeric < float4 < float8};
     * other operands take the type of the left side.
     */
    private Field inferArithmetic(BinaryExpression binary, Map<String, Field> uniqueFields, InferenceScope scope) {
        Field left = inferSingle(binary.getLeftExpression(), uniqueFields, scope);
        Field right = inferSingle(binary.getRightExpression(), uniqueFields, scope);
        boolean nullable = left.isNullable() || right.isNullable();
        Field typed = left.getTypeOid() == BuiltinTypes.UNKNOWN ? right : left;
        String leftName = BuiltinTypes.nameOf(left.getTypeOid());
        String rightName = BuiltinTypes.nameOf(right.getTypeOid());
        if (left.getDims() == 0 && right.getDims() == 0 && leftName != null && rightName != null
                && NUMERIC_ORDER_NAMES.contains(leftName) && NUMERIC_ORDER_NAMES.contains(rightName)) {
            typed = NUMERIC_ORDER.indexOf(rightName) > NUMERIC_ORDER.indexOf(leftName) ? right : left;
        }
        return new Field(ANONYMOUS, typed.getTypeOid(), nullable, typed.getDims(), null);
    }
}
