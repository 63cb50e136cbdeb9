package org.dxworks.pgshape.infer;

import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SetOperationList;
import org.dxworks.pgshape.error.UnsupportedConstructException;
import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.json.StructuralType;

import java.util.ArrayList;
import java.util.List;

/**
 * Infers the output fields of a SELECT: WITH first, then FROM, then the target list.
 */
public class SelectInferrer {

    private final InferenceEngine engine;

    SelectInferrer(InferenceEngine engine) {
        this.engine = engine;
    }

    public List<Field> inferSelect(Select select, InferenceScope scope) {
        if (select instanceof ParenthesedSelect) {
            ParenthesedSelect parenthesed = (ParenthesedSelect) select;
            engine.scopes().resolveWith(parenthesed.getWithItemsList(), scope);
            return inferSelect(parenthesed.getSelect(), scope);
        }
        if (select instanceof PlainSelect) {
            return inferPlainSelect((PlainSelect) select, scope);
        }
        if (select instanceof SetOperationList) {
            return inferSetOperation((SetOperationList) select, scope);
        }
        throw new UnsupportedConstructException("Unsupported query: " + select.getClass().getSimpleName(),
                select.toString());
    }

    private List<Field> inferPlainSelect(PlainSelect select, InferenceScope scope) {
        engine.scopes().resolveWith(select.getWithItemsList(), scope);
        engine.scopes().resolveFrom(select.getFromItem(), select.getJoins(), scope);
        List<Field> fields = engine.expressions().inferTargetList(select.getSelectItems(), scope);
        if (fields.isEmpty()) {
            throw new UnsupportedConstructException("Query has no result columns", select.toString());
        }
        return fields;
    }

    /**
     * Column names come from the first branch. A column is nullable if it is nullable in
     * any branch, and JSON shapes of the branches are unioned.
     */
    private List<Field> inferSetOperation(SetOperationList setOperation, InferenceScope scope) {
        engine.scopes().resolveWith(setOperation.getWithItemsList(), scope);
        List<Field> result = null;
        for (Select branch : setOperation.getSelects()) {
            List<Field> fields = inferSelect(branch, scope.fork());
            if (result == null) {
                result = new ArrayList<>(fields);
                continue;
            }
            if (fields.size() != result.size()) {
                throw new UnsupportedConstructException("Each set operation query must have the same number of columns",
                        branch.toString());
            }
            for (int i = 0; i < result.size(); i++) {
                Field merged = result.get(i);
                Field other = fields.get(i);
                merged = merged.withNullable(merged.isNullable() || other.isNullable());
                if (merged.getJsonType() != null && other.getJsonType() != null) {
                    merged = merged.withJsonType(StructuralType.union(merged.getJsonType(), other.getJsonType()));
                }
                result.set(i, merged);
            }
        }
        if (result == null) {
            throw new UnsupportedConstructException("Empty set operation", setOperation.toString());
        }
        return result;
    }
}
