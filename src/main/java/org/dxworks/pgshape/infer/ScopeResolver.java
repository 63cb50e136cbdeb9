package org.dxworks.pgshape.infer;

import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.LateralSubSelect;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.WithItem;
import org.dxworks.pgshape.error.UnsupportedConstructException;
import org.dxworks.pgshape.model.Field;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the relations named by WITH and FROM clauses into a scope.
 */
public class ScopeResolver {

    private final InferenceEngine engine;

    ScopeResolver(InferenceEngine engine) {
        this.engine = engine;
    }

    /**
     * Registers CTEs in declaration order. Each body is inferred in a fork of {@code scope},
     * so it sees the CTEs registered before it and nothing declared after it.
     */
    public void resolveWith(List<WithItem<?>> withItems, InferenceScope scope) {
        if (withItems == null) {
            return;
        }
        for (WithItem<?> item : withItems) {
            Select body;
            try {
                body = item.getSelect();
            } catch (ClassCastException e) {
                throw new UnsupportedConstructException("Only SELECT is supported in WITH", item.toString());
            }
            if (body == null) {
                throw new UnsupportedConstructException("Only SELECT is supported in WITH", item.toString());
            }
            List<Field> fields = engine.selects().inferSelect(body, scope.fork());
            RelationBinding cte = new RelationBinding(RelationKind.CTE, fields)
                    .withColumnAliases(columnNames(item.getWithItemList()), item.toString());
            scope.defineCte(Names.normalize(item.getAliasName()), cte);
        }
    }

    /**
     * Binds the FROM item and every joined item, left to right. Outer joins make the
     * fields of their optional side nullable.
     */
    public void resolveFrom(FromItem fromItem, List<Join> joins, InferenceScope scope) {
        if (fromItem == null) {
            return;
        }
        resolveItem(fromItem, scope);
        if (joins == null) {
            return;
        }
        for (Join join : joins) {
            List<String> before = new ArrayList<>(scope.getReferences().keySet());
            List<String> bound = resolveItem(join.getRightItem(), scope);
            if (join.isLeft() || join.isFull()) {
                markNullable(bound, scope);
            }
            if (join.isRight() || join.isFull()) {
                markNullable(before, scope);
            }
        }
    }

    /**
     * @return the names bound by this item
     */
    private List<String> resolveItem(FromItem item, InferenceScope scope) {
        if (item instanceof Table) {
            Table table = (Table) item;
            RelationBinding relation = null;
            if (table.getSchemaName() == null) {
                relation = scope.findCte(Names.normalize(table.getName()));
            }
            if (relation == null) {
                relation = scope.resolveRelation(table.getFullyQualifiedName(), table.toString());
            }
            String alias = Names.aliasName(table.getAlias());
            String name = alias != null ? alias : Names.normalize(table.getName());
            scope.bind(name, relation.withColumnAliases(RelationBinding.aliasColumns(table.getAlias()), table.toString()),
                    table.toString());
            return List.of(name);
        }
        if (item instanceof LateralSubSelect) {
            throw new UnsupportedConstructException("LATERAL subqueries are not supported", item.toString());
        }
        if (item instanceof ParenthesedSelect) {
            ParenthesedSelect subquery = (ParenthesedSelect) item;
            String alias = Names.aliasName(subquery.getAlias());
            if (alias == null) {
                throw new UnsupportedConstructException("Subquery in FROM must have an alias", subquery.toString());
            }
            List<Field> fields = engine.selects().inferSelect(subquery.getSelect(), scope.fork());
            RelationBinding relation = new RelationBinding(RelationKind.SUBQUERY, fields)
                    .withColumnAliases(RelationBinding.aliasColumns(subquery.getAlias()), subquery.toString());
            scope.bind(alias, relation, subquery.toString());
            return List.of(alias);
        }
        if (item instanceof ParenthesedFromItem) {
            ParenthesedFromItem nested = (ParenthesedFromItem) item;
            List<String> before = new ArrayList<>(scope.getReferences().keySet());
            resolveFrom(nested.getFromItem(), nested.getJoins(), scope);
            List<String> bound = new ArrayList<>(scope.getReferences().keySet());
            bound.removeAll(before);
            return bound;
        }
        throw new UnsupportedConstructException("Range functions are not supported", item.toString());
    }

    private static void markNullable(List<String> names, InferenceScope scope) {
        for (String name : names) {
            RelationBinding relation = scope.getReference(name);
            List<Field> fields = new ArrayList<>();
            for (Field field : relation.getFields()) {
                fields.add(field.withNullable(true));
            }
            scope.rebind(name, new RelationBinding(relation.getKind(), fields));
        }
    }

    private static List<String> columnNames(List<SelectItem<?>> items) {
        List<String> names = new ArrayList<>();
        if (items != null) {
            for (SelectItem<?> item : items) {
                names.add(Names.normalize(item.toString().trim()));
            }
        }
        return names;
    }
}
