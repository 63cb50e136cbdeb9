package org.dxworks.pgshape.parser;

import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.TypeName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects every relation, function and cast type named in a view query. Names in
 * {@code pg_catalog} and {@code information_schema} are left out; unqualified names
 * belong to the view's schema.
 */
public final class ViewReferenceCollector {

    private static final Set<String> SYSTEM_SCHEMAS = Set.of(BuiltinTypes.SCHEMA, "information_schema");

    private ViewReferenceCollector() {
        // utility class
    }

    public static List<Identifier> collect(Select select, String viewSchema) {
        Set<Identifier> refs = new LinkedHashSet<>();
        for (String table : tableNames(select)) {
            add(SqlTextUtils.splitQualified(table), viewSchema, refs);
        }

        List<String> functions = new ArrayList<>();
        List<String> castTypes = new ArrayList<>();
        visitSelect(select, createVisitor(functions, castTypes));
        for (String function : functions) {
            add(SqlTextUtils.splitQualified(function), viewSchema, refs);
        }
        for (String castType : castTypes) {
            TypeName type = TypeNameParser.parse(castType, viewSchema);
            if (!SYSTEM_SCHEMAS.contains(type.getId().getSchema())) {
                refs.add(type.getId());
            }
        }
        return new ArrayList<>(refs);
    }

    private static List<String> tableNames(Select select) {
        try {
            TablesNamesFinder finder = new TablesNamesFinder();
            List<String> tables = finder.getTableList((Statement) select);
            if (tables == null) return List.of();
            // the finder collects into a hash set
            List<String> sorted = new ArrayList<>(tables);
            Collections.sort(sorted);
            return sorted;
        } catch (UnsupportedOperationException e) {
            // Some constructs are not supported by TablesNamesFinder; the query is still walked for routines
            return List.of();
        }
    }

    private static void add(List<String> parts, String defaultSchema, Collection<Identifier> sink) {
        if (parts.isEmpty()) return;
        String name = parts.get(parts.size() - 1);
        String schema = parts.size() > 1 ? parts.get(parts.size() - 2) : defaultSchema;
        if (name == null || name.isEmpty() || SYSTEM_SCHEMAS.contains(schema)) return;
        sink.add(new Identifier(schema, name));
    }

    private static ExpressionVisitorAdapter<Void> createVisitor(Collection<String> functions, Collection<String> castTypes) {
        return new ExpressionVisitorAdapter<Void>() {
            @Override
            public <S> Void visit(Function function, S context) {
                if (function.getName() != null && !function.getName().isEmpty()) {
                    functions.add(function.getName());
                }
                return super.visit(function, context);
            }

            @Override
            public <S> Void visit(CastExpression cast, S context) {
                if (cast.getColDataType() != null) {
                    castTypes.add(cast.getColDataType().toString());
                }
                return super.visit(cast, context);
            }

            @Override
            public <S> Void visit(ParenthesedSelect subSelect, S context) {
                visitSelect(subSelect, this);
                return null;
            }
        };
    }

    private static void visitExpression(Expression expr, ExpressionVisitorAdapter<Void> visitor) {
        if (expr != null) {
            expr.accept(visitor);
        }
    }

    private static void visitSelect(Select select, ExpressionVisitorAdapter<Void> visitor) {
        if (select == null) return;

        if (select.getWithItemsList() != null) {
            for (WithItem<?> wi : select.getWithItemsList()) {
                if (wi.getSelect() != null) {
                    visitSelect(wi.getSelect(), visitor);
                }
            }
        }

        if (select instanceof ParenthesedSelect) {
            visitSelect(((ParenthesedSelect) select).getSelect(), visitor);
        } else if (select instanceof PlainSelect) {
            PlainSelect ps = (PlainSelect) select;
            if (ps.getSelectItems() != null) {
                for (SelectItem<?> si : ps.getSelectItems()) {
                    visitExpression(si.getExpression(), visitor);
                }
            }
            visitFromItem(ps.getFromItem(), visitor);
            if (ps.getJoins() != null) {
                for (Join j : ps.getJoins()) {
                    visitFromItem(j.getRightItem(), visitor);
                    if (j.getOnExpressions() != null) {
                        for (Expression e : j.getOnExpressions()) {
                            visitExpression(e, visitor);
                        }
                    }
                }
            }
            visitExpression(ps.getWhere(), visitor);
            visitExpression(ps.getHaving(), visitor);
            if (ps.getOrderByElements() != null) {
                for (OrderByElement o : ps.getOrderByElements()) {
                    visitExpression(o.getExpression(), visitor);
                }
            }
        } else if (select instanceof SetOperationList) {
            for (Select s : ((SetOperationList) select).getSelects()) {
                visitSelect(s, visitor);
            }
        }
    }

    private static void visitFromItem(FromItem item, ExpressionVisitorAdapter<Void> visitor) {
        if (item instanceof Select) {
            visitSelect((Select) item, visitor);
        }
    }
}
