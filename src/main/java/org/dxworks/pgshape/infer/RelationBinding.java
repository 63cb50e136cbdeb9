package org.dxworks.pgshape.infer;

import net.sf.jsqlparser.expression.Alias;
import org.dxworks.pgshape.error.UnsupportedConstructException;
import org.dxworks.pgshape.model.Field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A relation visible in a scope under some name, with its output fields in order.
 */
public final class RelationBinding {

    private final RelationKind kind;
    private final List<Field> fields;

    public RelationBinding(RelationKind kind, List<Field> fields) {
        this.kind = kind;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public RelationKind getKind() {
        return kind;
    }

    public List<Field> getFields() {
        return fields;
    }

    public Field getField(String name) {
        for (Field field : fields) {
            if (field.getName().equals(name)) {
                return field;
            }
        }
        return null;
    }

    /**
     * Renames fields positionally. Fields beyond the alias list keep their names.
     *
     * @throws UnsupportedConstructException if more names are given than the relation has fields
     */
    public RelationBinding withColumnAliases(List<String> names, String construct) {
        if (names == null || names.isEmpty()) {
            return this;
        }
        if (names.size() > fields.size()) {
            throw new UnsupportedConstructException("Relation has " + fields.size()
                    + " columns available but " + names.size() + " columns specified", construct);
        }
        List<Field> renamed = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            renamed.add(i < names.size() ? fields.get(i).withName(names.get(i)) : fields.get(i));
        }
        return new RelationBinding(kind, renamed);
    }

    static List<String> aliasColumns(Alias alias) {
        List<String> names = new ArrayList<>();
        if (alias != null && alias.getAliasColumns() != null) {
            for (Alias.AliasColumn column : alias.getAliasColumns()) {
                names.add(Names.normalize(column.name));
            }
        }
        return names;
    }
}
