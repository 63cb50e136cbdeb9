package org.dxworks.pgshape.analyzer;

import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.SchemaObject;
import org.dxworks.pgshape.model.TypeCategory;
import org.dxworks.pgshape.model.json.StructuralType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result shape of one analyzed object. The lists are parallel: the {@code i}th field has
 * the {@code i}th type name, category and JSON shape. Shapes are {@code null} when shape
 * inference is disabled.
 */
public class ObjectResult {

    private final SchemaObject object;
    private final List<Field> fields;
    private final List<String> typeNames;
    private final List<TypeCategory> categories;
    private final List<StructuralType> shapes;

    public ObjectResult(SchemaObject object, List<Field> fields, List<String> typeNames,
                        List<TypeCategory> categories, List<StructuralType> shapes) {
        this.object = object;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.typeNames = Collections.unmodifiableList(new ArrayList<>(typeNames));
        this.categories = Collections.unmodifiableList(new ArrayList<>(categories));
        this.shapes = Collections.unmodifiableList(new ArrayList<>(shapes));
    }

    public SchemaObject getObject() {
        return object;
    }

    public List<Field> getFields() {
        return fields;
    }

    public List<String> getTypeNames() {
        return typeNames;
    }

    public List<TypeCategory> getCategories() {
        return categories;
    }

    public List<StructuralType> getShapes() {
        return shapes;
    }

    public Field getField(String name) {
        for (Field field : fields) {
            if (field.getName().equals(name)) return field;
        }
        return null;
    }

    public StructuralType getShape(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).getName().equals(name)) return shapes.get(i);
        }
        return null;
    }
}
