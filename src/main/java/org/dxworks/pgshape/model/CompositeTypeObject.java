package org.dxworks.pgshape.model;

import java.util.ArrayList;
import java.util.List;

public class CompositeTypeObject extends SchemaObject {

    private final List<ColumnDefinition> attributes;

    public CompositeTypeObject(Identifier id, SourceSpan span, List<ColumnDefinition> attributes) {
        super(id, span);
        this.attributes = new ArrayList<>(attributes);
    }

    @Override
    public ObjectKind getKind() {
        return ObjectKind.COMPOSITE_TYPE;
    }

    public List<ColumnDefinition> getAttributes() {
        return attributes;
    }
}
