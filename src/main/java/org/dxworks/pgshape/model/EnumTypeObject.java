package org.dxworks.pgshape.model;

import java.util.List;

public class EnumTypeObject extends SchemaObject {

    private final List<String> labels;

    public EnumTypeObject(Identifier id, SourceSpan span, List<String> labels) {
        super(id, span);
        this.labels = List.copyOf(labels);
    }

    @Override
    public ObjectKind getKind() {
        return ObjectKind.ENUM_TYPE;
    }

    public List<String> getLabels() {
        return labels;
    }
}
