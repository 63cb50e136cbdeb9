package org.dxworks.pgshape.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A function or procedure. The result is either a single {@link #getReturnType() type}
 * or a list of named {@link #getReturnColumns() columns} (RETURNS TABLE / OUT parameters).
 */
public class RoutineObject extends SchemaObject {

    private final List<ParameterDefinition> parameters;
    private final TypeName returnType;
    private final List<ColumnDefinition> returnColumns;
    private final boolean returnSet;
    private final boolean procedure;
    private final String language;
    private final String body;

    public RoutineObject(Identifier id, SourceSpan span, List<ParameterDefinition> parameters,
                         TypeName returnType, List<ColumnDefinition> returnColumns,
                         boolean returnSet, boolean procedure, String language, String body) {
        super(id, span);
        this.parameters = new ArrayList<>(parameters);
        this.returnType = returnType;
        this.returnColumns = new ArrayList<>(returnColumns);
        this.returnSet = returnSet;
        this.procedure = procedure;
        this.language = language;
        this.body = body;
    }

    @Override
    public ObjectKind getKind() {
        return ObjectKind.ROUTINE;
    }

    public List<ParameterDefinition> getParameters() {
        return parameters;
    }

    public TypeName getReturnType() {
        return returnType;
    }

    public List<ColumnDefinition> getReturnColumns() {
        return returnColumns;
    }

    public boolean isReturnSet() {
        return returnSet;
    }

    public boolean isProcedure() {
        return procedure;
    }

    public String getLanguage() {
        return language;
    }

    public String getBody() {
        return body;
    }

    public boolean isSqlLanguage() {
        return "sql".equalsIgnoreCase(language);
    }
}
