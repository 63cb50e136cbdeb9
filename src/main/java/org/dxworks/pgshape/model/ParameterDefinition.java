package org.dxworks.pgshape.model;

public class ParameterDefinition {

    public enum Mode { IN, OUT, INOUT, VARIADIC, TABLE }

    public String name;
    public TypeName type;
    public Mode mode = Mode.IN;

    public ParameterDefinition() {
    }

    public ParameterDefinition(String name, TypeName type, Mode mode) {
        this.name = name;
        this.type = type;
        this.mode = mode;
    }

    public boolean isInput() {
        return mode == Mode.IN || mode == Mode.INOUT || mode == Mode.VARIADIC;
    }

    public boolean isOutput() {
        return mode == Mode.OUT || mode == Mode.INOUT || mode == Mode.TABLE;
    }
}
