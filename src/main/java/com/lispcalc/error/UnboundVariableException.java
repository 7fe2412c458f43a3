package com.lispcalc.error;

public class UnboundVariableException extends LispCalcException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public UnboundVariableException(String name) {
        super("Undefined variable: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
