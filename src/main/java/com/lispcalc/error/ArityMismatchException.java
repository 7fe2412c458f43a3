package com.lispcalc.error;

public class ArityMismatchException extends LispCalcException {

    private static final long serialVersionUID = 1L;

    private final String operator;
    private final int actual;

    public ArityMismatchException(String operator, String expected, int actual) {
        super(operator + "() expects " + expected + ", got " + actual);
        this.operator = operator;
        this.actual = actual;
    }

    public String getOperator() {
        return operator;
    }

    public int getActual() {
        return actual;
    }
}
