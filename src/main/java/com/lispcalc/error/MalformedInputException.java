package com.lispcalc.error;

/** Structural grammar violation found by the parser (or by {@code AstJson.fromJson}). */
public class MalformedInputException extends LispCalcException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public MalformedInputException(int line, String message) {
        super("[line " + line + "] " + message);
        this.line = line;
    }

    public MalformedInputException(int line, String message, Throwable cause) {
        super("[line " + line + "] " + message, cause);
        this.line = line;
    }

    /** 1-based source line, or 0 when the input did not come from source text. */
    public int getLine() {
        return line;
    }
}
