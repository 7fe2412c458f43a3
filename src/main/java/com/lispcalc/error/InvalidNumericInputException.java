package com.lispcalc.error;

/** Raised by {@code read} when the supplied line is missing or is not a base-10 int. */
public class InvalidNumericInputException extends LispCalcException {

    private static final long serialVersionUID = 1L;

    private final String input;

    public InvalidNumericInputException(String input, Throwable cause) {
        super(input == null
                ? "read: no input available"
                : "read: not an integer: '" + input + "'", cause);
        this.input = input;
    }

    /** The trimmed line that failed to parse, or null at end of input. */
    public String getInput() {
        return input;
    }
}
