package com.lispcalc.error;

/**
 * Base of every error the pipeline raises. All of them are fatal for the call that raised
 * them: nothing in the lexer, parser or evaluators catches and continues.
 */
public class LispCalcException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LispCalcException(String message) {
        super(message);
    }

    public LispCalcException(String message, Throwable cause) {
        super(message, cause);
    }
}
