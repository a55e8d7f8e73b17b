package com.dice.exception;

/**
 * Exception thrown when a parsed expression cannot be evaluated.
 */
public class EvaluationException extends DiceException {

    /**
     * Why evaluation stopped.
     */
    public enum Reason {
        INVALID_SIDES,
        INVALID_COUNT,
        DIVIDE_BY_ZERO,
        ARITHMETIC_OVERFLOW
    }

    private final Reason reason;

    public EvaluationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EvaluationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
