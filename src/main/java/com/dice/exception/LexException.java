package com.dice.exception;

/**
 * Exception thrown when an expression contains a character or word the tokenizer
 * does not recognize.
 */
public class LexException extends DiceException {

    private final int position;
    private final String offendingText;

    public LexException(String message, int position, String offendingText) {
        super(message);
        this.position = position;
        this.offendingText = offendingText;
    }

    /**
     * Zero-based character offset of the offending input.
     */
    public int getPosition() {
        return position;
    }

    public String getOffendingText() {
        return offendingText;
    }
}
