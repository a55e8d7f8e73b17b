package com.dice.exception;

/**
 * Exception thrown when a token sequence does not match the dice grammar.
 */
public class ParseException extends DiceException {

    private final int position;
    private final String expected;
    private final String found;

    public ParseException(String message, int position, String expected, String found) {
        super(message);
        this.position = position;
        this.expected = expected;
        this.found = found;
    }

    /**
     * Zero-based character offset of the token that could not be parsed.
     */
    public int getPosition() {
        return position;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
