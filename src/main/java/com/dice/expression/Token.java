package com.dice.expression;

/**
 * Represents a token in a dice expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Parsed value (Integer for INTEGER, SelectorKind for SELECTOR)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, Object literal, int position) {

    /**
     * Human-readable description used in parse errors.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of input";
        }
        return "'" + text + "'";
    }

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
