package com.dice.ast;

import java.util.Objects;

/**
 * Unary arithmetic negation.
 *
 * @param inner Negated operand
 */
public record Negate(Node inner) implements Node {

    public Negate {
        Objects.requireNonNull(inner, "inner must not be null");
    }
}
