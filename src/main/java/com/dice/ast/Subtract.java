package com.dice.ast;

import java.util.Objects;

/**
 * Integer subtraction.
 *
 * @param left  Left operand
 * @param right Right operand
 */
public record Subtract(Node left, Node right) implements BinaryNode {

    public Subtract {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}
