package com.dice.ast;

import java.util.Objects;

/**
 * Integer multiplication.
 *
 * @param left  Left operand
 * @param right Right operand
 */
public record Multiply(Node left, Node right) implements BinaryNode {

    public Multiply {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}
