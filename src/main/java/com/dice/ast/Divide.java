package com.dice.ast;

import java.util.Objects;

/**
 * Integer division, flooring toward negative infinity.
 *
 * @param left  Left operand
 * @param right Right operand
 */
public record Divide(Node left, Node right) implements BinaryNode {

    public Divide {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}
