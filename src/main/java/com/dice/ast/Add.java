package com.dice.ast;

import java.util.Objects;

/**
 * Integer addition.
 *
 * @param left  Left operand
 * @param right Right operand
 */
public record Add(Node left, Node right) implements BinaryNode {

    public Add {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}
