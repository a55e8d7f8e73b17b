package com.dice.ast;

/**
 * Integer constant.
 *
 * @param value Literal value
 */
public record Literal(int value) implements Node {
}
