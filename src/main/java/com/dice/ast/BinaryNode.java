package com.dice.ast;

/**
 * Arithmetic node with two operands.
 */
public sealed interface BinaryNode extends Node permits Add, Subtract, Multiply, Divide {

    Node left();

    Node right();
}
