package com.dice.ast;

/**
 * A node in the dice expression syntax tree.
 * <p>
 * The tree is built once by the parser and never mutated afterwards. Each node owns its
 * children exclusively, so a tree has no sharing and no cycles. The set of node kinds is
 * closed:
 * <pre>
 * Node       := Literal | Negate | Roll | BinaryNode
 * BinaryNode := Add | Subtract | Multiply | Divide
 * </pre>
 */
public sealed interface Node permits Literal, Negate, Roll, BinaryNode {
}
