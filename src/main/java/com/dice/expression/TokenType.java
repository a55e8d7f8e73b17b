package com.dice.expression;

/**
 * Token types for dice expression parsing.
 */
public enum TokenType {
    // Literals
    INTEGER,

    // Arithmetic operators
    PLUS,
    MINUS,
    STAR,
    SLASH,

    // Grouping
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,

    // Dice
    DIE,
    SELECTOR,
    PERCENT,

    // Special
    EOF
}
