package com.dice.expression;

import java.util.Map;

/**
 * Configuration for dice expression keywords and operators.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * The die marker. Also means "discard lowest" when it follows a roll.
     */
    public static final String DIE_WORD = "d";

    /**
     * Selector keywords mapped to their kind. Matched after lower-casing.
     */
    public static final Map<String, SelectorKind> SELECTOR_WORDS = Map.ofEntries(
            // Keep
            Map.entry("k", SelectorKind.KEEP_HIGH),
            Map.entry("kh", SelectorKind.KEEP_HIGH),
            Map.entry("kl", SelectorKind.KEEP_LOW),

            // Discard ("d" is handled as DIE_WORD)
            Map.entry("dh", SelectorKind.DISCARD_HIGH),
            Map.entry("dl", SelectorKind.DISCARD_LOW),

            // Reroll
            Map.entry("adv", SelectorKind.ADVANTAGE),
            Map.entry("ad", SelectorKind.ADVANTAGE),
            Map.entry("dis", SelectorKind.DISADVANTAGE),
            Map.entry("da", SelectorKind.DISADVANTAGE)
    );

    /**
     * Single-character operator symbols mapped to token types.
     */
    public static final Map<Character, TokenType> SYMBOLS = Map.ofEntries(
            Map.entry(Operators.PLUS, TokenType.PLUS),
            Map.entry(Operators.MINUS, TokenType.MINUS),
            Map.entry(Operators.STAR, TokenType.STAR),
            Map.entry(Operators.TIMES, TokenType.STAR),
            Map.entry(Operators.SLASH, TokenType.SLASH),
            Map.entry(Operators.DIVIDE, TokenType.SLASH),
            Map.entry(Operators.PERCENT, TokenType.PERCENT),
            Map.entry(Operators.LEFT_PAREN, TokenType.LPAREN),
            Map.entry(Operators.RIGHT_PAREN, TokenType.RPAREN),
            Map.entry(Operators.LEFT_BRACKET, TokenType.LBRACKET),
            Map.entry(Operators.RIGHT_BRACKET, TokenType.RBRACKET)
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char PLUS = '+';
        public static final char MINUS = '-';
        public static final char STAR = '*';
        public static final char TIMES = '×';
        public static final char SLASH = '/';
        public static final char DIVIDE = '÷';
        public static final char PERCENT = '%';
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';

        private Operators() {
        }
    }
}
