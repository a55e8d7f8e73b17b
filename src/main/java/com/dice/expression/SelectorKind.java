package com.dice.expression;

/**
 * Selector keywords recognized by the tokenizer.
 */
public enum SelectorKind {
    KEEP_HIGH,
    KEEP_LOW,
    DISCARD_HIGH,
    DISCARD_LOW,
    ADVANTAGE,
    DISADVANTAGE;

    /**
     * Whether the keyword may be followed by a die count.
     */
    public boolean takesCount() {
        return this != ADVANTAGE && this != DISADVANTAGE;
    }
}
