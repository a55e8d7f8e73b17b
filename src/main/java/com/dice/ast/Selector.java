package com.dice.ast;

/**
 * Modifier applied to the dice of a {@link Roll}, narrowing or re-deciding which dice
 * count toward its total.
 */
public sealed interface Selector permits Keep, Discard, Advantage, Disadvantage {

    /**
     * Count used when the expression omits one, e.g. {@code 3d6kh}.
     */
    int DEFAULT_COUNT = 1;
}
