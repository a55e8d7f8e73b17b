package com.dice.ast;

import java.util.Objects;

/**
 * Drops the {@code n} highest or lowest currently kept dice.
 *
 * @param mode HIGH or LOW
 * @param n    Number of dice to drop
 */
public record Discard(SelectMode mode, int n) implements Selector {

    public Discard {
        Objects.requireNonNull(mode, "mode must not be null");
    }
}
