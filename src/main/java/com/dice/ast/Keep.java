package com.dice.ast;

import java.util.Objects;

/**
 * Keeps the {@code n} highest or lowest currently kept dice and drops the rest.
 *
 * @param mode HIGH or LOW
 * @param n    Number of dice to keep
 */
public record Keep(SelectMode mode, int n) implements Selector {

    public Keep {
        Objects.requireNonNull(mode, "mode must not be null");
    }
}
