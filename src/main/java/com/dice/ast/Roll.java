package com.dice.ast;

import java.util.List;
import java.util.Objects;

/**
 * Rolls {@code count} dice with {@code sides} faces, then applies the selectors left to right.
 * <p>
 * Count and sides are sub-expressions. The parser fills in {@code Literal(1)} and
 * {@code Literal(6)} when they are omitted, and {@code Literal(100)} for {@code %}.
 *
 * @param count     Number of dice
 * @param sides     Faces per die
 * @param selectors Selectors in source order
 */
public record Roll(Node count, Node sides, List<Selector> selectors) implements Node {

    public static final int DEFAULT_COUNT = 1;
    public static final int DEFAULT_SIDES = 6;
    public static final int PERCENTILE_SIDES = 100;

    public Roll {
        Objects.requireNonNull(count, "count must not be null");
        Objects.requireNonNull(sides, "sides must not be null");
        selectors = selectors == null ? List.of() : List.copyOf(selectors);
    }

    /**
     * Create a roll with literal count and sides.
     */
    public static Roll of(int count, int sides, Selector... selectors) {
        return new Roll(new Literal(count), new Literal(sides), List.of(selectors));
    }
}
