package com.dice.roller;

import java.util.Objects;
import java.util.Random;

/**
 * Rolls dice from a {@link Random} source.
 */
public class RandomDieRoller implements DieRoller {

    private final Random random;

    public RandomDieRoller(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public int roll(int sides) {
        if (sides < 1) {
            throw new IllegalArgumentException("Die must have at least one side, got " + sides);
        }
        return random.nextInt(sides) + 1;
    }

    @Override
    public String toString() {
        return "RandomDieRoller";
    }
}
