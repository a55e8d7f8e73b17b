package com.dice.config;

import com.dice.eval.DiceEvaluator;

import java.util.Set;

/**
 * Root configuration for the dice engine.
 *
 * @param allowedSides Die sizes a roll may use
 * @param maxDice      Limit on dice rolled in one evaluation
 * @param randomSeed   Seed for the random roller, or null for an unseeded one
 * @param ansiColors   Whether text reports use ANSI colors
 */
public record DiceConfig(
        Set<Integer> allowedSides,
        int maxDice,
        Long randomSeed,
        boolean ansiColors
) {
    public DiceConfig {
        allowedSides = Set.copyOf(allowedSides);
    }

    /**
     * Standard dice, the default dice limit, unseeded, plain text reports.
     */
    public static DiceConfig defaults() {
        return new DiceConfig(DiceEvaluator.STANDARD_SIDES, DiceEvaluator.DEFAULT_MAX_DICE, null, false);
    }
}
