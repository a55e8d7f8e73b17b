package com.dice.roller;

/**
 * How die values are produced during evaluation.
 */
public enum RollMode {
    /**
     * Uniformly random value in [1, sides].
     */
    RANDOM,

    /**
     * Every die shows 1.
     */
    MIN,

    /**
     * Every die shows ceil(sides / 2).
     */
    MID,

    /**
     * Every die shows its highest face.
     */
    MAX
}
