package com.dice.roller;

/**
 * Produces the face value of a single die.
 * <p>
 * Supplied by the caller for each evaluation. Implementations backed by a random source
 * should not share that source with concurrent evaluations unless it is thread-safe.
 */
@FunctionalInterface
public interface DieRoller {

    /**
     * Roll one die.
     *
     * @param sides Number of faces, at least 1
     * @return A value in {@code [1, sides]}
     */
    int roll(int sides);
}
