package com.dice.roller;

/**
 * Deterministic roller for the MIN, MID and MAX modes.
 */
public enum FixedDieRoller implements DieRoller {

    MIN {
        @Override
        public int roll(int sides) {
            return 1;
        }
    },

    // ceil(sides / 2); equal to sides / 2 for every even die
    MID {
        @Override
        public int roll(int sides) {
            return (sides + 1) / 2;
        }
    },

    MAX {
        @Override
        public int roll(int sides) {
            return sides;
        }
    }
}
