package com.dice.roller;

import java.util.Random;

/**
 * Factory for creating DieRoller instances from a roll mode.
 */
public final class DieRollerFactory {

    private DieRollerFactory() {
    }

    /**
     * Create a DieRoller for the given mode.
     *
     * @param mode   Roll mode (null means RANDOM)
     * @param random Random source used by RANDOM mode
     * @return DieRoller instance
     */
    public static DieRoller create(RollMode mode, Random random) {
        if (mode == null) {
            mode = RollMode.RANDOM;
        }

        return switch (mode) {
            case RANDOM -> new RandomDieRoller(random);
            case MIN -> FixedDieRoller.MIN;
            case MID -> FixedDieRoller.MID;
            case MAX -> FixedDieRoller.MAX;
        };
    }
}
