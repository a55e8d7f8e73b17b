package com.dice.eval;

/**
 * One physical die resolved during evaluation.
 *
 * @param sides Number of faces
 * @param value Face value rolled
 * @param kept  Whether the die counts toward its roll's total after all selectors
 */
public record DieOutcome(int sides, int value, boolean kept) {
}
