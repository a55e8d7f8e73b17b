package com.dice.eval;

import java.util.List;

/**
 * Result of evaluating a dice expression.
 *
 * @param total Value of the whole expression
 * @param trace Every die resolved, kept or dropped, in the order it was rolled
 */
public record EvaluationResult(int total, List<DieOutcome> trace) {

    public EvaluationResult {
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    /**
     * Dice that count toward the total.
     */
    public List<DieOutcome> keptDice() {
        return trace.stream().filter(DieOutcome::kept).toList();
    }
}
