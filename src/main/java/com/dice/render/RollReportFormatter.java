package com.dice.render;

import com.dice.ast.Node;
import com.dice.eval.DieOutcome;
import com.dice.eval.EvaluationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Formats an evaluation as a human-readable report.
 * <pre>
 * 4d6kh3
 * [d6:6] [d6:4] [d6:4] ~[d6:1]~
 * total = 14
 * </pre>
 * The first line is the canonical expression. The second lists every die in trace order,
 * with dropped dice wrapped in {@code ~}; it is left out when no dice were rolled. With
 * ANSI colors enabled, kept dice are green and dropped dice red and struck through instead.
 */
public class RollReportFormatter {

    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String DEFAULT_COLOR = "\u001B[39m";
    private static final String STRIKE = "\u001B[9m";
    private static final String NO_STRIKE = "\u001B[29m";
    private static final String BOLD = "\u001B[1m";
    private static final String DIM = "\u001B[2m";
    private static final String NORMAL = "\u001B[22m";

    private final boolean ansiColors;

    public RollReportFormatter(boolean ansiColors) {
        this.ansiColors = ansiColors;
    }

    /**
     * Format a report.
     *
     * @param root   The evaluated expression
     * @param result Its evaluation
     * @return Report lines joined with '\n', without a trailing newline
     */
    public String format(Node root, EvaluationResult result) {
        List<String> lines = new ArrayList<>();
        lines.add(ExpressionPrinter.print(root));

        if (!result.trace().isEmpty()) {
            lines.add(result.trace().stream()
                    .map(this::formatDie)
                    .collect(Collectors.joining(" ")));
        }

        lines.add(formatTotal(result.total()));
        return String.join("\n", lines);
    }

    String formatDie(DieOutcome die) {
        String token = "[d" + die.sides() + ":" + die.value() + "]";
        if (ansiColors) {
            return die.kept()
                    ? GREEN + token + DEFAULT_COLOR
                    : STRIKE + RED + token + DEFAULT_COLOR + NO_STRIKE;
        }
        return die.kept() ? token : "~" + token + "~";
    }

    private String formatTotal(int total) {
        if (ansiColors) {
            return DIM + "total = " + NORMAL + BOLD + total + NORMAL;
        }
        return "total = " + total;
    }
}
