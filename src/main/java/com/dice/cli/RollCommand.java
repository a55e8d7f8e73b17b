package com.dice.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A command line request: what to do, and with which expression.
 *
 * @param action     Requested action
 * @param expression Expression text, possibly blank
 */
public record RollCommand(Action action, String expression) {

    public enum Action {
        ROLL,
        MIN,
        MID,
        MAX,
        DOT,
        MERMAID,
        JSON;

        /**
         * Action named by a command word, or null when the word is not one.
         * {@code roll} is the default and has no command word.
         */
        static Action fromWord(String word) {
            for (Action action : values()) {
                if (action != ROLL && action.name().toLowerCase(Locale.ROOT).equals(word)) {
                    return action;
                }
            }
            return null;
        }
    }

    /**
     * Interpret command line arguments. They are lower-cased; a leading command word selects
     * the action and the remaining arguments are joined with spaces into the expression.
     */
    public static RollCommand parse(List<String> args) {
        List<String> words = new ArrayList<>(args.size());
        for (String arg : args) {
            words.add(arg.toLowerCase(Locale.ROOT));
        }

        Action action = words.isEmpty() ? null : Action.fromWord(words.get(0));
        if (action != null) {
            words = words.subList(1, words.size());
        } else {
            action = Action.ROLL;
        }

        return new RollCommand(action, String.join(" ", words).trim());
    }

    public boolean hasExpression() {
        return !expression.isBlank();
    }
}
