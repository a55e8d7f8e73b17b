package com.dice.cli;

import com.dice.ast.Node;
import com.dice.engine.DiceEngine;
import com.dice.eval.EvaluationResult;
import com.dice.exception.DiceException;
import com.dice.render.GraphFormat;
import com.dice.roller.RollMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs one dice command from the command line.
 * <p>
 * Exit codes: 0 on success, 1 when the expression cannot be lexed, parsed or evaluated,
 * 2 when no expression is given.
 */
public class DiceCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(DiceCommandRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: dice [min|mid|max|dot|mermaid|json] <expression>";

    private final DiceEngine engine;
    private final PrintStream out;
    private final PrintStream err;
    private int exitCode = EXIT_OK;

    public DiceCommandRunner(DiceEngine engine, PrintStream out, PrintStream err) {
        this.engine = engine;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(withoutSpringOptions(args));
    }

    /**
     * Execute a command and print its output.
     *
     * @param args Command word and expression words
     * @return Exit code
     */
    public int execute(List<String> args) {
        RollCommand command = RollCommand.parse(args);
        if (!command.hasExpression()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        log.debug("Running {} for '{}'", command.action(), command.expression());
        try {
            out.println(output(command));
            return EXIT_OK;
        } catch (DiceException e) {
            log.debug("Command failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private String output(RollCommand command) {
        Node root = engine.parse(command.expression());
        return switch (command.action()) {
            case ROLL -> report(root, RollMode.RANDOM);
            case MIN -> report(root, RollMode.MIN);
            case MID -> report(root, RollMode.MID);
            case MAX -> report(root, RollMode.MAX);
            case DOT -> engine.render(root, GraphFormat.DOT);
            case MERMAID -> engine.render(root, GraphFormat.MERMAID);
            case JSON -> engine.json(root, engine.evaluate(root, RollMode.RANDOM));
        };
    }

    private String report(Node root, RollMode mode) {
        EvaluationResult result = engine.evaluate(root, mode);
        return engine.report(root, result);
    }

    // Spring Boot passes its own --name=value options through to runners
    private static List<String> withoutSpringOptions(String[] args) {
        List<String> words = new ArrayList<>();
        for (String arg : Arrays.asList(args)) {
            if (arg.startsWith("--") && arg.length() > 2 && Character.isLetter(arg.charAt(2))) {
                continue;
            }
            words.add(arg);
        }
        return words;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
