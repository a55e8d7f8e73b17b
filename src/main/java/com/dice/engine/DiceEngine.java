package com.dice.engine;

import com.dice.ast.Node;
import com.dice.config.DiceConfig;
import com.dice.eval.DiceEvaluator;
import com.dice.eval.EvaluationResult;
import com.dice.expression.DiceExpressionParser;
import com.dice.render.GraphFormat;
import com.dice.render.GraphRendererFactory;
import com.dice.render.JsonReportWriter;
import com.dice.render.RollReportFormatter;
import com.dice.roller.DieRoller;
import com.dice.roller.DieRollerFactory;
import com.dice.roller.RollMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * Entry point for parsing, evaluating and rendering dice expressions with one configuration.
 * <p>
 * Thread-safe: the parser, evaluator and renderers hold no shared state, and the random
 * roller draws from a single {@link Random}.
 */
public class DiceEngine {

    private static final Logger log = LoggerFactory.getLogger(DiceEngine.class);

    private final DiceConfig config;
    private final DiceEvaluator evaluator;
    private final Random random;
    private final RollReportFormatter reportFormatter;
    private final JsonReportWriter jsonWriter;

    public DiceEngine(DiceConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.evaluator = new DiceEvaluator(config.allowedSides(), config.maxDice());
        this.random = config.randomSeed() != null ? new Random(config.randomSeed()) : new Random();
        this.reportFormatter = new RollReportFormatter(config.ansiColors());
        this.jsonWriter = new JsonReportWriter();
    }

    public Node parse(String expression) {
        Node root = DiceExpressionParser.parse(expression);
        log.debug("Parsed '{}' into {}", expression, root);
        return root;
    }

    /**
     * Evaluate with the roller for a mode. RANDOM mode draws from this engine's random source.
     */
    public EvaluationResult evaluate(Node root, RollMode mode) {
        RollMode effectiveMode = mode != null ? mode : RollMode.RANDOM;
        return evaluate(root, DieRollerFactory.create(effectiveMode, random), effectiveMode);
    }

    public EvaluationResult evaluate(Node root, DieRoller roller) {
        return evaluate(root, roller, null);
    }

    private EvaluationResult evaluate(Node root, DieRoller roller, RollMode mode) {
        EvaluationResult result = evaluator.evaluate(root, roller);
        log.debug("Evaluated {} in {} mode: total {}, {} dice rolled",
                root, mode != null ? mode : "custom", result.total(), result.trace().size());
        return result;
    }

    public String render(Node root, GraphFormat format) {
        return GraphRendererFactory.create(format).render(root);
    }

    public String report(Node root, EvaluationResult result) {
        return reportFormatter.format(root, result);
    }

    public String json(Node root, EvaluationResult result) {
        return jsonWriter.write(root, result);
    }

    /**
     * Parse, evaluate and format a text report in one call.
     */
    public String roll(String expression, RollMode mode) {
        Node root = parse(expression);
        return report(root, evaluate(root, mode));
    }

    public DiceConfig getConfig() {
        return config;
    }
}
