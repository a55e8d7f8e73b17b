package com.dice.eval;

import com.dice.ast.Add;
import com.dice.ast.Advantage;
import com.dice.ast.BinaryNode;
import com.dice.ast.Disadvantage;
import com.dice.ast.Discard;
import com.dice.ast.Divide;
import com.dice.ast.Keep;
import com.dice.ast.Literal;
import com.dice.ast.Multiply;
import com.dice.ast.Negate;
import com.dice.ast.Node;
import com.dice.ast.Roll;
import com.dice.ast.SelectMode;
import com.dice.ast.Selector;
import com.dice.ast.Subtract;
import com.dice.exception.EvaluationException;
import com.dice.exception.EvaluationException.Reason;
import com.dice.roller.DieRoller;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntSupplier;

/**
 * Evaluates a dice expression tree against a {@link DieRoller}.
 * <p>
 * Evaluation is a post-order walk. Binary operands are evaluated left to right, division
 * floors toward negative infinity, and each {@link Roll} applies its selectors left to right
 * to its own dice only. Advantage and disadvantage resolve the roll built so far a second time
 * and keep the winning side. Every die rolled, including dice of losing sides, is recorded in
 * the trace in the order it was rolled.
 * <p>
 * The tree is never modified, so one tree may be evaluated any number of times.
 */
public class DiceEvaluator {

    /**
     * Dice accepted by default.
     */
    public static final Set<Integer> STANDARD_SIDES = Set.of(4, 6, 8, 10, 12, 20, 100);

    /**
     * Default limit on the dice rolled in one evaluation.
     */
    public static final int DEFAULT_MAX_DICE = 10_000;

    private static final Comparator<Die> HIGHEST_FIRST =
            Comparator.comparingInt(Die::value).reversed().thenComparingInt(Die::order);
    private static final Comparator<Die> LOWEST_FIRST =
            Comparator.comparingInt(Die::value).thenComparingInt(Die::order);

    private final Set<Integer> allowedSides;
    private final int maxDice;

    public DiceEvaluator() {
        this(STANDARD_SIDES, DEFAULT_MAX_DICE);
    }

    public DiceEvaluator(Set<Integer> allowedSides, int maxDice) {
        this.allowedSides = Set.copyOf(Objects.requireNonNull(allowedSides, "allowedSides must not be null"));
        if (maxDice < 0) {
            throw new IllegalArgumentException("maxDice must not be negative: " + maxDice);
        }
        this.maxDice = maxDice;
    }

    /**
     * Evaluate an expression tree.
     *
     * @param root   Parsed expression
     * @param roller Source of die values for this evaluation
     * @return Total and the trace of every die rolled
     * @throws EvaluationException on invalid sides or count, division by zero, or overflow
     */
    public EvaluationResult evaluate(Node root, DieRoller roller) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(roller, "roller must not be null");

        Evaluation evaluation = new Evaluation(roller);
        int total = evaluation.eval(root);
        return new EvaluationResult(total, evaluation.trace());
    }

    /**
     * State of a single evaluate() call.
     */
    private class Evaluation {
        private final DieRoller roller;
        private final List<Die> rolled = new ArrayList<>();

        Evaluation(DieRoller roller) {
            this.roller = roller;
        }

        int eval(Node node) {
            if (node instanceof Literal literal) {
                return literal.value();
            }
            if (node instanceof Negate negate) {
                int inner = eval(negate.inner());
                return exact(() -> Math.negateExact(inner), "-" + inner);
            }
            if (node instanceof Roll roll) {
                return evalRoll(roll);
            }
            if (node instanceof BinaryNode binary) {
                int left = eval(binary.left());
                int right = eval(binary.right());
                return apply(binary, left, right);
            }
            throw new IllegalStateException("Unknown node type: " + node);
        }

        private int apply(BinaryNode node, int left, int right) {
            if (node instanceof Add) {
                return exact(() -> Math.addExact(left, right), left + " + " + right);
            }
            if (node instanceof Subtract) {
                return exact(() -> Math.subtractExact(left, right), left + " - " + right);
            }
            if (node instanceof Multiply) {
                return exact(() -> Math.multiplyExact(left, right), left + " * " + right);
            }
            if (node instanceof Divide) {
                if (right == 0) {
                    throw new EvaluationException(Reason.DIVIDE_BY_ZERO, "Division by zero: " + left + " / 0");
                }
                if (left == Integer.MIN_VALUE && right == -1) {
                    throw new EvaluationException(Reason.ARITHMETIC_OVERFLOW,
                            "Integer overflow computing " + left + " / " + right);
                }
                return Math.floorDiv(left, right);
            }
            throw new IllegalStateException("Unknown operator: " + node);
        }

        private int evalRoll(Roll roll) {
            int count = eval(roll.count());
            int sides = eval(roll.sides());

            if (!allowedSides.contains(sides)) {
                throw new EvaluationException(Reason.INVALID_SIDES, "Invalid die: d" + sides);
            }
            if (count < 0) {
                throw new EvaluationException(Reason.INVALID_COUNT, "Cannot roll a negative number of dice: " + count);
            }

            List<Die> pool = resolve(count, sides, roll.selectors(), roll.selectors().size());
            return sumKept(pool);
        }

        /**
         * Roll the dice and apply the first {@code applied} selectors. Returns every die of
         * this roll, including dropped ones.
         */
        private List<Die> resolve(int count, int sides, List<Selector> selectors, int applied) {
            if (applied == 0) {
                return rollDice(count, sides);
            }

            List<Die> pool = resolve(count, sides, selectors, applied - 1);
            Selector selector = selectors.get(applied - 1);

            if (selector instanceof Keep keep) {
                select(pool, keep.mode(), keep.n(), true);
                return pool;
            }
            if (selector instanceof Discard discard) {
                select(pool, discard.mode(), discard.n(), false);
                return pool;
            }
            if (selector instanceof Advantage) {
                return contest(pool, resolve(count, sides, selectors, applied - 1), true);
            }
            if (selector instanceof Disadvantage) {
                return contest(pool, resolve(count, sides, selectors, applied - 1), false);
            }
            throw new IllegalStateException("Unknown selector type: " + selector);
        }

        private List<Die> rollDice(int count, int sides) {
            if (count > maxDice - rolled.size()) {
                throw new EvaluationException(Reason.INVALID_COUNT, "Cannot roll " + count
                        + " more dice: limit is " + maxDice + " per expression");
            }

            List<Die> pool = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                Die die = new Die(sides, roller.roll(sides), rolled.size());
                rolled.add(die);
                pool.add(die);
            }
            return pool;
        }

        // Orders the kept dice, then keeps or drops the first n of them
        private void select(List<Die> pool, SelectMode mode, int n, boolean keep) {
            if (n < 0) {
                throw new EvaluationException(Reason.INVALID_COUNT, "Selector count must not be negative: " + n);
            }

            List<Die> ordered = pool.stream()
                    .filter(Die::isKept)
                    .sorted(mode == SelectMode.HIGH ? HIGHEST_FIRST : LOWEST_FIRST)
                    .toList();

            for (int i = 0; i < ordered.size(); i++) {
                boolean first = i < n;
                if (first != keep) {
                    ordered.get(i).drop();
                }
            }
        }

        // Ties go to the side resolved first
        private List<Die> contest(List<Die> first, List<Die> second, boolean higher) {
            int firstTotal = sumKept(first);
            int secondTotal = sumKept(second);
            boolean secondWins = higher ? secondTotal > firstTotal : secondTotal < firstTotal;

            (secondWins ? first : second).forEach(Die::drop);

            List<Die> both = new ArrayList<>(first.size() + second.size());
            both.addAll(first);
            both.addAll(second);
            return both;
        }

        private int sumKept(List<Die> pool) {
            int sum = 0;
            for (Die die : pool) {
                if (die.isKept()) {
                    int current = sum;
                    sum = exact(() -> Math.addExact(current, die.value()), "dice total");
                }
            }
            return sum;
        }

        List<DieOutcome> trace() {
            return rolled.stream()
                    .map(die -> new DieOutcome(die.sides(), die.value(), die.isKept()))
                    .toList();
        }
    }

    private static int exact(IntSupplier operation, String description) {
        try {
            return operation.getAsInt();
        } catch (ArithmeticException e) {
            throw new EvaluationException(Reason.ARITHMETIC_OVERFLOW,
                    "Integer overflow computing " + description, e);
        }
    }

    /**
     * A rolled die with its position in the trace. Only the kept flag changes.
     */
    private static final class Die {
        private final int sides;
        private final int value;
        private final int order;
        private boolean kept = true;

        Die(int sides, int value, int order) {
            this.sides = sides;
            this.value = value;
            this.order = order;
        }

        int sides() {
            return sides;
        }

        int value() {
            return value;
        }

        int order() {
            return order;
        }

        boolean isKept() {
            return kept;
        }

        void drop() {
            kept = false;
        }
    }
}
