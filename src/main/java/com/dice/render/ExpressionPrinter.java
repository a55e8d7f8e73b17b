package com.dice.render;

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

/**
 * Prints a syntax tree back as a canonical dice expression.
 * <p>
 * Parentheses are added only where precedence requires them, and the output parses back
 * to the same tree: {@code 4d6kh3 + 2}, {@code (1 + 2) * 3}, {@code 10 - (4 - 1)}.
 */
public final class ExpressionPrinter {

    private static final int SUM = 1;
    private static final int TERM = 2;
    private static final int UNARY = 3;
    private static final int ATOM = 4;

    private ExpressionPrinter() {
    }

    public static String print(Node root) {
        StringBuilder out = new StringBuilder();
        print(root, SUM, out);
        return out.toString();
    }

    private static void print(Node node, int minPrecedence, StringBuilder out) {
        boolean group = precedence(node) < minPrecedence;
        if (group) {
            out.append('(');
        }

        if (node instanceof Literal literal) {
            out.append(literal.value());
        } else if (node instanceof Negate negate) {
            out.append('-');
            print(negate.inner(), UNARY, out);
        } else if (node instanceof Roll roll) {
            printRollOperand(roll.count(), out);
            out.append('d');
            printRollOperand(roll.sides(), out);
            for (Selector selector : roll.selectors()) {
                out.append(selector(selector));
            }
        } else if (node instanceof BinaryNode binary) {
            // Left-associative: a right operand of equal precedence needs parentheses
            int precedence = precedence(binary);
            print(binary.left(), precedence, out);
            out.append(' ').append(operator(binary)).append(' ');
            print(binary.right(), precedence + 1, out);
        } else {
            throw new IllegalStateException("Unknown node type: " + node);
        }

        if (group) {
            out.append(')');
        }
    }

    // Only a plain literal can sit next to the die marker without changing how it re-parses
    private static void printRollOperand(Node operand, StringBuilder out) {
        if (operand instanceof Literal literal && literal.value() >= 0) {
            out.append(literal.value());
        } else {
            out.append('(');
            print(operand, SUM, out);
            out.append(')');
        }
    }

    private static int precedence(Node node) {
        if (node instanceof Add || node instanceof Subtract) {
            return SUM;
        }
        if (node instanceof Multiply || node instanceof Divide) {
            return TERM;
        }
        if (node instanceof Negate) {
            return UNARY;
        }
        if (node instanceof Literal literal) {
            return literal.value() < 0 ? UNARY : ATOM;
        }
        return ATOM;
    }

    private static char operator(BinaryNode node) {
        if (node instanceof Add) {
            return '+';
        }
        if (node instanceof Subtract) {
            return '-';
        }
        if (node instanceof Multiply) {
            return '*';
        }
        return '/';
    }

    private static String selector(Selector selector) {
        if (selector instanceof Keep keep) {
            return (keep.mode() == SelectMode.HIGH ? "kh" : "kl") + keep.n();
        }
        if (selector instanceof Discard discard) {
            return (discard.mode() == SelectMode.HIGH ? "dh" : "dl") + discard.n();
        }
        if (selector instanceof Advantage) {
            return "adv";
        }
        if (selector instanceof Disadvantage) {
            return "dis";
        }
        throw new IllegalStateException("Unknown selector type: " + selector);
    }
}
