package com.dice.expression;

import com.dice.ast.Node;
import com.dice.exception.ParseException;

import java.util.List;

/**
 * Facade for parsing dice expressions into syntax trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Arithmetic: +, -, *, / (also × and ÷), unary minus</li>
 *   <li>Grouping with ( ) or [ ]</li>
 *   <li>Rolls: NdS, dS, Nd, d%, with selectors k, kh, kl, d, dh, dl, adv, ad, dis, da</li>
 * </ul>
 * <p>
 * Precedence: negation > * / > + - (parentheses override)
 */
public final class DiceExpressionParser {

    private DiceExpressionParser() {
    }

    /**
     * Parse a dice expression into a syntax tree.
     *
     * @param expression Expression string
     * @return Root node
     */
    public static Node parse(String expression) {
        if (expression == null) {
            throw new ParseException("Dice expression must not be null", 0, "expression", "null");
        }

        // Tokenize
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        // Parse
        ExpressionParser parser = new ExpressionParser(expression, tokens);
        return parser.parse();
    }
}
