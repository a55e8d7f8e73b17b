package com.dice.expression;

import com.dice.ast.Add;
import com.dice.ast.Advantage;
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
import com.dice.exception.ParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for dice expressions.
 * Converts tokens into a {@link Node} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: negation > term > sum):
 * <pre>
 * sum       := term (('+' | '-') term)*
 * term      := factor (('*' | '/') factor)*
 * factor    := '(' sum ')' | '[' sum ']' | negation | INTEGER | roll
 * negation  := '-' factor
 * roll      := INTEGER? 'd' (INTEGER | '%')? selection*
 * selection := ('k' | 'kh' | 'kl' | 'd' | 'dh' | 'dl') INTEGER?
 *            | 'adv' | 'ad' | 'dis' | 'da'
 * </pre>
 * Parsing stops at the first error.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a syntax tree.
     *
     * @return Root node
     * @throws ParseException if the tokens do not form a complete expression
     */
    public Node parse() {
        Node result = parseSum();
        if (check(TokenType.RPAREN) || check(TokenType.RBRACKET)) {
            throw error("Unmatched " + peek().describe(), "end of input");
        }
        if (!isAtEnd()) {
            throw error("Unexpected " + peek().describe() + " after expression", "end of input");
        }
        return result;
    }

    private Node parseSum() {
        Node left = parseTerm();

        while (true) {
            if (match(TokenType.PLUS)) {
                left = new Add(left, parseTerm());
            } else if (match(TokenType.MINUS)) {
                left = new Subtract(left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Node parseTerm() {
        Node left = parseFactor();

        while (true) {
            if (match(TokenType.STAR)) {
                left = new Multiply(left, parseFactor());
            } else if (match(TokenType.SLASH)) {
                left = new Divide(left, parseFactor());
            } else {
                return left;
            }
        }
    }

    private Node parseFactor() {
        // Grouped expression
        if (match(TokenType.LPAREN)) {
            return parseGroup(TokenType.RPAREN, ")");
        }
        if (match(TokenType.LBRACKET)) {
            return parseGroup(TokenType.RBRACKET, "]");
        }

        // Negation
        if (match(TokenType.MINUS)) {
            return new Negate(parseFactor());
        }

        // Literal, or the count of a roll
        if (match(TokenType.INTEGER)) {
            Literal literal = new Literal((Integer) previous().literal());
            if (match(TokenType.DIE)) {
                return parseRoll(literal);
            }
            return literal;
        }

        // Roll with implied count
        if (match(TokenType.DIE)) {
            return parseRoll(new Literal(Roll.DEFAULT_COUNT));
        }

        if (check(TokenType.SELECTOR)) {
            throw error("Selector " + peek().describe() + " must follow a roll", "expression");
        }
        if (isAtEnd()) {
            throw error("Unexpected end of input", "expression");
        }
        throw error("Unexpected " + peek().describe(), "expression");
    }

    private Node parseGroup(TokenType close, String closeText) {
        Token open = previous();
        Node inner = parseSum();

        if (match(close)) {
            return inner;
        }
        if (check(TokenType.RPAREN) || check(TokenType.RBRACKET)) {
            throw error("Closing " + peek().describe() + " does not match opening '"
                    + open.text() + "' at position " + open.position(), "'" + closeText + "'");
        }
        if (isAtEnd()) {
            throw error("Expression ended without closing '" + closeText + "'", "'" + closeText + "'");
        }
        throw error("Unexpected " + peek().describe() + " in parenthetical", "'" + closeText + "'");
    }

    // The die marker has already been consumed
    private Node parseRoll(Node count) {
        Node sides;
        if (match(TokenType.INTEGER)) {
            sides = new Literal((Integer) previous().literal());
        } else if (match(TokenType.PERCENT)) {
            sides = new Literal(Roll.PERCENTILE_SIDES);
        } else {
            sides = new Literal(Roll.DEFAULT_SIDES);
        }

        List<Selector> selectors = new ArrayList<>();
        while (check(TokenType.SELECTOR) || check(TokenType.DIE)) {
            selectors.add(parseSelector());
        }

        return new Roll(count, sides, selectors);
    }

    private Selector parseSelector() {
        Token token = advance();
        // After a roll, a bare "d" means discard lowest
        SelectorKind kind = token.type() == TokenType.DIE
                ? SelectorKind.DISCARD_LOW
                : (SelectorKind) token.literal();

        if (!kind.takesCount()) {
            return kind == SelectorKind.ADVANTAGE ? Advantage.INSTANCE : Disadvantage.INSTANCE;
        }

        int n = Selector.DEFAULT_COUNT;
        if (match(TokenType.INTEGER)) {
            n = (Integer) previous().literal();
        }

        return switch (kind) {
            case KEEP_HIGH -> new Keep(SelectMode.HIGH, n);
            case KEEP_LOW -> new Keep(SelectMode.LOW, n);
            case DISCARD_HIGH -> new Discard(SelectMode.HIGH, n);
            case DISCARD_LOW -> new Discard(SelectMode.LOW, n);
            case ADVANTAGE, DISADVANTAGE -> throw new IllegalStateException("Unexpected selector: " + kind);
        };
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ParseException error(String message, String expected) {
        Token token = peek();
        return new ParseException("Invalid dice expression at position "
                + token.position() + ": " + message + " in '" + input + "'",
                token.position(), expected, token.describe());
    }
}
