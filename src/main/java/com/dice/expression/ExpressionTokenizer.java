package com.dice.expression;

import com.dice.exception.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.dice.expression.ExpressionConfig.*;

/**
 * Tokenizer for dice expressions.
 * Converts input string into a sequence of tokens terminated by {@link TokenType#EOF}.
 * <p>
 * Letters are read as whole words, so {@code 4d6kh3} yields {@code 4 d 6 kh 3}.
 * The word {@code d} is always emitted as {@link TokenType#DIE}; whether it marks a die
 * or a discard-lowest selector is decided by the parser.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens
     * @throws LexException on the first unrecognized character or word
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            if (isDigit(c)) {
                tokens.add(readInteger());
            } else if (Character.isLetter(c)) {
                tokens.add(readWord());
            } else {
                TokenType type = SYMBOLS.get(c);
                if (type == null) {
                    throw error("Unexpected character '" + c + "'", start, String.valueOf(c));
                }
                advance();
                tokens.add(new Token(type, String.valueOf(c), null, start));
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readInteger() {
        int start = pos;

        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        try {
            return new Token(TokenType.INTEGER, text, Integer.parseInt(text), start);
        } catch (NumberFormatException e) {
            throw error("Integer '" + text + "' is out of range", start, text);
        }
    }

    private Token readWord() {
        int start = pos;

        while (!isAtEnd() && Character.isLetter(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        String lower = text.toLowerCase(Locale.ROOT);

        if (DIE_WORD.equals(lower)) {
            return new Token(TokenType.DIE, text, null, start);
        }

        SelectorKind kind = SELECTOR_WORDS.get(lower);
        if (kind == null) {
            throw error("Unexpected word '" + text + "'", start, text);
        }
        return new Token(TokenType.SELECTOR, text, kind, start);
    }

    // Only ASCII digits; Character.isDigit would admit other scripts
    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private LexException error(String message, int position, String offendingText) {
        return new LexException("Invalid dice expression at position "
                + position + ": " + message + " in '" + input + "'", position, offendingText);
    }
}
