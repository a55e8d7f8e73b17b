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
import com.dice.ast.Subtract;
import com.dice.exception.LexException;
import com.dice.exception.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionParser through the DiceExpressionParser facade.
 */
class ExpressionParserTest {

    private static Literal lit(int value) {
        return new Literal(value);
    }

    // =====================================================================
    // Arithmetic
    // =====================================================================

    @Test
    @DisplayName("Should give multiplication precedence over addition")
    void shouldRespectPrecedence() {
        Node node = DiceExpressionParser.parse("2+3*4");

        assertEquals(new Add(lit(2), new Multiply(lit(3), lit(4))), node);
    }

    @Test
    @DisplayName("Should let parentheses override precedence")
    void shouldGroupWithParentheses() {
        Node node = DiceExpressionParser.parse("(2+3)*4");

        assertEquals(new Multiply(new Add(lit(2), lit(3)), lit(4)), node);
    }

    @Test
    @DisplayName("Should accept square brackets for grouping")
    void shouldGroupWithBrackets() {
        assertEquals(DiceExpressionParser.parse("(2+3)*4"), DiceExpressionParser.parse("[2+3]*4"));
    }

    @Test
    @DisplayName("Should associate subtraction and division to the left")
    void shouldBeLeftAssociative() {
        assertEquals(new Subtract(new Subtract(lit(10), lit(4)), lit(1)), DiceExpressionParser.parse("10-4-1"));
        assertEquals(new Divide(new Divide(lit(8), lit(4)), lit(2)), DiceExpressionParser.parse("8/4/2"));
    }

    @Test
    @DisplayName("Should bind unary minus tighter than multiplication")
    void shouldParseNegation() {
        assertEquals(new Divide(new Negate(lit(7)), lit(2)), DiceExpressionParser.parse("-7/2"));
        assertEquals(new Negate(new Negate(lit(1))), DiceExpressionParser.parse("--1"));
        assertEquals(new Subtract(lit(1), new Negate(lit(2))), DiceExpressionParser.parse("1 - -2"));
    }

    // =====================================================================
    // Rolls
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should fill in default count and sides")
    @CsvSource({
            "d20, 1, 20",
            "4d, 4, 6",
            "d, 1, 6",
            "3d8, 3, 8",
            "d%, 1, 100",
            "2D%, 2, 100"
    })
    void shouldApplyRollDefaults(String input, int count, int sides) {
        assertEquals(Roll.of(count, sides), DiceExpressionParser.parse(input));
    }

    @Test
    @DisplayName("Should parse keep and discard selectors")
    void shouldParseSelectors() {
        assertEquals(Roll.of(4, 6, new Keep(SelectMode.HIGH, 3)), DiceExpressionParser.parse("4d6kh3"));
        assertEquals(Roll.of(4, 6, new Keep(SelectMode.HIGH, 3)), DiceExpressionParser.parse("4d6k3"));
        assertEquals(Roll.of(4, 6, new Keep(SelectMode.LOW, 2)), DiceExpressionParser.parse("4d6kl2"));
        assertEquals(Roll.of(4, 6, new Discard(SelectMode.HIGH, 1)), DiceExpressionParser.parse("4d6dh1"));
        assertEquals(Roll.of(4, 6, new Discard(SelectMode.LOW, 2)), DiceExpressionParser.parse("4d6dl2"));
    }

    @Test
    @DisplayName("Should treat d after a roll as discard lowest")
    void shouldTreatTrailingDAsDiscardLowest() {
        assertEquals(Roll.of(4, 6, new Discard(SelectMode.LOW, 1)), DiceExpressionParser.parse("4d6d1"));
        assertEquals(Roll.of(4, 6, new Discard(SelectMode.LOW, 1)), DiceExpressionParser.parse("4d6d"));
    }

    @Test
    @DisplayName("Should default selector count to one")
    void shouldDefaultSelectorCount() {
        assertEquals(Roll.of(3, 6, new Keep(SelectMode.HIGH, 1)), DiceExpressionParser.parse("3d6kh"));
        assertEquals(Roll.of(3, 6, new Keep(SelectMode.LOW, 1)), DiceExpressionParser.parse("3d6 kl"));
    }

    @Test
    @DisplayName("Should parse advantage and disadvantage")
    void shouldParseAdvantage() {
        assertEquals(Roll.of(1, 20, Advantage.INSTANCE), DiceExpressionParser.parse("d20adv"));
        assertEquals(Roll.of(1, 20, Advantage.INSTANCE), DiceExpressionParser.parse("d20 ad"));
        assertEquals(Roll.of(1, 20, Disadvantage.INSTANCE), DiceExpressionParser.parse("d20dis"));
        assertEquals(Roll.of(1, 20, Disadvantage.INSTANCE), DiceExpressionParser.parse("d20da"));
    }

    @Test
    @DisplayName("Should keep selectors in source order")
    void shouldChainSelectors() {
        Roll roll = (Roll) DiceExpressionParser.parse("4d6kh3adv");

        assertEquals(List.of(new Keep(SelectMode.HIGH, 3), Advantage.INSTANCE), roll.selectors());
    }

    @Test
    @DisplayName("Should combine rolls with arithmetic")
    void shouldCombineRolls() {
        Node node = DiceExpressionParser.parse("4d6kh3 + 2d8 * 2 - 1");

        assertEquals(new Subtract(
                new Add(Roll.of(4, 6, new Keep(SelectMode.HIGH, 3)), new Multiply(Roll.of(2, 8), lit(2))),
                lit(1)), node);
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @Test
    @DisplayName("Should reject a trailing operator")
    void shouldRejectTrailingOperator() {
        ParseException e = assertThrows(ParseException.class, () -> DiceExpressionParser.parse("3+"));

        assertEquals(2, e.getPosition());
        assertEquals("end of input", e.getFound());
    }

    @Test
    @DisplayName("Should reject empty input")
    void shouldRejectEmptyInput() {
        assertThrows(ParseException.class, () -> DiceExpressionParser.parse(""));
        assertThrows(ParseException.class, () -> DiceExpressionParser.parse(null));
    }

    @Test
    @DisplayName("Should propagate lex errors")
    void shouldPropagateLexErrors() {
        LexException e = assertThrows(LexException.class, () -> DiceExpressionParser.parse("3$4"));

        assertEquals(1, e.getPosition());
    }

    @ParameterizedTest
    @DisplayName("Should reject malformed expressions")
    @CsvSource(delimiter = '|', value = {
            "(1+2",
            "(1]",
            "[1)",
            "1+2)",
            "1+2]",
            "()",
            "2 3",
            "kh3",
            "4d6 + kh1",
            "*2",
            "4d6kh3 3"
    })
    void shouldRejectMalformedExpressions(String input) {
        assertThrows(ParseException.class, () -> DiceExpressionParser.parse(input));
    }

    @Test
    @DisplayName("Should report mismatched closing bracket")
    void shouldReportMismatchedBracket() {
        ParseException e = assertThrows(ParseException.class, () -> DiceExpressionParser.parse("(1]"));

        assertEquals(2, e.getPosition());
        assertEquals("')'", e.getExpected());
        assertEquals("']'", e.getFound());
        assertTrue(e.getMessage().contains("does not match"));
    }

    @Test
    @DisplayName("Should report a selector without a roll")
    void shouldReportSelectorWithoutRoll() {
        ParseException e = assertThrows(ParseException.class, () -> DiceExpressionParser.parse("2 + adv"));

        assertEquals(4, e.getPosition());
        assertTrue(e.getMessage().contains("must follow a roll"));
    }

    @Test
    @DisplayName("Should report unclosed group at end of input")
    void shouldReportUnclosedGroup() {
        ParseException e = assertThrows(ParseException.class, () -> DiceExpressionParser.parse("[1 + 2"));

        assertEquals(6, e.getPosition());
        assertEquals("']'", e.getExpected());
    }
}
