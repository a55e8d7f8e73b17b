package com.dice.cli;

import com.dice.config.DiceConfig;
import com.dice.engine.DiceEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DiceCommandRunner.
 */
class DiceCommandRunnerTest {

    private static final String NL = System.lineSeparator();

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private DiceCommandRunner runner;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new DiceCommandRunner(new DiceEngine(DiceConfig.defaults()),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    // =====================================================================
    // Reports
    // =====================================================================

    @Test
    @DisplayName("Should print a report at maximum")
    void shouldPrintMaxReport() {
        int code = runner.execute(List.of("max", "4d6kh3"));

        assertEquals(DiceCommandRunner.EXIT_OK, code);
        assertEquals("4d6kh3\n[d6:6] [d6:6] [d6:6] ~[d6:6]~\ntotal = 18" + NL, stdout());
        assertEquals("", stderr());
    }

    @ParameterizedTest
    @DisplayName("Should print totals for deterministic modes")
    @CsvSource({
            "min, 2d6+1, 3",
            "MID, 2d6+1, 7",
            "max, 2D6 + 1, 13",
            "mid, d%, 50",
            "min, 7/2, 3"
    })
    void shouldPrintDeterministicTotals(String mode, String expression, int total) {
        assertEquals(DiceCommandRunner.EXIT_OK, runner.execute(List.of(mode, expression)));
        assertTrue(stdout().endsWith("total = " + total + NL), stdout());
    }

    @Test
    @DisplayName("Should join remaining arguments into one expression")
    void shouldJoinArguments() {
        assertEquals(DiceCommandRunner.EXIT_OK, runner.execute(List.of("max", "2d6", "+", "1")));
        assertTrue(stdout().startsWith("2d6 + 1\n"));
    }

    @Test
    @DisplayName("Should roll randomly by default")
    void shouldRollRandomly() {
        assertEquals(DiceCommandRunner.EXIT_OK, runner.execute(List.of("d20")));

        String[] lines = stdout().strip().split("\n");
        assertEquals(3, lines.length);
        assertEquals("1d20", lines[0]);
        int total = Integer.parseInt(lines[2].substring("total = ".length()).strip());
        assertTrue(total >= 1 && total <= 20);
    }

    // =====================================================================
    // Renders
    // =====================================================================

    @Test
    @DisplayName("Should print DOT and Mermaid graphs")
    void shouldPrintGraphs() {
        assertEquals(DiceCommandRunner.EXIT_OK, runner.execute(List.of("dot", "1+2")));
        assertTrue(stdout().startsWith("digraph {\n"));
        assertTrue(stdout().contains("node0001 [label=\"Add\"]"));

        out.reset();
        assertEquals(DiceCommandRunner.EXIT_OK, runner.execute(List.of("mermaid", "1+2")));
        assertTrue(stdout().startsWith("graph TB\n"));
        assertTrue(stdout().contains("node0001 -->|left| node0002"));
    }

    @Test
    @DisplayName("Should print a JSON report")
    void shouldPrintJson() throws Exception {
        assertEquals(DiceCommandRunner.EXIT_OK, runner.execute(List.of("json", "2d6kh1")));

        JsonNode root = new ObjectMapper().readTree(stdout());
        assertEquals("2d6kh1", root.get("expression").asText());
        assertEquals(2, root.get("rolls").size());
        int total = root.get("total").asInt();
        assertTrue(total >= 1 && total <= 6);
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should report invalid expressions with exit code 1")
    @CsvSource(delimiter = '|', value = {
            "3$4 | position 1",
            "3+ | end of input",
            "d7 | Invalid die: d7",
            "1/0 | Division by zero",
            "(1] | does not match"
    })
    void shouldReportErrors(String expression, String fragment) {
        assertEquals(DiceCommandRunner.EXIT_ERROR, runner.execute(List.of(expression)));

        assertTrue(stderr().startsWith("Error: "), stderr());
        assertTrue(stderr().contains(fragment), stderr());
        assertEquals("", stdout());
    }

    @Test
    @DisplayName("Should print usage without an expression")
    void shouldPrintUsage() {
        assertEquals(DiceCommandRunner.EXIT_USAGE, runner.execute(List.of()));
        assertEquals(DiceCommandRunner.USAGE + NL, stderr());

        err.reset();
        assertEquals(DiceCommandRunner.EXIT_USAGE, runner.execute(List.of("max")));
        assertEquals(DiceCommandRunner.USAGE + NL, stderr());
    }

    @Test
    @DisplayName("Should expose the exit code after running")
    void shouldExposeExitCode() {
        runner.run("--spring.main.banner-mode=off", "max", "d4");
        assertEquals(DiceCommandRunner.EXIT_OK, runner.getExitCode());
        assertTrue(stdout().endsWith("total = 4" + NL));

        runner.run("--logging.level.root=WARN");
        assertEquals(DiceCommandRunner.EXIT_USAGE, runner.getExitCode());

        runner.run("d3");
        assertEquals(DiceCommandRunner.EXIT_ERROR, runner.getExitCode());
    }

    @Test
    @DisplayName("Should keep double negation that looks like an option")
    void shouldKeepDoubleNegation() {
        runner.run("min", "--3");

        assertEquals(DiceCommandRunner.EXIT_OK, runner.getExitCode());
        assertTrue(stdout().endsWith("total = 3" + NL));
    }
}
