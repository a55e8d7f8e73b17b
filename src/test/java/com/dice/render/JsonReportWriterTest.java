package com.dice.render;

import com.dice.eval.DieOutcome;
import com.dice.eval.EvaluationResult;
import com.dice.expression.DiceExpressionParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JsonReportWriter.
 */
class JsonReportWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should write expression, total and rolls")
    void shouldWriteReport() throws Exception {
        EvaluationResult result = new EvaluationResult(6, List.of(
                new DieOutcome(6, 2, false),
                new DieOutcome(6, 5, true)));

        String json = new JsonReportWriter().write(DiceExpressionParser.parse("2d6kh+1"), result);

        JsonNode root = objectMapper.readTree(json);
        assertEquals("2d6kh1 + 1", root.get("expression").asText());
        assertEquals(6, root.get("total").asInt());
        assertEquals(2, root.get("rolls").size());
        assertEquals(6, root.get("rolls").get(0).get("sides").asInt());
        assertEquals(2, root.get("rolls").get(0).get("value").asInt());
        assertFalse(root.get("rolls").get(0).get("kept").asBoolean());
        assertTrue(root.get("rolls").get(1).get("kept").asBoolean());
    }

    @Test
    @DisplayName("Should write an empty rolls array for plain arithmetic")
    void shouldWriteEmptyRolls() {
        String json = new JsonReportWriter().write(DiceExpressionParser.parse("7/2"), new EvaluationResult(3, List.of()));

        assertEquals("{\"expression\":\"7 / 2\",\"total\":3,\"rolls\":[]}", json);
    }
}
