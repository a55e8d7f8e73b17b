package com.dice.render;

import com.dice.ast.Node;
import com.dice.eval.DieOutcome;
import com.dice.eval.EvaluationResult;
import com.dice.exception.DiceException;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Writes an evaluation as JSON:
 * <pre>
 * {"expression":"2d6","total":7,"rolls":[{"sides":6,"value":3,"kept":true},{"sides":6,"value":4,"kept":true}]}
 * </pre>
 */
public class JsonReportWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public String write(Node root, EvaluationResult result) {
        RollReport report = new RollReport(ExpressionPrinter.print(root), result.total(), result.trace());
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new DiceException("Failed to write JSON report: " + e.getMessage(), e);
        }
    }

    /**
     * JSON shape of a report.
     */
    @JsonPropertyOrder({"expression", "total", "rolls"})
    public record RollReport(String expression, int total, List<DieOutcome> rolls) {
    }
}
