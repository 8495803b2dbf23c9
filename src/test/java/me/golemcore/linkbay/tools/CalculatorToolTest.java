package me.golemcore.linkbay.tools;

import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CalculatorToolTest {

    private final CalculatorTool tool = new CalculatorTool();

    @Test
    void getDefinition_requiresExpression() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("calculate", definition.getName());
        assertNotNull(definition.getParameters().get("required"));
    }

    @Test
    void handle_respectsPrecedenceAndParentheses() {
        assertEquals(14L, evaluate("2 + 3 * 4"));
        assertEquals(20L, evaluate("(2 + 3) * 4"));
        assertEquals(-3L, evaluate("-(1 + 2)"));
        assertEquals(2.5, evaluate("5 / 2"));
        assertEquals(0.3, (double) evaluate("0.1 + 0.2"), 1e-9);
    }

    @Test
    void handle_returnsExpressionWithResult() {
        Object result = tool.handle(ToolArguments.of(Map.of("expression", "6*7")));

        assertEquals(Map.of("expression", "6*7", "result", 42L), result);
    }

    @Test
    void handle_rejectsDivisionByZero() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> evaluate("1 / (2 - 2)"));

        assertEquals("Division by zero", exception.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = { "Math.exit(1)", "2 ^ 3", "import os", "" })
    void handle_rejectsUnsupportedInput(String expression) {
        assertThrows(IllegalArgumentException.class, () -> evaluate(expression));
    }

    @Test
    void handle_rejectsMalformedExpressions() {
        assertThrows(IllegalArgumentException.class, () -> evaluate("(1 + 2"));
        assertThrows(IllegalArgumentException.class, () -> evaluate("1 +"));
        assertThrows(IllegalArgumentException.class, () -> evaluate("1.2.3 + 1"));
        assertThrows(IllegalArgumentException.class, () -> evaluate("1" + " + 1".repeat(200)));
    }

    private Object evaluate(String expression) {
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) tool.handle(
                ToolArguments.of(Map.of("expression", expression)));
        return result.get("result");
    }
}
