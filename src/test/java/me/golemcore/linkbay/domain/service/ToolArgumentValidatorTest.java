package me.golemcore.linkbay.domain.service;

import me.golemcore.linkbay.domain.exception.ToolValidationException;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolArgumentValidatorTest {

    private final ToolArgumentValidator validator = new ToolArgumentValidator();

    private final ToolDefinition notification = ToolDefinition.builder()
            .name("send_notification")
            .parameters(Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "user_id", Map.of("type", "integer"),
                            "message", Map.of("type", "string"),
                            "urgent", Map.of("type", "boolean"),
                            "channel", Map.of("type", "string", "enum", List.of("email", "sms", "push"),
                                    "default", "email")),
                    "required", List.of("user_id", "message")))
            .build();

    @Test
    void shouldAcceptValidArgumentsAndApplyDefaults() {
        ToolArguments arguments = validator.validate(notification, Map.of("user_id", 7, "message", "hi"));

        assertEquals(7L, arguments.getLong("user_id"));
        assertEquals("hi", arguments.getString("message"));
        assertEquals("email", arguments.getString("channel"));
        assertFalse(arguments.has("urgent"));
    }

    @Test
    void shouldNormalizeWholeDoublesToLong() {
        ToolArguments arguments = validator.validate(notification, Map.of("user_id", 3.0, "message", "hi"));

        assertEquals(3L, arguments.asMap().get("user_id"));
    }

    @Test
    void shouldReportEveryViolation() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("user_id", "seven");
        raw.put("channel", "fax");
        raw.put("priority", "high");

        ToolValidationException exception = assertThrows(ToolValidationException.class,
                () -> validator.validate(notification, raw));

        List<String> violations = exception.getViolations();
        assertEquals(4, violations.size());
        assertTrue(violations.contains("missing required argument 'message'"));
        assertTrue(violations.contains("argument 'user_id' must be of type integer but was string"));
        assertTrue(violations.contains("unknown argument 'priority'"));
        assertTrue(violations.stream().anyMatch(v -> v.startsWith("argument 'channel' must be one of")));
        assertEquals("send_notification", exception.getToolName());
        assertTrue(exception.getMessage().startsWith("Invalid arguments for tool 'send_notification'"));
    }

    @Test
    void shouldRejectFractionalInteger() {
        ToolValidationException exception = assertThrows(ToolValidationException.class,
                () -> validator.validate(notification, Map.of("user_id", 1.5, "message", "hi")));

        assertEquals(List.of("argument 'user_id' must be of type integer but was number"),
                exception.getViolations());
    }

    @Test
    void shouldTreatNullRequiredValueAsMissing() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("user_id", null);
        raw.put("message", "hi");

        assertThrows(ToolValidationException.class, () -> validator.validate(notification, raw));
    }

    @Test
    void shouldAllowUnknownArgumentsWhenSchemaPermits() {
        ToolDefinition open = ToolDefinition.builder()
                .name("open")
                .parameters(Map.of("type", "object", "properties", Map.of(), "additionalProperties", true))
                .build();

        ToolArguments arguments = validator.validate(open, Map.of("anything", 1));

        assertEquals(1, arguments.asMap().get("anything"));
    }

    @Test
    void shouldAcceptNullArgumentsForEmptySchema() {
        ToolArguments arguments = validator.validate(ToolDefinition.simple("ping", "Ping"), null);

        assertTrue(arguments.asMap().isEmpty());
    }

    @Test
    void shouldTreatBooleanPropertySchemasAsJsonSchemaDoes() {
        ToolDefinition loose = ToolDefinition.builder()
                .name("loose")
                .parameters(Map.of("type", "object", "properties", Map.of("x", true, "y", false)))
                .build();

        ToolArguments arguments = validator.validate(loose, Map.of("x", "v"));
        ToolValidationException exception = assertThrows(ToolValidationException.class,
                () -> validator.validate(loose, Map.of("y", "v")));

        assertEquals("v", arguments.getString("x"));
        assertEquals(List.of("argument 'y' is not allowed"), exception.getViolations());
    }
}
