package me.golemcore.linkbay.domain.service;

import me.golemcore.linkbay.domain.component.ToolComponent;
import me.golemcore.linkbay.domain.exception.ToolExecutionException;
import me.golemcore.linkbay.domain.exception.ToolNotFoundException;
import me.golemcore.linkbay.domain.exception.ToolValidationException;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.OrchestrationEvent;
import me.golemcore.linkbay.domain.model.OrchestrationEventType;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolDefinition;
import me.golemcore.linkbay.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static final Map<String, Object> ECHO_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("text", Map.of("type", "string")),
            "required", List.of("text"));

    private List<OrchestrationEvent> events;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        events = new ArrayList<>();
        registry = new ToolRegistry(new ToolArgumentValidator(), events::add);
        registry.registerTool("echo", args -> Map.of("echo", args.getString("text")), "Echo text", ECHO_SCHEMA);
    }

    @Test
    void executeTool_runsHandlerWithValidatedArguments() {
        ToolResult result = registry.executeTool(call("call_1", "echo", Map.of("text", "hello")));

        assertTrue(result.isSuccess());
        assertEquals("echo", result.getToolName());
        assertEquals("call_1", result.getToolCallId());
        assertEquals(Map.of("echo", "hello"), result.getValue());
        assertEquals(OrchestrationEventType.TOOL_EXECUTED, events.get(0).type());
    }

    @Test
    void executeTool_unknownToolListsAvailableTools() {
        registry.registerTool("ping", args -> "pong", "Ping", null);

        ToolNotFoundException exception = assertThrows(ToolNotFoundException.class,
                () -> registry.executeTool(call("call_2", "missing", Map.of())));

        assertEquals("Unknown tool: missing. Available tools: echo, ping", exception.getMessage());
        assertEquals(OrchestrationEventType.TOOL_FAILED, events.get(0).type());
    }

    @Test
    void executeTool_rejectsInvalidArgumentsWithoutCallingHandler() {
        List<ToolArguments> seen = new ArrayList<>();
        registry.registerTool("strict", args -> {
            seen.add(args);
            return "ok";
        }, "Strict", ECHO_SCHEMA);

        assertThrows(ToolValidationException.class, () -> registry.executeTool(call("c", "strict", Map.of())));
        assertTrue(seen.isEmpty());
    }

    @Test
    void executeTool_mapsHandlerIllegalArgumentToValidationError() {
        registry.registerTool("picky", args -> {
            throw new IllegalArgumentException("text must not be blank");
        }, "Picky", ECHO_SCHEMA);

        ToolValidationException exception = assertThrows(ToolValidationException.class,
                () -> registry.executeTool(call("c", "picky", Map.of("text", " "))));

        assertEquals(List.of("text must not be blank"), exception.getViolations());
    }

    @Test
    void executeTool_wrapsHandlerFailure() {
        registry.registerTool("broken", args -> {
            throw new IOException("disk unavailable");
        }, "Broken", null);

        ToolExecutionException exception = assertThrows(ToolExecutionException.class,
                () -> registry.executeTool(call("c", "broken", Map.of())));

        assertEquals("Tool execution failed: disk unavailable", exception.getMessage());
        assertEquals("broken", exception.getToolName());
        assertInstanceOf(IOException.class, exception.getCause());
    }

    @Test
    void executeTool_restoresInterruptFlagWhenHandlerIsInterrupted() {
        registry.registerTool("sleepy", args -> {
            throw new InterruptedException("stopped");
        }, "Sleeps", null);

        try {
            ToolExecutionException exception = assertThrows(ToolExecutionException.class,
                    () -> registry.executeTool(call("c", "sleepy", Map.of())));

            assertEquals("sleepy", exception.getToolName());
            assertInstanceOf(InterruptedException.class, exception.getCause());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void executeTool_acceptsBooleanPropertySchema() {
        registry.registerTool("loose", args -> args.getString("x"), "Loose",
                Map.of("type", "object", "properties", Map.of("x", true)));

        assertEquals("v", registry.executeTool(call("c", "loose", Map.of("x", "v"))).getValue());
    }

    @Test
    void registerTool_rejectsInvalidNames() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.registerTool("bad name", args -> null, "", null));
        assertThrows(IllegalArgumentException.class,
                () -> registry.registerTool(null, args -> null, "", null));
        assertThrows(IllegalArgumentException.class,
                () -> registry.registerTool("nohandler", null, "", null));
    }

    @Test
    void registerTool_replacesExistingNameInPlace() {
        registry.registerTool("other", args -> 1, "Other", null);
        registry.registerTool("echo", args -> "replaced", "Echo v2", ECHO_SCHEMA);

        assertEquals(List.of("echo", "other"), registry.listTools());
        assertEquals("replaced", registry.executeTool(call("c", "echo", Map.of("text", "x"))).getValue());
        assertEquals("Echo v2", registry.getDefinitions().get(0).getDescription());
    }

    @Test
    void registerTool_acceptsComponent() {
        ToolComponent component = new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple("now", "Current time");
            }

            @Override
            public Object handle(ToolArguments arguments) {
                return "12:00";
            }
        };

        registry.registerTool(component);

        assertTrue(registry.hasTool("now"));
        assertEquals("now", component.getToolName());
        assertEquals("12:00", registry.executeTool(call("c", "now", null)).getValue());
    }

    @Test
    void getToolDefinitions_usesFunctionCallingShape() {
        List<Map<String, Object>> definitions = registry.getToolDefinitions();

        assertEquals(1, definitions.size());
        assertEquals("function", definitions.get(0).get("type"));
        @SuppressWarnings("unchecked")
        Map<String, Object> function = (Map<String, Object>) definitions.get(0).get("function");
        assertEquals("echo", function.get("name"));
        assertEquals("Echo text", function.get("description"));
        assertEquals(ECHO_SCHEMA, function.get("parameters"));
    }

    private static Message.ToolCall call(String id, String name, Map<String, Object> arguments) {
        return Message.ToolCall.builder().id(id).name(name).arguments(arguments).build();
    }
}
