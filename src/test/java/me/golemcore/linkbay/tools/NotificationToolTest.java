package me.golemcore.linkbay.tools;

import me.golemcore.linkbay.domain.exception.ToolExecutionException;
import me.golemcore.linkbay.domain.exception.ToolValidationException;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.service.ToolArgumentValidator;
import me.golemcore.linkbay.domain.service.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NotificationToolTest {

    private NotificationTool tool;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        tool = new NotificationTool();
        registry = new ToolRegistry(new ToolArgumentValidator(), null);
        registry.registerTool(tool);
    }

    @Test
    void handle_defaultsToEmailAndRecordsInOutbox() throws Exception {
        Object result = tool.handle(ToolArguments.of(Map.of("user_id", "42", "message", "Order shipped")));

        assertEquals(Map.of("sent", true, "user_id", "42", "channel", "email"), result);
        assertEquals(1, tool.getOutbox().size());
        assertEquals("Order shipped", tool.getOutbox().get(0).getMessage());
    }

    @Test
    void registry_rejectsUnknownChannel() {
        assertThrows(ToolValidationException.class, () -> registry.executeTool(Message.ToolCall.builder()
                .id("c").name("send_notification")
                .arguments(Map.of("user_id", "42", "message", "hi", "channel", "fax"))
                .build()));
        assertTrue(tool.getOutbox().isEmpty());
    }

    @Test
    void registry_wrapsSenderFailure() {
        tool.setSender(notification -> {
            throw new IOException("SMTP unavailable");
        });

        ToolExecutionException exception = assertThrows(ToolExecutionException.class,
                () -> registry.executeTool(Message.ToolCall.builder()
                        .id("c").name("send_notification")
                        .arguments(Map.of("user_id", "42", "message", "hi", "channel", "sms"))
                        .build()));

        assertEquals("Tool execution failed: SMTP unavailable", exception.getMessage());
    }

    @Test
    void handle_rejectsBlankMessage() {
        assertThrows(IllegalArgumentException.class,
                () -> tool.handle(ToolArguments.of(Map.of("user_id", "42", "message", " "))));
    }
}
