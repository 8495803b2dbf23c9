package me.golemcore.linkbay.tools;

import me.golemcore.linkbay.domain.model.ToolArguments;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UserInfoToolTest {

    private final UserInfoTool tool = new UserInfoTool();

    @Test
    void handle_returnsRegisteredProfile() {
        tool.registerUser("42", Map.of("name", "Ada", "plan", "pro"));

        Object profile = tool.handle(ToolArguments.of(Map.of("user_id", "42")));

        assertEquals(Map.of("user_id", "42", "name", "Ada", "plan", "pro"), profile);
    }

    @Test
    void handle_rejectsUnknownUser() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> tool.handle(ToolArguments.of(Map.of("user_id", "7"))));

        assertEquals("Unknown user: 7", exception.getMessage());
    }
}
