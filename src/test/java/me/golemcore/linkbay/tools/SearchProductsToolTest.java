package me.golemcore.linkbay.tools;

import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolResult;
import me.golemcore.linkbay.domain.service.ToolArgumentValidator;
import me.golemcore.linkbay.domain.service.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SearchProductsToolTest {

    private SearchProductsTool tool;

    @BeforeEach
    void setUp() {
        tool = new SearchProductsTool();
        tool.addProduct(product("p1", "Wireless Mouse", "Ergonomic bluetooth mouse", "electronics", 29.9));
        tool.addProduct(product("p2", "Mechanical Keyboard", "RGB keyboard with wireless mode", "electronics", 89.0));
        tool.addProduct(product("p3", "Desk Lamp", "Warm LED lamp", "home", 19.5));
    }

    @Test
    void handle_matchesNameAndDescriptionCaseInsensitively() {
        Map<String, Object> result = search(Map.of("query", "WIRELESS"));

        assertEquals(2, result.get("count"));
        assertEquals(List.of("p1", "p2"), ids(result));
    }

    @Test
    void handle_filtersByCategoryAndLimit() {
        assertEquals(List.of("p3"), ids(search(Map.of("query", "lamp", "category", "home"))));
        assertEquals(List.of(), ids(search(Map.of("query", "lamp", "category", "electronics"))));
        assertEquals(List.of("p1"), ids(search(Map.of("query", "wireless", "max_results", 1L))));
    }

    @Test
    void handle_rejectsOutOfRangeLimit() {
        assertThrows(IllegalArgumentException.class, () -> search(Map.of("query", "x", "max_results", 0L)));
        assertThrows(IllegalArgumentException.class, () -> search(Map.of("query", "x", "max_results", 101L)));
    }

    @Test
    void registryAppliesDefaultLimit() {
        ToolRegistry registry = new ToolRegistry(new ToolArgumentValidator(), null);
        registry.registerTool(tool);

        ToolResult result = registry.executeTool(Message.ToolCall.builder()
                .id("call_1").name("search_products").arguments(Map.of("query", "keyboard")).build());

        @SuppressWarnings("unchecked")
        Map<String, Object> value = (Map<String, Object>) result.getValue();
        assertEquals(1, value.get("count"));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> search(Map<String, Object> arguments) {
        return (Map<String, Object>) tool.handle(ToolArguments.of(arguments));
    }

    @SuppressWarnings("unchecked")
    private static List<String> ids(Map<String, Object> result) {
        return ((List<Map<String, Object>>) result.get("products")).stream()
                .map(product -> (String) product.get("id"))
                .toList();
    }

    private static SearchProductsTool.Product product(String id, String name, String description, String category,
            double price) {
        return SearchProductsTool.Product.builder()
                .id(id).name(name).description(description).category(category).price(price).build();
    }
}
