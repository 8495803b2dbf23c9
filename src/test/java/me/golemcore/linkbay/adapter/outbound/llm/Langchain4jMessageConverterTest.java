package me.golemcore.linkbay.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.linkbay.domain.model.BackendResponse;
import me.golemcore.linkbay.domain.model.GenerationParams;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jMessageConverterTest {

    private final Langchain4jMessageConverter converter = new Langchain4jMessageConverter(new ObjectMapper());

    @Test
    void shouldConvertEveryRole() {
        Message toolResult = Message.builder()
                .role(Message.ROLE_TOOL)
                .content("{\"result\":4}")
                .toolCallId("call_1")
                .toolName("calculate")
                .build();
        Message assistantWithCalls = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(List.of(Message.ToolCall.builder()
                        .id("call_1").name("calculate").arguments(Map.of("expression", "2+2")).build()))
                .build();

        List<ChatMessage> converted = converter.convertMessages(List.of(
                Message.system("Be brief"),
                Message.user("What is 2+2?"),
                assistantWithCalls,
                toolResult,
                Message.assistant("4")));

        assertEquals(5, converted.size());
        assertInstanceOf(SystemMessage.class, converted.get(0));
        assertEquals("What is 2+2?", ((UserMessage) converted.get(1)).singleText());
        AiMessage withCalls = (AiMessage) converted.get(2);
        assertTrue(withCalls.hasToolExecutionRequests());
        assertEquals("{\"expression\":\"2+2\"}", withCalls.toolExecutionRequests().get(0).arguments());
        ToolExecutionResultMessage result = (ToolExecutionResultMessage) converted.get(3);
        assertEquals("call_1", result.id());
        assertEquals("calculate", result.toolName());
        assertEquals("4", ((AiMessage) converted.get(4)).text());
    }

    @Test
    void shouldConvertToolDefinitionSchema() {
        ToolDefinition definition = ToolDefinition.builder()
                .name("send_notification")
                .description("Send a notification")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "user_id", Map.of("type", "integer", "description", "User id"),
                                "message", Map.of("type", "string"),
                                "channel", Map.of("type", "string", "enum", List.of("email", "sms", "push"))),
                        "required", List.of("user_id", "message")))
                .build();

        ToolSpecification toolSpec = converter.convertToolDefinition(definition);

        assertEquals("send_notification", toolSpec.name());
        assertEquals("Send a notification", toolSpec.description());
        assertInstanceOf(JsonIntegerSchema.class, toolSpec.parameters().properties().get("user_id"));
        assertInstanceOf(JsonStringSchema.class, toolSpec.parameters().properties().get("message"));
        assertInstanceOf(JsonEnumSchema.class, toolSpec.parameters().properties().get("channel"));
        assertEquals(List.of("user_id", "message"), toolSpec.parameters().required());
    }

    @Test
    void shouldAttachToolsToRequest() {
        GenerationParams params = GenerationParams.builder()
                .model("gpt-4")
                .tools(List.of(ToolDefinition.simple("get_weather", "Current weather")))
                .build();

        ChatRequest request = converter.toChatRequest(List.of(Message.user("Weather?")), params);

        assertEquals(1, request.messages().size());
        assertEquals(1, request.toolSpecifications().size());
        assertEquals("get_weather", request.toolSpecifications().get(0).name());
    }

    @Test
    void shouldConvertResponseWithToolCallsAndUsage() {
        ChatResponse response = ChatResponse.builder()
                .aiMessage(AiMessage.from(List.of(ToolExecutionRequest.builder()
                        .id("call_9")
                        .name("get_weather")
                        .arguments("{\"location\":\"Rome\"}")
                        .build())))
                .tokenUsage(new TokenUsage(20, 5))
                .modelName("gpt-4-0613")
                .build();

        BackendResponse converted = converter.toBackendResponse(response, "gpt-4");

        assertEquals("", converted.getContent());
        assertEquals(25, converted.getTotalTokens());
        assertEquals("gpt-4-0613", converted.getModel());
        assertEquals(1, converted.getToolCalls().size());
        assertEquals("get_weather", converted.getToolCalls().get(0).getName());
        assertEquals("Rome", converted.getToolCalls().get(0).getArguments().get("location"));
    }

    @Test
    void shouldFallBackToRequestedModelAndZeroTokens() {
        ChatResponse response = ChatResponse.builder()
                .aiMessage(AiMessage.from("Hello"))
                .build();

        BackendResponse converted = converter.toBackendResponse(response, "deepseek-chat");

        assertEquals("Hello", converted.getContent());
        assertEquals("deepseek-chat", converted.getModel());
        assertEquals(0, converted.getTotalTokens());
        assertTrue(converted.getToolCalls().isEmpty());
    }

    @Test
    void shouldReturnEmptyArgumentsForInvalidJson() {
        assertTrue(converter.parseJsonArgs("{not json").isEmpty());
        assertTrue(converter.parseJsonArgs(null).isEmpty());
        assertEquals(Map.of("a", 1), converter.parseJsonArgs("{\"a\":1}"));
    }
}
