/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.linkbay.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.model.BackendResponse;
import me.golemcore.linkbay.domain.model.GenerationParams;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Converts between domain messages and langchain4j chat types, including tool
 * definitions expressed as JSON Schema maps.
 */
@Slf4j
public class Langchain4jMessageConverter {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Langchain4jMessageConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ChatRequest toChatRequest(List<Message> messages, GenerationParams params) {
        ChatRequest.Builder builder = ChatRequest.builder()
                .messages(convertMessages(messages));
        if (params.hasTools()) {
            builder.toolSpecifications(params.getTools().stream()
                    .map(this::convertToolDefinition)
                    .toList());
        }
        return builder.build();
    }

    public BackendResponse toBackendResponse(ChatResponse response, String requestedModel) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = List.of();
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("Parsed {} tool calls from response", toolCalls.size());
        }

        int totalTokens = 0;
        if (response.tokenUsage() != null && response.tokenUsage().totalTokenCount() != null) {
            totalTokens = response.tokenUsage().totalTokenCount();
        }

        String model = response.metadata() != null && response.metadata().modelName() != null
                ? response.metadata().modelName()
                : requestedModel;

        return BackendResponse.builder()
                .content(aiMessage.text() != null ? aiMessage.text() : "")
                .model(model)
                .totalTokens(totalTokens)
                .toolCalls(toolCalls)
                .build();
    }

    List<ChatMessage> convertMessages(List<Message> messages) {
        List<ChatMessage> converted = new ArrayList<>();
        for (Message msg : messages) {
            switch (msg.getRole()) {
            case Message.ROLE_USER -> converted.add(UserMessage.from(msg.getContent()));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    converted.add(AiMessage.from(toolRequests));
                } else {
                    converted.add(AiMessage.from(msg.getContent()));
                }
            }
            case Message.ROLE_TOOL -> converted.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent()));
            case Message.ROLE_SYSTEM -> converted.add(SystemMessage.from(msg.getContent()));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                converted.add(UserMessage.from(msg.getContent()));
            }
            }
        }
        return converted;
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getParameters();
        if (schema != null) {
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<Object> enumValues = (List<Object>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }

        return switch (type != null ? type : "string") {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
            if (nested != null) {
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool arguments are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            // Leave validation to the tool registry: required arguments will be reported missing
            log.warn("[Provider] Failed to parse tool arguments: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
