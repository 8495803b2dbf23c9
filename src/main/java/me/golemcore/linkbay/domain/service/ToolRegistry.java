package me.golemcore.linkbay.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.component.ToolComponent;
import me.golemcore.linkbay.domain.component.ToolHandler;
import me.golemcore.linkbay.domain.exception.ToolExecutionException;
import me.golemcore.linkbay.domain.exception.ToolNotFoundException;
import me.golemcore.linkbay.domain.exception.ToolValidationException;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.OrchestrationEventType;
import me.golemcore.linkbay.domain.model.ToolArguments;
import me.golemcore.linkbay.domain.model.ToolDefinition;
import me.golemcore.linkbay.domain.model.ToolResult;
import me.golemcore.linkbay.port.outbound.OrchestrationEventPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Named tool registry and dispatcher for model-requested tool calls.
 *
 * <p>
 * Registration order is kept; registering an existing name replaces its
 * handler and definition in place. Every call is validated against the
 * declared schema before the handler runs.
 */
@Slf4j
public class ToolRegistry {

    private static final Pattern VALID_NAME = Pattern.compile("[a-zA-Z0-9_-]+");
    private static final String SOURCE = "tools";

    private final Map<String, RegisteredTool> tools = new LinkedHashMap<>();
    private final ToolArgumentValidator validator;
    private final OrchestrationEventPort events;

    public ToolRegistry(ToolArgumentValidator validator, OrchestrationEventPort events) {
        this.validator = validator;
        this.events = events != null ? events : OrchestrationEventPort.NOOP;
    }

    public void registerTool(String name, ToolHandler handler, String description, Map<String, Object> parameters) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid tool name: '" + name + "'");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Tool handler must not be null: " + name);
        }
        ToolDefinition definition = ToolDefinition.builder()
                .name(name)
                .description(description != null ? description : "")
                .parameters(parameters != null ? parameters : ToolDefinition.emptySchema())
                .build();

        synchronized (tools) {
            RegisteredTool previous = tools.put(name, new RegisteredTool(definition, handler));
            if (previous != null) {
                log.info("[Tools] Replaced tool: {}", name);
            } else {
                log.debug("[Tools] Registered tool: {}", name);
            }
        }
    }

    public void registerTool(ToolComponent tool) {
        ToolDefinition definition = tool.getDefinition();
        registerTool(definition.getName(), tool, definition.getDescription(), definition.getParameters());
    }

    /**
     * Executes a model-requested tool call.
     *
     * @throws ToolNotFoundException
     *             if no tool is registered under the call's name
     * @throws ToolValidationException
     *             if the arguments do not match the schema or the handler
     *             rejected them
     * @throws ToolExecutionException
     *             if the handler failed
     */
    public ToolResult executeTool(Message.ToolCall toolCall) {
        String toolName = toolCall.getName();
        RegisteredTool tool;
        synchronized (tools) {
            tool = toolName != null ? tools.get(toolName) : null;
        }
        if (tool == null) {
            String available = String.join(", ", listTools());
            publishFailure(toolName, "not_found");
            throw new ToolNotFoundException(toolName, "Unknown tool: " + toolName + ". Available tools: " + available);
        }

        ToolArguments arguments;
        try {
            arguments = validator.validate(tool.definition(), toolCall.getArguments());
        } catch (ToolValidationException e) {
            log.warn("[Tools] {} rejected arguments: {}", toolName, e.getViolations());
            publishFailure(toolName, "validation");
            throw e;
        }

        Object value;
        try {
            value = tool.handler().handle(arguments);
        } catch (ToolExecutionException e) {
            publishFailure(toolName, "execution");
            throw e;
        } catch (IllegalArgumentException e) {
            log.warn("[Tools] {} rejected arguments: {}", toolName, e.getMessage());
            publishFailure(toolName, "validation");
            throw new ToolValidationException(toolName, safeCauseMessage(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Tools] Tool execution interrupted: {}", toolName);
            publishFailure(toolName, "interrupted");
            throw new ToolExecutionException(toolName, "Tool execution interrupted", e);
        } catch (Exception e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            publishFailure(toolName, "execution");
            throw new ToolExecutionException(toolName, "Tool execution failed: " + safeCauseMessage(e), e);
        }

        log.debug("[Tools] Executed {} ({})", toolName, toolCall.getId());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", toolName);
        payload.put("callId", toolCall.getId() != null ? toolCall.getId() : "");
        events.publish(OrchestrationEventType.TOOL_EXECUTED, SOURCE, payload);
        return ToolResult.success(toolName, toolCall.getId(), value);
    }

    public List<String> listTools() {
        synchronized (tools) {
            return List.copyOf(tools.keySet());
        }
    }

    public boolean hasTool(String name) {
        synchronized (tools) {
            return tools.containsKey(name);
        }
    }

    /**
     * Returns the definitions in the function-calling shape.
     */
    public List<Map<String, Object>> getToolDefinitions() {
        return getDefinitions().stream()
                .map(ToolDefinition::toFunctionSpec)
                .toList();
    }

    public List<ToolDefinition> getDefinitions() {
        synchronized (tools) {
            List<ToolDefinition> definitions = new ArrayList<>(tools.size());
            for (RegisteredTool tool : tools.values()) {
                definitions.add(tool.definition());
            }
            return definitions;
        }
    }

    private void publishFailure(String toolName, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", toolName != null ? toolName : "");
        payload.put("reason", reason);
        events.publish(OrchestrationEventType.TOOL_FAILED, SOURCE, payload);
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private record RegisteredTool(ToolDefinition definition, ToolHandler handler) {
    }
}
