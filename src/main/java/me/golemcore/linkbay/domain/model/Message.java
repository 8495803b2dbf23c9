package me.golemcore.linkbay.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single chat message exchanged with a provider. Assistant messages may carry
 * tool calls; tool messages carry the id and name of the call they answer.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_TOOL = "tool";

    public static final Set<String> ROLES = Set.of(ROLE_USER, ROLE_ASSISTANT, ROLE_SYSTEM, ROLE_TOOL);

    private String role;
    private String content;
    private int tokens;
    private Instant timestamp;

    private List<ToolCall> toolCalls;
    private String toolCallId;
    private String toolName;

    public static Message user(String content) {
        return of(ROLE_USER, content);
    }

    public static Message assistant(String content) {
        return of(ROLE_ASSISTANT, content);
    }

    public static Message system(String content) {
        return of(ROLE_SYSTEM, content);
    }

    public static Message of(String role, String content) {
        return Message.builder()
                .role(role)
                .content(content)
                .timestamp(Instant.now())
                .build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls requested by the model.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static boolean isValidRole(String role) {
        return role != null && ROLES.contains(role);
    }

    /**
     * A tool invocation requested by the model.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
