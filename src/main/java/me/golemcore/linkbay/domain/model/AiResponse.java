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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Unified response of any provider. Tool results are filled in by the
 * orchestrator after dispatching the tool calls.
 */
@Value
@Builder(toBuilder = true)
public class AiResponse {

    String content;
    String model;
    String provider;
    int tokensUsed;

    @Builder.Default
    List<Message.ToolCall> toolCalls = List.of();

    @Builder.Default
    List<ToolResult> toolResults = List.of();

    boolean cached;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
