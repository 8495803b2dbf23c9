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
 * Per-request generation parameters. A missing model is filled from the
 * provider's default model.
 */
@Value
@Builder(toBuilder = true)
public class GenerationParams {

    String model;

    @Builder.Default
    int maxTokens = 1000;

    @Builder.Default
    double temperature = 0.7;

    boolean stream;

    @Builder.Default
    List<ToolDefinition> tools = List.of();

    public static GenerationParams defaults() {
        return GenerationParams.builder().build();
    }

    public GenerationParams withDefaultModel(String defaultModel) {
        if (model != null && !model.isBlank()) {
            return this;
        }
        return toBuilder().model(defaultModel).build();
    }

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}
