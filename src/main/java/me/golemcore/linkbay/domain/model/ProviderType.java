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

import lombok.Getter;

/**
 * Supported provider variants with their default endpoint and model.
 */
@Getter
public enum ProviderType {

    DEEPSEEK("deepseek", "https://api.deepseek.com/v1", "deepseek-chat"),

    OPENAI("openai", "https://api.openai.com/v1", "gpt-3.5-turbo"),

    ANTHROPIC("anthropic", "https://api.anthropic.com/v1", "claude-3-5-haiku-latest"),

    LOCAL("local", null, "local");

    private final String id;
    private final String defaultBaseUrl;
    private final String defaultModel;

    ProviderType(String id, String defaultBaseUrl, String defaultModel) {
        this.id = id;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
    }

    /**
     * Resolves a provider type from its id, case-insensitive.
     */
    public static ProviderType fromId(String id) {
        for (ProviderType type : values()) {
            if (type.id.equalsIgnoreCase(id) || type.name().equalsIgnoreCase(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider type: " + id);
    }
}
