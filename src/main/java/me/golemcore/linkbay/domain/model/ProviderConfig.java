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

import java.time.Duration;

/**
 * Immutable connection and retry settings of a single provider.
 */
@Value
@Builder(toBuilder = true)
public class ProviderConfig {

    String name;
    ProviderType providerType;
    String apiKey;
    String baseUrl;
    String defaultModel;

    @Builder.Default
    int priority = 1;

    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    double backoffFactor = 1.5;

    public String getName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return providerType != null ? providerType.getId() : "unknown";
    }

    public String getBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl;
        }
        return providerType != null ? providerType.getDefaultBaseUrl() : null;
    }

    public String getDefaultModel() {
        if (defaultModel != null && !defaultModel.isBlank()) {
            return defaultModel;
        }
        return providerType != null ? providerType.getDefaultModel() : null;
    }
}
