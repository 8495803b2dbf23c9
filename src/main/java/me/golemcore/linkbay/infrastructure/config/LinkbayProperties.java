package me.golemcore.linkbay.infrastructure.config;

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

import lombok.Data;
import me.golemcore.linkbay.domain.model.BudgetConfig;
import me.golemcore.linkbay.domain.model.ConversationConfig;
import me.golemcore.linkbay.domain.model.ProviderConfig;
import me.golemcore.linkbay.domain.model.ProviderType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrator configuration bound from application.properties.
 *
 * <p>
 * Everything lives under the {@code linkbay.*} prefix:
 * <ul>
 * <li>{@code linkbay.providers[n].*} - remote and local providers</li>
 * <li>{@code linkbay.retry.*} - retry defaults for providers that set none</li>
 * <li>{@code linkbay.budget.*} - token and cost ceilings</li>
 * <li>{@code linkbay.conversation.*} - conversation context limits</li>
 * <li>{@code linkbay.cache.*} - semantic response cache</li>
 * <li>{@code linkbay.embedding.*} - embedding model used by the cache</li>
 * <li>{@code linkbay.tools.*} - predefined tools</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "linkbay")
@Data
public class LinkbayProperties {

    private List<ProviderProperties> providers = new ArrayList<>();
    private RetryProperties retry = new RetryProperties();
    private BudgetConfig budget = new BudgetConfig();
    private ConversationConfig conversation = new ConversationConfig();
    private CacheProperties cache = new CacheProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private ToolsProperties tools = new ToolsProperties();
    private HistoryProperties history = new HistoryProperties();
    private HttpProperties http = new HttpProperties();
    private TasksProperties tasks = new TasksProperties();
    private int charsPerToken = 4;

    @Data
    public static class ProviderProperties {
        private String name;
        private ProviderType type;
        private String apiKey;
        private String baseUrl;
        private String defaultModel;
        private int priority = 1;
        private Duration timeout = Duration.ofSeconds(30);
        private Integer maxRetries;
        private Double backoffFactor;
        private boolean enabled = true;

        public ProviderConfig toConfig(RetryProperties retryDefaults) {
            return ProviderConfig.builder()
                    .name(name)
                    .providerType(type)
                    .apiKey(apiKey)
                    .baseUrl(baseUrl)
                    .defaultModel(defaultModel)
                    .priority(priority)
                    .timeout(timeout)
                    .maxRetries(maxRetries != null ? maxRetries : retryDefaults.getMaxRetries())
                    .backoffFactor(backoffFactor != null ? backoffFactor : retryDefaults.getBackoffFactor())
                    .build();
        }
    }

    @Data
    public static class RetryProperties {
        private int maxRetries = 3;
        private double backoffFactor = 1.5;
    }

    @Data
    public static class CacheProperties {
        private boolean enabled = true;
        private double similarityThreshold = 0.95;
        private int maxEntries = 1000;
        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "text-embedding-3-small";
    }

    @Data
    public static class ToolsProperties {
        private boolean enabled = true;
    }

    @Data
    public static class HistoryProperties {
        private int maxEntries = 1000;
    }

    /**
     * Shared HTTP transport used by declarative tool clients. Durations in
     * milliseconds.
     */
    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class TasksProperties {
        private String generationModel;
        private String analysisModel;
    }
}
