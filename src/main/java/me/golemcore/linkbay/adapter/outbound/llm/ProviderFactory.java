package me.golemcore.linkbay.adapter.outbound.llm;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.model.ProviderConfig;
import me.golemcore.linkbay.port.outbound.ChatBackendPort;
import me.golemcore.linkbay.port.outbound.LlmProvider;
import me.golemcore.linkbay.port.outbound.OrchestrationEventPort;

/**
 * Builds the provider variant matching a {@link ProviderConfig}.
 *
 * <ul>
 * <li>DEEPSEEK, OPENAI - {@link OpenAiCompatibleBackend} behind a
 * {@link ResilientProvider}
 * <li>ANTHROPIC - {@link AnthropicBackend} behind a {@link ResilientProvider}
 * <li>LOCAL - {@link LocalProvider}
 * </ul>
 */
@Slf4j
public class ProviderFactory {

    private final Langchain4jMessageConverter converter;
    private final BackoffScheduler backoffScheduler;
    private final OrchestrationEventPort events;

    public ProviderFactory(ObjectMapper objectMapper, BackoffScheduler backoffScheduler,
            OrchestrationEventPort events) {
        this.converter = new Langchain4jMessageConverter(objectMapper);
        this.backoffScheduler = backoffScheduler;
        this.events = events;
    }

    public LlmProvider create(ProviderConfig config) {
        if (config.getProviderType() == null) {
            throw new IllegalArgumentException("Provider type is required for provider " + config.getName());
        }
        log.debug("[Provider] Creating {} provider '{}' (priority {}, model {})",
                config.getProviderType().getId(), config.getName(), config.getPriority(), config.getDefaultModel());

        ChatBackendPort backend;
        switch (config.getProviderType()) {
        case LOCAL -> {
            return new LocalProvider(config);
        }
        case ANTHROPIC -> backend = new AnthropicBackend(config, converter);
        default -> backend = new OpenAiCompatibleBackend(config, converter);
        }

        ProviderRetryExecutor retryExecutor = new ProviderRetryExecutor(config.getName(), config.getMaxRetries(),
                config.getBackoffFactor(), config.getTimeout(), backoffScheduler, events);
        return new ResilientProvider(config, backend, retryExecutor);
    }
}
