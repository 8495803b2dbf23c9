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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.model.AiResponse;
import me.golemcore.linkbay.domain.model.BackendResponse;
import me.golemcore.linkbay.domain.model.GenerationParams;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.ProviderConfig;
import me.golemcore.linkbay.domain.model.ProviderStats;
import me.golemcore.linkbay.domain.model.ProviderType;
import me.golemcore.linkbay.port.outbound.ChatBackendPort;
import me.golemcore.linkbay.port.outbound.LlmProvider;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Remote provider that runs every backend call through its own
 * {@link ProviderRetryExecutor}.
 */
@Slf4j
public class ResilientProvider implements LlmProvider {

    private final ProviderConfig config;
    private final ChatBackendPort backend;
    private final ProviderRetryExecutor retryExecutor;

    public ResilientProvider(ProviderConfig config, ChatBackendPort backend, ProviderRetryExecutor retryExecutor) {
        this.config = config;
        this.backend = backend;
        this.retryExecutor = retryExecutor;
    }

    @Override
    public String getName() {
        return config.getName();
    }

    @Override
    public ProviderType getType() {
        return config.getProviderType();
    }

    @Override
    public int getPriority() {
        return config.getPriority();
    }

    @Override
    public String getDefaultModel() {
        return config.getDefaultModel();
    }

    @Override
    public CompletableFuture<AiResponse> chat(List<Message> messages, GenerationParams params) {
        GenerationParams effective = resolve(params);
        return retryExecutor.execute(() -> backend.send(messages, effective))
                .thenApply(response -> toAiResponse(response, effective));
    }

    @Override
    public Flux<String> stream(List<Message> messages, GenerationParams params) {
        GenerationParams effective = resolve(params).toBuilder().stream(true).build();
        return retryExecutor.executeStream(() -> backend.stream(messages, effective));
    }

    @Override
    public boolean isAvailable() {
        try {
            return backend.isConfigured();
        } catch (RuntimeException e) {
            log.warn("[Provider] {} availability check failed: {}", getName(), e.getMessage());
            return false;
        }
    }

    @Override
    public ProviderStats getStats() {
        return ProviderStats.builder()
                .name(getName())
                .type(getType())
                .priority(getPriority())
                .requestCount(retryExecutor.getRequestCount())
                .errorCount(retryExecutor.getErrorCount())
                .available(isAvailable())
                .build();
    }

    private GenerationParams resolve(GenerationParams params) {
        GenerationParams base = params != null ? params : GenerationParams.defaults();
        return base.withDefaultModel(config.getDefaultModel());
    }

    private AiResponse toAiResponse(BackendResponse response, GenerationParams params) {
        return AiResponse.builder()
                .content(response.getContent() != null ? response.getContent() : "")
                .model(response.getModel() != null ? response.getModel() : params.getModel())
                .provider(getName())
                .tokensUsed(response.getTotalTokens())
                .toolCalls(response.getToolCalls() != null ? response.getToolCalls() : List.of())
                .build();
    }
}
