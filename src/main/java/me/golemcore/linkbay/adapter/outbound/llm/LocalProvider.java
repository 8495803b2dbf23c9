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

import me.golemcore.linkbay.domain.model.AiResponse;
import me.golemcore.linkbay.domain.model.GenerationParams;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.ProviderConfig;
import me.golemcore.linkbay.domain.model.ProviderStats;
import me.golemcore.linkbay.domain.model.ProviderType;
import me.golemcore.linkbay.port.outbound.LlmProvider;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Offline last-resort provider. Answers every request with a fixed notice and
 * consumes no tokens.
 */
public class LocalProvider implements LlmProvider {

    static final String NOTICE = "Local model support is not available yet. Configure a remote provider.";

    private final ProviderConfig config;
    private final AtomicLong requestCount = new AtomicLong();

    public LocalProvider(ProviderConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return config.getName();
    }

    @Override
    public ProviderType getType() {
        return ProviderType.LOCAL;
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
        requestCount.incrementAndGet();
        String model = params != null && params.getModel() != null ? params.getModel() : getDefaultModel();
        return CompletableFuture.completedFuture(AiResponse.builder()
                .content(NOTICE)
                .model(model)
                .provider(getName())
                .tokensUsed(0)
                .build());
    }

    @Override
    public Flux<String> stream(List<Message> messages, GenerationParams params) {
        return Flux.defer(() -> {
            requestCount.incrementAndGet();
            return Flux.just(NOTICE);
        });
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public ProviderStats getStats() {
        return ProviderStats.builder()
                .name(getName())
                .type(getType())
                .priority(getPriority())
                .requestCount(requestCount.get())
                .errorCount(0)
                .available(true)
                .build();
    }
}
