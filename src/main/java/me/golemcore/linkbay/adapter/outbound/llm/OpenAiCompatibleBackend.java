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

package me.golemcore.linkbay.adapter.outbound.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.model.BackendResponse;
import me.golemcore.linkbay.domain.model.GenerationParams;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.ProviderConfig;
import me.golemcore.linkbay.port.outbound.ChatBackendPort;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Backend for OpenAI-compatible chat completion APIs (DeepSeek, OpenAI).
 */
@Slf4j
public class OpenAiCompatibleBackend implements ChatBackendPort {

    private final ProviderConfig config;
    private final Langchain4jMessageConverter converter;

    public OpenAiCompatibleBackend(ProviderConfig config, Langchain4jMessageConverter converter) {
        this.config = config;
        this.converter = converter;
    }

    @Override
    public CompletableFuture<BackendResponse> send(List<Message> messages, GenerationParams params) {
        return Langchain4jCalls.send(this::createChatModel, converter, messages, params);
    }

    @Override
    public Flux<String> stream(List<Message> messages, GenerationParams params) {
        return Langchain4jCalls.stream(this::createStreamingModel, converter, messages, params);
    }

    @Override
    public boolean isConfigured() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    ChatModel createChatModel(GenerationParams params) {
        log.debug("[Provider] {} chat model: {}", config.getName(), params.getModel());
        return OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .baseUrl(config.getBaseUrl())
                .modelName(params.getModel())
                .temperature(params.getTemperature())
                .maxTokens(params.getMaxTokens())
                .maxRetries(0) // Retry handled by ProviderRetryExecutor
                .timeout(config.getTimeout())
                .build();
    }

    StreamingChatModel createStreamingModel(GenerationParams params) {
        return OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .baseUrl(config.getBaseUrl())
                .modelName(params.getModel())
                .temperature(params.getTemperature())
                .maxTokens(params.getMaxTokens())
                .timeout(config.getTimeout())
                .build();
    }
}
