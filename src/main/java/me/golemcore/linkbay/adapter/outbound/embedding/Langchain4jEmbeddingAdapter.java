package me.golemcore.linkbay.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.infrastructure.config.LinkbayProperties;
import me.golemcore.linkbay.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI-compatible embedding APIs.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code linkbay.embedding.api-key} - API key; without it the adapter
 * reports itself unavailable and the cache falls back to exact matching
 * <li>{@code linkbay.embedding.base-url} - optional endpoint override
 * <li>{@code linkbay.embedding.model} - embedding model name
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final LinkbayProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }

        String apiKey = properties.getEmbedding().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.info("[Embedding] API key not configured, semantic cache matching disabled");
            initialized = true;
            return;
        }

        var builder = OpenAiEmbeddingModel.builder()
                .apiKey(apiKey)
                .modelName(getModel());
        String baseUrl = properties.getEmbedding().getBaseUrl();
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        embeddingModel = builder.build();
        log.info("[Embedding] Embedding model initialized: {}", getModel());

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
