package me.golemcore.linkbay.port.outbound;

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
import me.golemcore.linkbay.domain.model.ProviderStats;
import me.golemcore.linkbay.domain.model.ProviderType;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A language-model provider the orchestrator can route requests to.
 *
 * <p>
 * Implementations own their retry policy: a returned future that completes
 * exceptionally means the provider gave up on the request, and the
 * orchestrator moves on to the next provider.
 */
public interface LlmProvider {

    /**
     * Unique name within an orchestrator, used in failure reports and
     * analytics.
     */
    String getName();

    ProviderType getType();

    /**
     * Lower values are tried first.
     */
    int getPriority();

    String getDefaultModel();

    /**
     * Sends a chat request.
     *
     * @param messages
     *            conversation to send, oldest first
     * @param params
     *            generation parameters; a missing model falls back to the
     *            provider's default model
     * @return future completed with the response, or exceptionally with a
     *         {@link me.golemcore.linkbay.domain.exception.ProviderException}
     */
    CompletableFuture<AiResponse> chat(List<Message> messages, GenerationParams params);

    /**
     * Streams the response as text fragments. The sequence is cold: every
     * subscription re-issues the request.
     */
    Flux<String> stream(List<Message> messages, GenerationParams params);

    /**
     * Best-effort availability check. Never throws.
     */
    boolean isAvailable();

    ProviderStats getStats();
}
