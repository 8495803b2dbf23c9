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

import me.golemcore.linkbay.domain.model.BackendResponse;
import me.golemcore.linkbay.domain.model.GenerationParams;
import me.golemcore.linkbay.domain.model.Message;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Single-attempt access to a remote chat API. Retries are applied by the
 * caller.
 */
public interface ChatBackendPort {

    /**
     * Performs exactly one request. Failures complete the future exceptionally
     * with either a
     * {@link me.golemcore.linkbay.domain.exception.ChatBackendException} or the
     * raw client exception.
     */
    CompletableFuture<BackendResponse> send(List<Message> messages, GenerationParams params);

    Flux<String> stream(List<Message> messages, GenerationParams params);

    /**
     * Checks whether the backend is configured well enough to be called.
     */
    boolean isConfigured();
}
