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
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import me.golemcore.linkbay.domain.model.BackendResponse;
import me.golemcore.linkbay.domain.model.GenerationParams;
import me.golemcore.linkbay.domain.model.Message;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Blocking and streaming langchain4j calls shared by the backends.
 */
final class Langchain4jCalls {

    private Langchain4jCalls() {
    }

    static CompletableFuture<BackendResponse> send(Function<GenerationParams, ChatModel> modelFactory,
            Langchain4jMessageConverter converter, List<Message> messages, GenerationParams params) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = modelFactory.apply(params);
            ChatResponse response = model.chat(converter.toChatRequest(messages, params));
            return converter.toBackendResponse(response, params.getModel());
        });
    }

    static Flux<String> stream(Function<GenerationParams, StreamingChatModel> modelFactory,
            Langchain4jMessageConverter converter, List<Message> messages, GenerationParams params) {
        return Flux.create(sink -> {
            StreamingChatModel model = modelFactory.apply(params);
            ChatRequest request = converter.toChatRequest(messages, params);
            model.chat(request, new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    if (partialResponse != null && !partialResponse.isEmpty()) {
                        sink.next(partialResponse);
                    }
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                    sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                    sink.error(error);
                }
            });
        });
    }
}
