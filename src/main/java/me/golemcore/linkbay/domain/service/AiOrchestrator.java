package me.golemcore.linkbay.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.exception.AllProvidersFailedException;
import me.golemcore.linkbay.domain.exception.ProviderException;
import me.golemcore.linkbay.domain.model.AiResponse;
import me.golemcore.linkbay.domain.model.ChatOptions;
import me.golemcore.linkbay.domain.model.GenerationParams;
import me.golemcore.linkbay.domain.model.Message;
import me.golemcore.linkbay.domain.model.OrchestrationEventType;
import me.golemcore.linkbay.domain.model.OrchestratorAnalytics;
import me.golemcore.linkbay.domain.model.ProviderErrorKind;
import me.golemcore.linkbay.domain.model.ProviderStats;
import me.golemcore.linkbay.domain.model.RequestRecord;
import me.golemcore.linkbay.domain.model.ToolResult;
import me.golemcore.linkbay.port.outbound.ConversationPort;
import me.golemcore.linkbay.port.outbound.LlmProvider;
import me.golemcore.linkbay.port.outbound.OrchestrationEventPort;
import me.golemcore.linkbay.port.outbound.ResponseCachePort;
import me.golemcore.linkbay.usage.RequestHistory;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for orchestrated chat requests.
 *
 * <p>
 * A request goes through the response cache (when enabled), the budget check,
 * and then the registered providers in ascending priority order until one
 * succeeds. Each provider applies its own retry policy; a provider that gives
 * up hands the request to the next one. Actual usage is recorded before any
 * tool call in the response is dispatched.
 *
 * <p>
 * Tool results are attached to the response and never sent back to the model
 * automatically.
 */
@Slf4j
public class AiOrchestrator {

    private static final String SOURCE = "orchestrator";
    private static final String CACHE_PROVIDER = "cache";
    private static final Comparator<ProviderRegistration> BY_PRIORITY = Comparator
            .comparingInt(ProviderRegistration::priority)
            .thenComparingLong(ProviderRegistration::sequence);

    private final CostController costController;
    private final ToolRegistry toolRegistry;
    private final ConversationPort conversation;
    private final ResponseCachePort cache;
    private final RequestHistory history;
    private final TokenEstimator tokenEstimator;
    private final OrchestrationEventPort events;
    private final Clock clock;

    private final CopyOnWriteArrayList<ProviderRegistration> providers = new CopyOnWriteArrayList<>();
    private final AtomicLong registrationSequence = new AtomicLong();

    @Builder
    public AiOrchestrator(CostController costController, ToolRegistry toolRegistry, ConversationPort conversation,
            ResponseCachePort cache, RequestHistory history, TokenEstimator tokenEstimator,
            OrchestrationEventPort events, Clock clock) {
        if (costController == null) {
            throw new IllegalArgumentException("costController is required");
        }
        this.costController = costController;
        this.toolRegistry = toolRegistry;
        this.conversation = conversation;
        this.cache = cache;
        this.history = history != null ? history : new RequestHistory(1000);
        this.tokenEstimator = tokenEstimator != null
                ? tokenEstimator
                : TokenEstimator.characterRatio(TokenEstimator.DEFAULT_CHARS_PER_TOKEN);
        this.events = events != null ? events : OrchestrationEventPort.NOOP;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    // ===== Provider registry =====

    public void registerProvider(LlmProvider provider) {
        registerProvider(provider, provider.getPriority());
    }

    /**
     * Registers a provider under an explicit priority. A provider already
     * registered under the same name is replaced.
     */
    public synchronized void registerProvider(LlmProvider provider, int priority) {
        if (provider == null) {
            throw new IllegalArgumentException("provider must not be null");
        }
        boolean replaced = providers.removeIf(r -> r.provider().getName().equals(provider.getName()));
        providers.add(new ProviderRegistration(provider, priority, registrationSequence.getAndIncrement()));
        providers.sort(BY_PRIORITY);
        log.info("[Orchestrator] {} provider {} ({}) with priority {}",
                replaced ? "Replaced" : "Registered", provider.getName(), provider.getType(), priority);
    }

    public synchronized boolean deregisterProvider(String name) {
        boolean removed = providers.removeIf(r -> r.provider().getName().equals(name));
        if (removed) {
            log.info("[Orchestrator] Deregistered provider {}", name);
        }
        return removed;
    }

    /**
     * Returns the providers in the order they are tried.
     */
    public List<LlmProvider> getProviders() {
        return providers.stream().map(ProviderRegistration::provider).toList();
    }

    public List<String> getAvailableProviders() {
        return providers.stream()
                .map(ProviderRegistration::provider)
                .filter(LlmProvider::isAvailable)
                .map(LlmProvider::getName)
                .toList();
    }

    // ===== Chat =====

    public CompletableFuture<AiResponse> chat(String prompt) {
        return chat(prompt, ChatOptions.defaults());
    }

    public CompletableFuture<AiResponse> chat(String prompt, ChatOptions options) {
        if (prompt == null || prompt.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Prompt must not be blank"));
        }
        ChatOptions opts = options != null ? options : ChatOptions.defaults();
        List<ProviderRegistration> snapshot = List.copyOf(providers);
        if (snapshot.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalStateException("No AI providers configured"));
        }
        Instant start = clock.instant();

        return lookupCache(prompt, opts).thenCompose(cached -> {
            if (cached.isPresent()) {
                return CompletableFuture.completedFuture(cachedResponse(prompt, cached.get(), start));
            }

            GenerationParams params = buildParams(opts);
            List<Message> messages = buildMessages(prompt, opts);
            long estimate = tokenEstimator.estimate(messages);
            costController.checkBudget(estimate, budgetModel(params, snapshot));
            if (opts.isUseConversation()) {
                conversation.addMessage(Message.ROLE_USER, prompt, (int) tokenEstimator.estimate(prompt));
            }

            return failover(snapshot, messages, params)
                    .thenApply(response -> complete(prompt, opts, response, start));
        });
    }

    /**
     * Streams the response of the first provider that starts emitting. A
     * provider failing before its first fragment hands over to the next one;
     * a failure after that ends the stream. Usage is estimated from the
     * streamed text and recorded on completion.
     */
    public Flux<String> chatStream(String prompt, ChatOptions options) {
        return Flux.defer(() -> {
            if (prompt == null || prompt.isBlank()) {
                return Flux.error(new IllegalArgumentException("Prompt must not be blank"));
            }
            ChatOptions opts = options != null ? options : ChatOptions.defaults();
            List<ProviderRegistration> snapshot = List.copyOf(providers);
            if (snapshot.isEmpty()) {
                return Flux.error(new IllegalStateException("No AI providers configured"));
            }
            Instant start = clock.instant();

            GenerationParams params = buildParams(opts).toBuilder().stream(true).tools(List.of()).build();
            List<Message> messages = buildMessages(prompt, opts);
            long estimate = tokenEstimator.estimate(messages);
            String model = budgetModel(params, snapshot);
            costController.checkBudget(estimate, model);
            if (opts.isUseConversation()) {
                conversation.addMessage(Message.ROLE_USER, prompt, (int) tokenEstimator.estimate(prompt));
            }

            StringBuilder collected = new StringBuilder();
            String[] servedBy = new String[1];
            return streamFrom(snapshot, 0, messages, params, new LinkedHashMap<>(), servedBy)
                    .doOnNext(collected::append)
                    .doOnComplete(() -> {
                        String content = collected.toString();
                        long tokens = estimate + tokenEstimator.estimate(content);
                        costController.recordUsage(tokens, model);
                        if (opts.isUseConversation()) {
                            conversation.addMessage(Message.ROLE_ASSISTANT, content,
                                    (int) tokenEstimator.estimate(content));
                        }
                        history.record(RequestRecord.builder()
                                .timestamp(start)
                                .prompt(prompt)
                                .model(model)
                                .provider(servedBy[0])
                                .tokens(tokens)
                                .latency(Duration.between(start, clock.instant()))
                                .build());
                    });
        });
    }

    // ===== Analytics =====

    public OrchestratorAnalytics getAnalytics() {
        List<ProviderStats> stats = providers.stream()
                .map(r -> {
                    ProviderStats providerStats = r.provider().getStats();
                    providerStats.setPriority(r.priority());
                    return providerStats;
                })
                .toList();
        return history.getAnalytics(stats, costController.getCurrentUsage());
    }

    public List<RequestRecord> getRequestHistory() {
        return history.getRecords();
    }

    public void resetConversation() {
        if (conversation != null) {
            conversation.clear();
            log.debug("[Orchestrator] Conversation reset");
        }
    }

    // ===== Internals =====

    private CompletableFuture<Optional<String>> lookupCache(String prompt, ChatOptions opts) {
        if (!opts.isUseCache() || cache == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return cache.getCachedResponse(prompt);
    }

    private AiResponse cachedResponse(String prompt, String content, Instant start) {
        log.debug("[Orchestrator] Cache hit");
        events.publish(OrchestrationEventType.CACHE_HIT, SOURCE, Map.of("promptLength", prompt.length()));
        history.record(RequestRecord.builder()
                .timestamp(start)
                .prompt(prompt)
                .model(CACHE_PROVIDER)
                .provider(CACHE_PROVIDER)
                .tokens(0)
                .cached(true)
                .latency(Duration.between(start, clock.instant()))
                .build());
        return AiResponse.builder()
                .content(content)
                .model(CACHE_PROVIDER)
                .provider(CACHE_PROVIDER)
                .tokensUsed(0)
                .cached(true)
                .build();
    }

    private List<Message> buildMessages(String prompt, ChatOptions opts) {
        List<Message> messages = new ArrayList<>();
        if (opts.getSystemPrompt() != null && !opts.getSystemPrompt().isBlank()) {
            messages.add(Message.system(opts.getSystemPrompt()));
        }
        if (opts.isUseConversation()) {
            if (conversation == null) {
                throw new IllegalStateException("Conversation mode requested but no conversation is configured");
            }
            messages.addAll(conversation.getMessages());
        }
        messages.add(Message.user(prompt));
        return messages;
    }

    private GenerationParams buildParams(ChatOptions opts) {
        GenerationParams.GenerationParamsBuilder builder = GenerationParams.builder().model(opts.getModel());
        if (opts.getMaxTokens() != null) {
            builder.maxTokens(opts.getMaxTokens());
        }
        if (opts.getTemperature() != null) {
            builder.temperature(opts.getTemperature());
        }
        if (opts.isUseTools() && toolRegistry != null) {
            builder.tools(toolRegistry.getDefinitions());
        }
        return builder.build();
    }

    private static String budgetModel(GenerationParams params, List<ProviderRegistration> snapshot) {
        if (params.getModel() != null && !params.getModel().isBlank()) {
            return params.getModel();
        }
        return snapshot.get(0).provider().getDefaultModel();
    }

    private CompletableFuture<AiResponse> failover(List<ProviderRegistration> snapshot, List<Message> messages,
            GenerationParams params) {
        CompletableFuture<AiResponse> result = new CompletableFuture<>();
        tryProvider(snapshot, 0, messages, params, new LinkedHashMap<>(), result);
        return result;
    }

    private void tryProvider(List<ProviderRegistration> snapshot, int index, List<Message> messages,
            GenerationParams params, Map<String, ProviderException> failures, CompletableFuture<AiResponse> result) {
        if (index >= snapshot.size()) {
            log.error("[Orchestrator] All {} providers failed", snapshot.size());
            result.completeExceptionally(new AllProvidersFailedException(failures));
            return;
        }

        LlmProvider provider = snapshot.get(index).provider();
        CompletableFuture<AiResponse> attempt;
        try {
            attempt = provider.chat(messages, params);
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }

        attempt.whenComplete((response, error) -> {
            if (error == null) {
                if (index > 0) {
                    log.info("[Orchestrator] Served by fallback provider {}", provider.getName());
                }
                events.publish(OrchestrationEventType.PROVIDER_SUCCEEDED, provider.getName(),
                        Map.of("tokens", response.getTokensUsed()));
                result.complete(response);
                return;
            }

            ProviderException failure = asProviderException(provider, error);
            failures.put(provider.getName(), failure);
            log.warn("[Orchestrator] Provider {} failed ({}): {}", provider.getName(), failure.getKind(),
                    failure.getMessage());
            events.publish(OrchestrationEventType.PROVIDER_FAILED, provider.getName(),
                    Map.of("kind", failure.getKind().name()));
            tryProvider(snapshot, index + 1, messages, params, failures, result);
        });
    }

    private Flux<String> streamFrom(List<ProviderRegistration> snapshot, int index, List<Message> messages,
            GenerationParams params, Map<String, ProviderException> failures, String[] servedBy) {
        if (index >= snapshot.size()) {
            return Flux.error(new AllProvidersFailedException(failures));
        }
        LlmProvider provider = snapshot.get(index).provider();
        AtomicBoolean emitted = new AtomicBoolean(false);
        return Flux.defer(() -> provider.stream(messages, params))
                .doOnNext(fragment -> {
                    if (emitted.compareAndSet(false, true)) {
                        servedBy[0] = provider.getName();
                    }
                })
                .onErrorResume(error -> {
                    if (emitted.get()) {
                        return Flux.error(asProviderException(provider, error));
                    }
                    ProviderException failure = asProviderException(provider, error);
                    failures.put(provider.getName(), failure);
                    log.warn("[Orchestrator] Stream from {} failed ({}): {}", provider.getName(), failure.getKind(),
                            failure.getMessage());
                    events.publish(OrchestrationEventType.PROVIDER_FAILED, provider.getName(),
                            Map.of("kind", failure.getKind().name()));
                    return streamFrom(snapshot, index + 1, messages, params, failures, servedBy);
                });
    }

    private AiResponse complete(String prompt, ChatOptions opts, AiResponse response, Instant start) {
        costController.recordUsage(response.getTokensUsed(), response.getModel());

        AiResponse finalResponse = response;
        if (opts.isUseTools() && toolRegistry != null && response.hasToolCalls()) {
            List<ToolResult> results = new ArrayList<>(response.getToolCalls().size());
            for (Message.ToolCall toolCall : response.getToolCalls()) {
                results.add(toolRegistry.executeTool(toolCall));
            }
            finalResponse = response.toBuilder().toolResults(List.copyOf(results)).build();
        }

        if (opts.isUseConversation()) {
            conversation.addMessage(Message.ROLE_ASSISTANT, finalResponse.getContent(),
                    (int) tokenEstimator.estimate(finalResponse.getContent()));
        }

        if (opts.isUseCache() && cache != null && !finalResponse.hasToolCalls()) {
            cache.cacheResponse(prompt, finalResponse.getContent())
                    .exceptionally(error -> {
                        log.warn("[Orchestrator] Failed to cache response: {}", error.getMessage());
                        return null;
                    });
        }

        history.record(RequestRecord.builder()
                .timestamp(start)
                .prompt(prompt)
                .model(finalResponse.getModel())
                .provider(finalResponse.getProvider())
                .tokens(finalResponse.getTokensUsed())
                .latency(Duration.between(start, clock.instant()))
                .toolCalls(finalResponse.getToolCalls().size())
                .build());
        return finalResponse;
    }

    private static ProviderException asProviderException(LlmProvider provider, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ProviderException providerException) {
            return providerException;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ProviderException("Provider " + provider.getName() + " failed: " + message,
                ProviderErrorKind.UNEXPECTED, provider.getName(), cause);
    }

    private record ProviderRegistration(LlmProvider provider, int priority, long sequence) {
    }
}
