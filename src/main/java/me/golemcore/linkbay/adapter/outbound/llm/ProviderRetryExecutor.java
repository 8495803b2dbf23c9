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
import me.golemcore.linkbay.domain.exception.ProviderException;
import me.golemcore.linkbay.domain.model.OrchestrationEventType;
import me.golemcore.linkbay.domain.model.ProviderErrorKind;
import me.golemcore.linkbay.port.outbound.OrchestrationEventPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Bounded retry loop of a single provider.
 *
 * <p>
 * Retryable failures (rate limit, timeout, connection, server error) are
 * retried after {@code 2^attempt} seconds, multiplied by the backoff factor for
 * rate limits. Client errors are surfaced immediately and unexpected failures
 * abort the loop. No delay follows the final attempt.
 *
 * <p>
 * The request counter grows by one per attempt; the error counter grows by
 * one per call that exhausted its retries or aborted on an unexpected failure.
 */
@Slf4j
public class ProviderRetryExecutor {

    private final String providerName;
    private final int maxRetries;
    private final double backoffFactor;
    private final Duration timeout;
    private final BackoffScheduler backoffScheduler;
    private final OrchestrationEventPort events;

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    public ProviderRetryExecutor(String providerName, int maxRetries, double backoffFactor, Duration timeout,
            BackoffScheduler backoffScheduler, OrchestrationEventPort events) {
        this.providerName = providerName;
        this.maxRetries = Math.max(1, maxRetries);
        this.backoffFactor = backoffFactor;
        this.timeout = timeout;
        this.backoffScheduler = backoffScheduler != null ? backoffScheduler : BackoffScheduler.DELAYED_EXECUTOR;
        this.events = events != null ? events : OrchestrationEventPort.NOOP;
    }

    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(call, 0, result);
        return result;
    }

    /**
     * Streams through the retry policy. A failure after the first fragment has
     * been emitted is not retried.
     */
    public Flux<String> executeStream(Supplier<Flux<String>> call) {
        return Flux.defer(() -> {
            AtomicBoolean emitted = new AtomicBoolean(false);
            Flux<String> source = Flux.defer(() -> {
                requestCount.incrementAndGet();
                return call.get();
            });
            if (timeout != null) {
                source = source.timeout(timeout);
            }
            return source
                    .doOnNext(fragment -> emitted.set(true))
                    .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                        Throwable error = signal.failure();
                        ProviderErrorKind kind = ProviderErrorClassifier.classify(error);
                        int attempt = (int) signal.totalRetries();
                        if (emitted.get() || !kind.isRetryable() || attempt + 1 >= maxRetries) {
                            return Mono.error(error);
                        }
                        Duration delay = backoffDelay(kind, attempt);
                        onRetry(kind, attempt, delay, error);
                        return Mono.fromFuture(() -> backoffScheduler.delay(delay)).thenReturn(attempt);
                    })))
                    .onErrorMap(error -> !(error instanceof ProviderException), error -> {
                        ProviderErrorKind kind = ProviderErrorClassifier.classify(error);
                        if (kind != ProviderErrorKind.CLIENT_ERROR) {
                            errorCount.incrementAndGet();
                        }
                        return toProviderException(kind, error, emitted.get() ? "stream interrupted" : "stream failed");
                    });
        });
    }

    /**
     * Delay before the retry following the given zero-based attempt.
     */
    public Duration backoffDelay(ProviderErrorKind kind, int attempt) {
        double seconds = Math.pow(2, attempt);
        if (kind == ProviderErrorKind.RATE_LIMIT) {
            seconds *= backoffFactor;
        }
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    private <T> void attempt(Supplier<CompletableFuture<T>> call, int attempt, CompletableFuture<T> result) {
        requestCount.incrementAndGet();
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (timeout != null) {
            future = future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        future.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }

            ProviderErrorKind kind = ProviderErrorClassifier.classify(error);
            if (kind == ProviderErrorKind.CLIENT_ERROR) {
                log.warn("[Provider] {} rejected the request: {}", providerName, describe(error));
                result.completeExceptionally(toProviderException(kind, error, "request rejected"));
                return;
            }
            if (kind == ProviderErrorKind.UNEXPECTED) {
                errorCount.incrementAndGet();
                log.error("[Provider] {} unexpected error: {}", providerName, describe(error));
                result.completeExceptionally(toProviderException(kind, error, "unexpected error"));
                return;
            }
            if (attempt + 1 >= maxRetries) {
                errorCount.incrementAndGet();
                log.error("[Provider] {} failed after {} attempts: {}", providerName, maxRetries, describe(error));
                result.completeExceptionally(
                        toProviderException(kind, error, "failed after " + maxRetries + " attempts"));
                return;
            }

            Duration delay = backoffDelay(kind, attempt);
            onRetry(kind, attempt, delay, error);
            backoffScheduler.delay(delay).whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    errorCount.incrementAndGet();
                    result.completeExceptionally(toProviderException(kind, error, "retry interrupted"));
                    return;
                }
                attempt(call, attempt + 1, result);
            });
        });
    }

    private void onRetry(ProviderErrorKind kind, int attempt, Duration delay, Throwable error) {
        log.warn("[Provider] {} {} (attempt {}/{}), retrying in {}ms: {}",
                providerName, kind, attempt + 1, maxRetries, delay.toMillis(), describe(error));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", kind.name());
        payload.put("attempt", attempt + 1);
        payload.put("delayMs", delay.toMillis());
        events.publish(OrchestrationEventType.RETRY_ATTEMPTED, providerName, payload);
    }

    private ProviderException toProviderException(ProviderErrorKind kind, Throwable error, String summary) {
        Throwable cause = ProviderErrorClassifier.unwrap(error);
        if (cause instanceof ProviderException providerException) {
            return providerException;
        }
        String message = "Provider " + providerName + " " + summary + ": " + describe(cause);
        return ProviderException.of(kind, providerName, message, cause);
    }

    private static String describe(Throwable error) {
        Throwable cause = ProviderErrorClassifier.unwrap(error);
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
