package me.golemcore.linkbay.adapter.outbound.llm;

import me.golemcore.linkbay.domain.exception.ChatBackendException;
import me.golemcore.linkbay.domain.exception.ProviderException;
import me.golemcore.linkbay.domain.exception.ProviderRateLimitException;
import me.golemcore.linkbay.domain.model.OrchestrationEvent;
import me.golemcore.linkbay.domain.model.OrchestrationEventType;
import me.golemcore.linkbay.domain.model.ProviderErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProviderRetryExecutorTest {

    private List<Duration> delays;
    private List<OrchestrationEvent> events;
    private ProviderRetryExecutor executor;

    @BeforeEach
    void setUp() {
        delays = new ArrayList<>();
        events = new ArrayList<>();
        BackoffScheduler recording = duration -> {
            delays.add(duration);
            return CompletableFuture.completedFuture(null);
        };
        executor = new ProviderRetryExecutor("deepseek", 3, 1.5, Duration.ofSeconds(5), recording, events::add);
    }

    @Test
    void execute_retriesRateLimitWithIncreasingBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute(() -> calls.incrementAndGet() <= 2
                ? CompletableFuture.<String>failedFuture(
                        new ChatBackendException(ProviderErrorKind.RATE_LIMIT, "429 Too Many Requests"))
                : CompletableFuture.completedFuture("ok")).get();

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(1500), Duration.ofMillis(3000)), delays);
        assertEquals(3, executor.getRequestCount());
        assertEquals(0, executor.getErrorCount());
    }

    @Test
    void execute_publishesRetryEvents() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        executor.execute(() -> calls.incrementAndGet() == 1
                ? CompletableFuture.<String>failedFuture(
                        new ChatBackendException(ProviderErrorKind.SERVER_ERROR, "502 Bad Gateway"))
                : CompletableFuture.completedFuture("ok")).get();

        assertEquals(1, events.size());
        assertEquals(OrchestrationEventType.RETRY_ATTEMPTED, events.get(0).type());
        assertEquals("deepseek", events.get(0).source());
        assertEquals("SERVER_ERROR", events.get(0).payload().get("kind"));
        assertEquals(1000L, events.get(0).payload().get("delayMs"));
    }

    @Test
    void execute_exhaustsRetriesWithoutSleepingAfterLastAttempt() {
        CompletableFuture<String> future = executor.execute(() -> CompletableFuture.failedFuture(
                new ChatBackendException(ProviderErrorKind.RATE_LIMIT, "429 Too Many Requests")));

        ExecutionException exception = assertThrows(ExecutionException.class, future::get);
        ProviderRateLimitException cause = assertInstanceOf(ProviderRateLimitException.class, exception.getCause());
        assertEquals("deepseek", cause.getProviderName());
        assertEquals(ProviderErrorKind.RATE_LIMIT, cause.getKind());
        assertTrue(cause.getMessage().contains("failed after 3 attempts"));
        assertEquals(2, delays.size());
        assertEquals(3, executor.getRequestCount());
        assertEquals(1, executor.getErrorCount());
    }

    @Test
    void execute_nonRateLimitBackoffIgnoresFactor() {
        CompletableFuture<String> future = executor.execute(() -> CompletableFuture.failedFuture(
                new ChatBackendException(ProviderErrorKind.CONNECTION, "connection refused")));

        assertThrows(ExecutionException.class, future::get);
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), delays);
    }

    @Test
    void execute_doesNotRetryClientError() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> future = executor.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(
                    new ChatBackendException(ProviderErrorKind.CLIENT_ERROR, "401 Unauthorized"));
        });

        ExecutionException exception = assertThrows(ExecutionException.class, future::get);
        ProviderException cause = assertInstanceOf(ProviderException.class, exception.getCause());
        assertEquals(ProviderErrorKind.CLIENT_ERROR, cause.getKind());
        assertEquals(1, calls.get());
        assertTrue(delays.isEmpty());
        assertEquals(0, executor.getErrorCount());
    }

    @Test
    void execute_abortsOnUnexpectedError() {
        AtomicInteger calls = new AtomicInteger();

        CompletableFuture<String> future = executor.execute(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        ExecutionException exception = assertThrows(ExecutionException.class, future::get);
        ProviderException cause = assertInstanceOf(ProviderException.class, exception.getCause());
        assertEquals(ProviderErrorKind.UNEXPECTED, cause.getKind());
        assertTrue(cause.getMessage().contains("boom"));
        assertEquals(1, calls.get());
        assertTrue(delays.isEmpty());
        assertEquals(1, executor.getErrorCount());
    }

    @Test
    void execute_timesOutSlowCalls() {
        ProviderRetryExecutor fast = new ProviderRetryExecutor("slow", 1, 1.5, Duration.ofMillis(50),
                duration -> CompletableFuture.completedFuture(null), null);

        CompletableFuture<String> future = fast.execute(CompletableFuture::new);

        ExecutionException exception = assertThrows(ExecutionException.class, future::get);
        ProviderException cause = assertInstanceOf(ProviderException.class, exception.getCause());
        assertEquals(ProviderErrorKind.TIMEOUT, cause.getKind());
    }

    @Test
    void backoffDelay_growsExponentially() {
        assertEquals(Duration.ofSeconds(1), executor.backoffDelay(ProviderErrorKind.TIMEOUT, 0));
        assertEquals(Duration.ofSeconds(4), executor.backoffDelay(ProviderErrorKind.SERVER_ERROR, 2));
        assertEquals(Duration.ofMillis(6000), executor.backoffDelay(ProviderErrorKind.RATE_LIMIT, 2));
    }

    @Test
    void executeStream_retriesBeforeFirstFragment() {
        AtomicInteger calls = new AtomicInteger();

        Flux<String> stream = executor.executeStream(() -> calls.incrementAndGet() == 1
                ? Flux.error(new ChatBackendException(ProviderErrorKind.CONNECTION, "reset"))
                : Flux.just("Hel", "lo"));

        StepVerifier.create(stream)
                .expectNext("Hel", "lo")
                .verifyComplete();
        assertEquals(2, calls.get());
        assertEquals(List.of(Duration.ofSeconds(1)), delays);
    }

    @Test
    void executeStream_doesNotRetryAfterFirstFragment() {
        AtomicInteger calls = new AtomicInteger();

        Flux<String> stream = executor.executeStream(() -> {
            calls.incrementAndGet();
            return Flux.just("partial")
                    .concatWith(Flux.error(new ChatBackendException(ProviderErrorKind.CONNECTION, "reset")));
        });

        StepVerifier.create(stream)
                .expectNext("partial")
                .expectErrorSatisfies(error -> {
                    ProviderException providerException = assertInstanceOf(ProviderException.class, error);
                    assertTrue(providerException.getMessage().contains("stream interrupted"));
                })
                .verify();
        assertEquals(1, calls.get());
        assertTrue(delays.isEmpty());
    }

    @Test
    void executeStream_doesNotRetryClientError() {
        AtomicInteger calls = new AtomicInteger();

        Flux<String> stream = executor.executeStream(() -> {
            calls.incrementAndGet();
            return Flux.error(new ChatBackendException(ProviderErrorKind.CLIENT_ERROR, "400 Bad Request"));
        });

        StepVerifier.create(stream)
                .expectError(ProviderException.class)
                .verify();
        assertEquals(1, calls.get());
    }
}
