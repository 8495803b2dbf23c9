package me.golemcore.linkbay.usage;

import me.golemcore.linkbay.domain.model.OrchestratorAnalytics;
import me.golemcore.linkbay.domain.model.ProviderStats;
import me.golemcore.linkbay.domain.model.RequestRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestHistoryTest {

    @Test
    void record_dropsOldestBeyondCapacity() {
        RequestHistory history = new RequestHistory(2);

        history.record(request("a", "deepseek", "deepseek-chat", 1, false, 10));
        history.record(request("b", "deepseek", "deepseek-chat", 1, false, 10));
        history.record(request("c", "deepseek", "deepseek-chat", 1, false, 10));

        assertEquals(List.of("b", "c"), history.getRecords().stream().map(RequestRecord::getPrompt).toList());
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RequestHistory(0));
    }

    @Test
    void getAnalytics_groupsByProviderAndModel() {
        RequestHistory history = new RequestHistory(10);
        history.record(request("q1", "deepseek", "deepseek-chat", 100, false, 200));
        history.record(request("q2", "openai", "gpt-4", 50, false, 400));
        history.record(request("q3", "cache", "cache", 0, true, 0));
        history.record(request("q4", null, null, 10, false, 0));
        List<ProviderStats> providers = List.of(ProviderStats.builder().name("deepseek").build());

        OrchestratorAnalytics analytics = history.getAnalytics(providers, null);

        assertEquals(4, analytics.getTotalRequests());
        assertEquals(1, analytics.getCachedResponses());
        assertEquals(160, analytics.getTotalTokens());
        assertEquals(Duration.ofMillis(150), analytics.getAvgLatency());
        assertEquals(Map.of("deepseek", 1L, "openai", 1L, "cache", 1L, "unknown", 1L),
                analytics.getRequestsByProvider());
        assertEquals(Map.of("deepseek-chat", 100L, "gpt-4", 50L, "cache", 0L, "unknown", 10L),
                analytics.getTokensByModel());
        assertSame(providers, analytics.getProviders());
    }

    @Test
    void getAnalytics_emptyHistory() {
        OrchestratorAnalytics analytics = new RequestHistory(5).getAnalytics(List.of(), null);

        assertEquals(0, analytics.getTotalRequests());
        assertEquals(Duration.ZERO, analytics.getAvgLatency());
        assertTrue(analytics.getRequestsByModel().isEmpty());
    }

    @Test
    void clear_removesRecords() {
        RequestHistory history = new RequestHistory(5);
        history.record(request("q", "deepseek", "deepseek-chat", 1, false, 1));

        history.clear();

        assertTrue(history.getRecords().isEmpty());
    }

    private static RequestRecord request(String prompt, String provider, String model, long tokens, boolean cached,
            long latencyMs) {
        return RequestRecord.builder()
                .timestamp(Instant.parse("2026-03-10T10:00:00Z"))
                .prompt(prompt)
                .provider(provider)
                .model(model)
                .tokens(tokens)
                .cached(cached)
                .latency(Duration.ofMillis(latencyMs))
                .build();
    }
}
