package me.golemcore.linkbay.usage;

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
import me.golemcore.linkbay.domain.model.OrchestratorAnalytics;
import me.golemcore.linkbay.domain.model.ProviderStats;
import me.golemcore.linkbay.domain.model.RequestRecord;
import me.golemcore.linkbay.domain.model.UsageSnapshot;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Bounded in-process history of completed requests and the analytics derived
 * from it. The oldest record is dropped once the capacity is reached.
 */
@Slf4j
public class RequestHistory {

    private static final String UNKNOWN = "unknown";

    private final int maxEntries;
    private final Deque<RequestRecord> records = new ArrayDeque<>();

    public RequestHistory(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
    }

    public synchronized void record(RequestRecord requestRecord) {
        records.addLast(requestRecord);
        while (records.size() > maxEntries) {
            records.removeFirst();
        }
        log.trace("[Usage] Recorded request: provider={}, model={}, tokens={}",
                requestRecord.getProvider(), requestRecord.getModel(), requestRecord.getTokens());
    }

    public synchronized List<RequestRecord> getRecords() {
        return List.copyOf(records);
    }

    public synchronized void clear() {
        records.clear();
    }

    public OrchestratorAnalytics getAnalytics(List<ProviderStats> providers, UsageSnapshot budget) {
        List<RequestRecord> snapshot = getRecords();

        long cached = snapshot.stream().filter(RequestRecord::isCached).count();
        long totalTokens = snapshot.stream().mapToLong(RequestRecord::getTokens).sum();
        long avgLatencyMs = (long) snapshot.stream()
                .map(RequestRecord::getLatency)
                .filter(Objects::nonNull)
                .mapToLong(Duration::toMillis)
                .average()
                .orElse(0);

        Map<String, Long> requestsByProvider = snapshot.stream()
                .collect(Collectors.groupingBy(r -> keyOf(r.getProvider()), TreeMap::new, Collectors.counting()));
        Map<String, Long> requestsByModel = snapshot.stream()
                .collect(Collectors.groupingBy(r -> keyOf(r.getModel()), TreeMap::new, Collectors.counting()));
        Map<String, Long> tokensByModel = snapshot.stream()
                .collect(Collectors.groupingBy(r -> keyOf(r.getModel()), TreeMap::new,
                        Collectors.summingLong(RequestRecord::getTokens)));

        return OrchestratorAnalytics.builder()
                .totalRequests(snapshot.size())
                .cachedResponses(cached)
                .totalTokens(totalTokens)
                .avgLatency(Duration.ofMillis(avgLatencyMs))
                .requestsByProvider(requestsByProvider)
                .requestsByModel(requestsByModel)
                .tokensByModel(tokensByModel)
                .providers(providers)
                .budget(budget)
                .build();
    }

    private static String keyOf(String value) {
        return value != null ? value : UNKNOWN;
    }
}
