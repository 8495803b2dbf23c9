package me.golemcore.linkbay.adapter.outbound.cache;

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
import me.golemcore.linkbay.domain.model.CacheStats;
import me.golemcore.linkbay.infrastructure.config.LinkbayProperties;
import me.golemcore.linkbay.port.outbound.EmbeddingPort;
import me.golemcore.linkbay.port.outbound.ResponseCachePort;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Response cache matching prompts by embedding similarity.
 *
 * <p>
 * A lookup hits when the cosine similarity between the prompt and a cached
 * prompt reaches the configured threshold. Without a usable
 * {@link EmbeddingPort} the cache matches on normalized prompt text only.
 * Entries expire after the TTL; the oldest entry is evicted once the cache is
 * full.
 */
@Slf4j
public class SemanticResponseCache implements ResponseCachePort {

    private final EmbeddingPort embeddingPort;
    private final LinkbayProperties.CacheProperties config;
    private final Clock clock;

    private final List<CacheEntry> entries = new ArrayList<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public SemanticResponseCache(EmbeddingPort embeddingPort, LinkbayProperties.CacheProperties config,
            Clock clock) {
        this.embeddingPort = embeddingPort;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Optional<String>> getCachedResponse(String query) {
        String normalized = normalize(query);
        if (!isSemantic()) {
            return CompletableFuture.completedFuture(countLookup(findExact(normalized)));
        }
        return embeddingPort.embed(query)
                .thenApply(vector -> countLookup(findSimilar(normalized, vector)))
                .exceptionally(error -> {
                    log.warn("[Cache] Embedding lookup failed, using exact match: {}", error.getMessage());
                    return countLookup(findExact(normalized));
                });
    }

    @Override
    public CompletableFuture<Void> cacheResponse(String query, String content) {
        String normalized = normalize(query);
        if (!isSemantic()) {
            store(new CacheEntry(normalized, null, content, clock.instant()));
            return CompletableFuture.completedFuture(null);
        }
        return embeddingPort.embed(query)
                .thenAccept(vector -> store(new CacheEntry(normalized, vector, content, clock.instant())));
    }

    @Override
    public synchronized void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
    }

    @Override
    public synchronized CacheStats getStats() {
        return CacheStats.builder()
                .size(entries.size())
                .maxEntries(config.getMaxEntries())
                .hits(hits.get())
                .misses(misses.get())
                .similarityThreshold(config.getSimilarityThreshold())
                .semantic(isSemantic())
                .build();
    }

    private boolean isSemantic() {
        return embeddingPort != null && embeddingPort.isAvailable();
    }

    private synchronized Optional<String> findExact(String normalized) {
        evictExpired();
        for (CacheEntry entry : entries) {
            if (entry.query().equals(normalized)) {
                return Optional.of(entry.content());
            }
        }
        return Optional.empty();
    }

    private synchronized Optional<String> findSimilar(String normalized, float[] vector) {
        evictExpired();
        CacheEntry best = null;
        double bestScore = -1;
        for (CacheEntry entry : entries) {
            if (entry.embedding() == null) {
                if (entry.query().equals(normalized)) {
                    return Optional.of(entry.content());
                }
                continue;
            }
            if (entry.embedding().length != vector.length) {
                continue;
            }
            double score = embeddingPort.cosineSimilarity(vector, entry.embedding());
            if (score > bestScore) {
                bestScore = score;
                best = entry;
            }
        }
        if (best != null && bestScore >= config.getSimilarityThreshold()) {
            log.debug("[Cache] Semantic hit (similarity {})", String.format(Locale.ROOT, "%.3f", bestScore));
            return Optional.of(best.content());
        }
        return Optional.empty();
    }

    private synchronized void store(CacheEntry entry) {
        evictExpired();
        entries.removeIf(existing -> existing.query().equals(entry.query()));
        entries.add(entry);
        while (entries.size() > config.getMaxEntries()) {
            entries.remove(0);
        }
    }

    private void evictExpired() {
        if (config.getTtl() == null) {
            return;
        }
        Instant threshold = clock.instant().minus(config.getTtl());
        Iterator<CacheEntry> iterator = entries.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().createdAt().isBefore(threshold)) {
                iterator.remove();
            }
        }
    }

    private Optional<String> countLookup(Optional<String> result) {
        if (result.isPresent()) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return result;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private record CacheEntry(String query, float[] embedding, String content, Instant createdAt) {
    }
}
