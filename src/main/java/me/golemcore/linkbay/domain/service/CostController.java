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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.exception.BudgetExceededException;
import me.golemcore.linkbay.domain.model.BudgetConfig;
import me.golemcore.linkbay.domain.model.OrchestrationEventType;
import me.golemcore.linkbay.domain.model.UsageSnapshot;
import me.golemcore.linkbay.port.outbound.OrchestrationEventPort;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Enforces hourly and daily token ceilings and an hourly cost ceiling.
 *
 * <p>
 * Usage is bucketed by wall-clock hour ({@code yyyy-MM-dd-HH}) and day
 * ({@code yyyy-MM-dd}) in the zone of the injected {@link Clock}. Buckets
 * older than two hours (hourly) or two days (daily) are evicted on every
 * budget check. All window access is serialized on this instance.
 *
 * <p>
 * {@link #checkBudget} and {@link #recordUsage} are each atomic, but nothing
 * is reserved between them: concurrent requests that pass the check before any
 * of them records may together overshoot a ceiling by up to their combined
 * usage. The overshoot is visible to the next check, which then rejects.
 */
@Slf4j
public class CostController {

    private static final DateTimeFormatter HOUR_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH");
    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final String SOURCE = "budget";

    private final BudgetConfig config;
    private final Clock clock;
    private final OrchestrationEventPort events;

    private final Map<String, Long> hourlyTokens = new HashMap<>();
    private final Map<String, Long> dailyTokens = new HashMap<>();
    private final Map<String, Double> hourlyCost = new HashMap<>();

    public CostController(BudgetConfig config, Clock clock, OrchestrationEventPort events) {
        this.config = config;
        this.clock = clock;
        this.events = events != null ? events : OrchestrationEventPort.NOOP;
    }

    /**
     * Checks whether a request of the given estimated size fits the budget.
     *
     * @param estimatedTokens
     *            estimated tokens of the request, must not be negative
     * @param model
     *            model used to price the request
     * @return {@code true} when the request is within every ceiling
     * @throws IllegalArgumentException
     *             if the estimate is negative or alone exceeds the hourly
     *             token ceiling
     * @throws BudgetExceededException
     *             if the request would exceed a ceiling
     */
    public synchronized boolean checkBudget(long estimatedTokens, String model) {
        if (estimatedTokens < 0) {
            throw new IllegalArgumentException("Estimated tokens must not be negative: " + estimatedTokens);
        }
        if (estimatedTokens > config.getMaxTokensPerHour()) {
            throw new IllegalArgumentException("Estimated tokens " + estimatedTokens
                    + " exceed the hourly limit of " + config.getMaxTokensPerHour());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        evictStaleWindows(now);

        String hourKey = HOUR_KEY.format(now);
        String dayKey = DAY_KEY.format(now);

        long hourTokens = hourlyTokens.getOrDefault(hourKey, 0L);
        if (hourTokens + estimatedTokens > config.getMaxTokensPerHour()) {
            log.warn("[Budget] Hourly token limit reached: {} + {} > {}",
                    hourTokens, estimatedTokens, config.getMaxTokensPerHour());
            throw new BudgetExceededException(BudgetExceededException.Limit.HOURLY_TOKENS,
                    "Hourly token limit exceeded: " + hourTokens + " used, " + estimatedTokens
                            + " requested, limit " + config.getMaxTokensPerHour());
        }

        long dayTokens = dailyTokens.getOrDefault(dayKey, 0L);
        if (dayTokens + estimatedTokens > config.getMaxTokensPerDay()) {
            log.warn("[Budget] Daily token limit reached: {} + {} > {}",
                    dayTokens, estimatedTokens, config.getMaxTokensPerDay());
            throw new BudgetExceededException(BudgetExceededException.Limit.DAILY_TOKENS,
                    "Daily token limit exceeded: " + dayTokens + " used, " + estimatedTokens
                            + " requested, limit " + config.getMaxTokensPerDay());
        }

        double cost = hourlyCost.getOrDefault(hourKey, 0.0);
        double estimatedCost = estimateCost(estimatedTokens, model);
        if (cost + estimatedCost > config.getMaxCostPerHour()) {
            log.warn("[Budget] Hourly cost limit reached: ${} + ${} > ${}",
                    format(cost), format(estimatedCost), config.getMaxCostPerHour());
            throw new BudgetExceededException(BudgetExceededException.Limit.HOURLY_COST,
                    "Hourly cost limit exceeded: $" + format(cost) + " spent, $" + format(estimatedCost)
                            + " requested, limit $" + config.getMaxCostPerHour());
        }

        double usageRatio = (double) (hourTokens + estimatedTokens) / config.getMaxTokensPerHour();
        if (usageRatio > config.getAlertThreshold()) {
            log.warn("[Budget] Hourly token usage at {}%", Math.round(usageRatio * 100));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("hourKey", hourKey);
            payload.put("tokens", hourTokens + estimatedTokens);
            payload.put("limit", config.getMaxTokensPerHour());
            payload.put("ratio", usageRatio);
            events.publish(OrchestrationEventType.BUDGET_ALERT, SOURCE, payload);
        }

        return true;
    }

    /**
     * Adds actual consumption to the current hour and day windows.
     */
    public synchronized void recordUsage(long tokens, String model) {
        if (tokens < 0) {
            throw new IllegalArgumentException("Recorded tokens must not be negative: " + tokens);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        String hourKey = HOUR_KEY.format(now);
        String dayKey = DAY_KEY.format(now);
        double cost = estimateCost(tokens, model);

        hourlyTokens.merge(hourKey, tokens, Long::sum);
        dailyTokens.merge(dayKey, tokens, Long::sum);
        hourlyCost.merge(hourKey, cost, Double::sum);

        log.debug("[Budget] Recorded {} tokens for {} (${})", tokens, model, format(cost));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tokens", tokens);
        payload.put("model", model != null ? model : "");
        payload.put("cost", cost);
        events.publish(OrchestrationEventType.USAGE_RECORDED, SOURCE, payload);
    }

    public synchronized UsageSnapshot getCurrentUsage() {
        LocalDateTime now = LocalDateTime.now(clock);
        String hourKey = HOUR_KEY.format(now);
        String dayKey = DAY_KEY.format(now);

        long hourTokens = hourlyTokens.getOrDefault(hourKey, 0L);
        long dayTokens = dailyTokens.getOrDefault(dayKey, 0L);

        return UsageSnapshot.builder()
                .hourly(UsageSnapshot.HourlyUsage.builder()
                        .tokens(hourTokens)
                        .limit(config.getMaxTokensPerHour())
                        .percent(percent(hourTokens, config.getMaxTokensPerHour()))
                        .cost(hourlyCost.getOrDefault(hourKey, 0.0))
                        .costLimit(config.getMaxCostPerHour())
                        .build())
                .daily(UsageSnapshot.DailyUsage.builder()
                        .tokens(dayTokens)
                        .limit(config.getMaxTokensPerDay())
                        .percent(percent(dayTokens, config.getMaxTokensPerDay()))
                        .build())
                .build();
    }

    public synchronized void resetBudgets() {
        hourlyTokens.clear();
        dailyTokens.clear();
        hourlyCost.clear();
        log.info("[Budget] Usage windows reset");
    }

    /**
     * Estimated USD cost of the given number of tokens on a model. Unknown
     * models use the default unit price.
     */
    public double estimateCost(long tokens, String model) {
        return tokens * config.unitPrice(model);
    }

    private void evictStaleWindows(LocalDateTime now) {
        String hourThreshold = HOUR_KEY.format(now.minusHours(2));
        String dayThreshold = DAY_KEY.format(now.minusDays(2));
        // Keys sort chronologically as strings
        hourlyTokens.keySet().removeIf(key -> key.compareTo(hourThreshold) <= 0);
        hourlyCost.keySet().removeIf(key -> key.compareTo(hourThreshold) <= 0);
        dailyTokens.keySet().removeIf(key -> key.compareTo(dayThreshold) <= 0);
    }

    int windowCount() {
        return hourlyTokens.size() + dailyTokens.size() + hourlyCost.size();
    }

    private static double percent(long used, long limit) {
        return limit > 0 ? used * 100.0 / limit : 0.0;
    }

    private static String format(double amount) {
        return String.format(Locale.ROOT, "%.4f", amount);
    }
}
