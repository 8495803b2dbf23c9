package me.golemcore.linkbay.domain.model;

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
import lombok.Data;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Aggregated view over the request history, provider counters and budget.
 *
 * <p>
 * Request and token counts cover the records still retained in the bounded
 * history.
 */
@Data
@Builder
public class OrchestratorAnalytics {

    private long totalRequests;
    private long cachedResponses;
    private long totalTokens;
    private Duration avgLatency;

    private Map<String, Long> requestsByProvider;
    private Map<String, Long> requestsByModel;
    private Map<String, Long> tokensByModel;

    private List<ProviderStats> providers;
    private UsageSnapshot budget;
}
