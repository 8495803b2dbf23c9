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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Non-blocking delay between retry attempts.
 */
@FunctionalInterface
public interface BackoffScheduler {

    BackoffScheduler DELAYED_EXECUTOR = duration -> CompletableFuture.runAsync(() -> {
    }, CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS));

    /**
     * Returns a future that completes once the given duration has elapsed.
     */
    CompletableFuture<Void> delay(Duration duration);
}
