package me.golemcore.linkbay.port.outbound;

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

import me.golemcore.linkbay.domain.model.OrchestrationEvent;
import me.golemcore.linkbay.domain.model.OrchestrationEventType;

import java.time.Instant;
import java.util.Map;

/**
 * Sink for structured orchestration events.
 */
public interface OrchestrationEventPort {

    OrchestrationEventPort NOOP = event -> {
    };

    void publish(OrchestrationEvent event);

    default void publish(OrchestrationEventType type, String source, Map<String, Object> payload) {
        publish(OrchestrationEvent.builder()
                .type(type)
                .timestamp(Instant.now())
                .source(source)
                .payload(payload != null ? payload : Map.of())
                .build());
    }
}
