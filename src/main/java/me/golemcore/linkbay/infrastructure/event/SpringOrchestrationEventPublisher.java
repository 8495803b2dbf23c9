package me.golemcore.linkbay.infrastructure.event;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.linkbay.domain.model.OrchestrationEvent;
import me.golemcore.linkbay.port.outbound.OrchestrationEventPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes orchestration events through Spring's ApplicationEventPublisher.
 *
 * <p>
 * Events are delivered synchronously to all {@code @EventListener} methods
 * accepting {@link OrchestrationEvent}. A failing listener never fails the
 * request that emitted the event.
 *
 * <pre>{@code
 * &#64;EventListener
 * public void onEvent(OrchestrationEvent event) {
 *     if (event.type() == OrchestrationEventType.BUDGET_ALERT) {
 *         ...
 *     }
 * }
 * }</pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringOrchestrationEventPublisher implements OrchestrationEventPort {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void publish(OrchestrationEvent event) {
        log.trace("Publishing event: {} from {}", event.type(), event.source());
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("[Events] Listener failed for {}: {}", event.type(), e.getMessage());
        }
    }
}
