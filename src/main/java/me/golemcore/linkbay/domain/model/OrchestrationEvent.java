package me.golemcore.linkbay.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Structured event emitted by providers, the budget controller and the tool
 * dispatcher.
 */
@Builder public record OrchestrationEvent(OrchestrationEventType type,Instant timestamp,String source,Map<String,Object>payload){}
