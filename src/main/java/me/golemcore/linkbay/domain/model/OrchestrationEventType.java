package me.golemcore.linkbay.domain.model;

/**
 * Stable event types emitted during orchestrated requests.
 */
public enum OrchestrationEventType {
    USAGE_RECORDED, BUDGET_ALERT, RETRY_ATTEMPTED, PROVIDER_FAILED, PROVIDER_SUCCEEDED, TOOL_EXECUTED, TOOL_FAILED, CACHE_HIT
}
