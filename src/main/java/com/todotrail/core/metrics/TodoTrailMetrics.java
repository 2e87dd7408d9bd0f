package com.todotrail.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for change tracking, citations, triggers, rollbacks and scope.
 */
@Service
public class TodoTrailMetrics {

    private final MeterRegistry registry;

    public TodoTrailMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordChangeAppended(String changeType) {
        Counter.builder("todotrail.changes.appended")
                .tag("type", changeType)
                .register(registry)
                .increment();
    }

    public void recordCitationCreated(String citationType, String priority) {
        Counter.builder("todotrail.citations.created")
                .tag("type", citationType)
                .tag("priority", priority)
                .register(registry)
                .increment();
    }

    public void recordCitationDismissed() {
        Counter.builder("todotrail.citations.dismissed")
                .register(registry)
                .increment();
    }

    public void recordCitationReviewed() {
        Counter.builder("todotrail.citations.reviewed")
                .register(registry)
                .increment();
    }

    /**
     * @param triggerId the trigger that fired
     * @param junction  where it fired, e.g. "session-start"
     */
    public void recordTriggerFired(String triggerId, String junction) {
        Counter.builder("todotrail.triggers.fired")
                .description("Lookup triggers whose conditions held at a junction")
                .tag("trigger", triggerId)
                .tag("junction", junction)
                .register(registry)
                .increment();
    }

    public void recordRollback(String type, String status) {
        Counter.builder("todotrail.rollbacks.total")
                .tag("type", type)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordScopeViolations(String tier, String mode, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("todotrail.scope.violations")
                .description("Scope creep findings by tier and enforcement mode")
                .tag("tier", tier)
                .tag("mode", mode)
                .register(registry)
                .increment(count);
    }
}
