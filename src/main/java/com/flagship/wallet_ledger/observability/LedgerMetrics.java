package com.flagship.wallet_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized Micrometer metrics for the ledger.
 *
 * Metrics exposed:
 * - ledger.operations: postings by operation and outcome (success or error code)
 * - ledger.operation.latency: time spent per operation
 * - ledger.invariant.broken: data-integrity incidents, should always be zero
 * - ledger.trial_balance.delta / ledger.trial_balance.runs: last audit result
 * - ledger.reconciliation.drift: balances that disagree with the entry log
 * - outbox.events.*: publisher outcomes
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final AtomicLong trialBalanceDelta = new AtomicLong(0);
    private final AtomicLong balanceDrift = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("ledger.trial_balance.delta", trialBalanceDelta, AtomicLong::get)
                .description("Sum of debits minus sum of credits at the last trial balance run")
                .register(registry);

        Gauge.builder("ledger.reconciliation.drift", balanceDrift, AtomicLong::get)
                .description("Running balances that differ from a replay of the entry log")
                .register(registry);
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordInvariantBroken(String operation) {
        registry.counter("ledger.invariant.broken",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordTrialBalance(String status, long delta) {
        trialBalanceDelta.set(delta);
        registry.counter("ledger.trial_balance.runs", "status", sanitizeTag(status)).increment();
    }

    public void recordBalanceDrift(int driftCount) {
        balanceDrift.set(driftCount);
    }

    public void recordEventPublished(String eventType) {
        registry.counter("outbox.events.published",
                "event_type", sanitizeTag(eventType),
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        registry.counter("outbox.events.published",
                "event_type", sanitizeTag(eventType),
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        registry.counter("outbox.events.dead_lettered", "event_type", sanitizeTag(eventType)).increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
