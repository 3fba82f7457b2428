package com.flagship.balance_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transactions: counter tagged by type (credit, debit, transfer, rollback) and outcome
 * - ledger.transactions.latency: timer tagged by type
 * - ledger.history.append.failures: history rows lost in best-effort mode
 * - ledger.reconciliations: counter tagged by result (consistent, mismatch)
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter historyAppendFailures;
    private final Counter reconciliationsConsistent;
    private final Counter reconciliationsMismatch;
    private final Counter reconciliationsFailed;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.historyAppendFailures = Counter.builder("ledger.history.append.failures")
                .description("Balance changes committed without their history row")
                .register(registry);

        this.reconciliationsConsistent = Counter.builder("ledger.reconciliations")
                .tag("result", "consistent")
                .description("Reconciliation checks by result")
                .register(registry);

        this.reconciliationsMismatch = Counter.builder("ledger.reconciliations")
                .tag("result", "mismatch")
                .description("Reconciliation checks by result")
                .register(registry);

        this.reconciliationsFailed = Counter.builder("ledger.reconciliations")
                .tag("result", "error")
                .description("Reconciliation checks by result")
                .register(registry);
    }

    /**
     * Records a finished orchestrator operation.
     *
     * @param type credit, debit, transfer or rollback
     * @param outcome "success" or the error code of the failure
     */
    public void recordTransaction(String type, String outcome) {
        registry.counter("ledger.transactions",
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String type, long durationMs) {
        registry.timer("ledger.transactions.latency",
                "type", sanitizeTag(type)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordHistoryAppendFailure() {
        historyAppendFailures.increment();
    }

    public void recordReconciliation(boolean consistent) {
        if (consistent) {
            reconciliationsConsistent.increment();
        } else {
            reconciliationsMismatch.increment();
        }
    }

    public void recordReconciliationFailure() {
        reconciliationsFailed.increment();
    }

    public double historyAppendFailureCount() {
        return historyAppendFailures.count();
    }

    public double reconciliationMismatchCount() {
        return reconciliationsMismatch.count();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
