package com.flagship.balance_ledger.ledger;

import java.util.Locale;

/**
 * How a balance history row relates to the balance update it describes.
 */
public enum HistoryWriteMode {

    /**
     * History row commits or aborts together with the balance update.
     */
    ATOMIC,

    /**
     * History row is written inside a savepoint. A failure is logged and
     * counted, the balance update still commits, and the resulting drift is
     * left for reconciliation to find.
     */
    BEST_EFFORT;

    public static HistoryWriteMode fromProperty(String value) {
        if (value == null || value.isBlank()) {
            return ATOMIC;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown ledger.history.mode '" + value + "', expected atomic or best-effort", e);
        }
    }
}
