package com.flagship.balance_ledger.ledger;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Timestamps written to the ledger tables.
 *
 * Truncated to microseconds so that a value read back from the database is
 * equal to the one that was written.
 */
public final class LedgerTimestamps {

    private LedgerTimestamps() {
    }

    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
