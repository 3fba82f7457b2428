package com.flagship.balance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One append-only row of the balance audit trail.
 *
 * {@code id} is null until the row has been written; {@code transactionId} is
 * null for changes that were not made on behalf of a transaction record.
 */
@Value
public class BalanceHistoryEntry {
    Long id;
    long accountId;
    BigDecimal resultingBalance;
    BigDecimal changeAmount;
    Long transactionId;
    Instant createdAt;

    static BalanceHistoryEntry pending(long accountId, BigDecimal resultingBalance,
                                       BigDecimal changeAmount, Long transactionId, Instant createdAt) {
        return new BalanceHistoryEntry(null, accountId, resultingBalance, changeAmount, transactionId, createdAt);
    }
}
