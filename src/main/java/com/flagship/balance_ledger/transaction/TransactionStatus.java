package com.flagship.balance_ledger.transaction;

/**
 * Transaction record status.
 *
 * PENDING → COMPLETED → ROLLED_BACK, no other edges.
 * PENDING is only ever visible inside the atomic unit that creates the record.
 */
public enum TransactionStatus {
    PENDING,

    /**
     * Balances have been changed. Can be compensated once.
     */
    COMPLETED,

    /**
     * Compensated by reverse balance changes. Terminal.
     */
    ROLLED_BACK
}
