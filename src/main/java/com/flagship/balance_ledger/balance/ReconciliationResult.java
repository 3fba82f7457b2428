package com.flagship.balance_ledger.balance;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Outcome of comparing a stored balance against the sum of its history.
 */
@Value
public class ReconciliationResult {
    long accountId;
    BigDecimal storedBalance;
    BigDecimal historyBalance;

    /**
     * storedBalance - historyBalance. Zero when consistent.
     */
    public BigDecimal getDiscrepancy() {
        return storedBalance.subtract(historyBalance);
    }

    public boolean isConsistent() {
        return storedBalance.compareTo(historyBalance) == 0;
    }
}
