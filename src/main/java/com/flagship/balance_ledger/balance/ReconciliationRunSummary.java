package com.flagship.balance_ledger.balance;

import lombok.Value;

/**
 * Outcome of one pass over all accounts. {@code failures} counts accounts
 * whose check threw; they are neither checked nor mismatched.
 */
@Value
public class ReconciliationRunSummary {
    int checked;
    int mismatches;
    int failures;
}
