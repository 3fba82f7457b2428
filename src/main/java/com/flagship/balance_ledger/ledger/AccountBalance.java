package com.flagship.balance_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Current, authoritative balance of one account. Never negative.
 */
@Value
public class AccountBalance {
    long accountId;
    BigDecimal amount;
    Instant lastUpdatedAt;
}
