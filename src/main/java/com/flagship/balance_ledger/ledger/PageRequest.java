package com.flagship.balance_ledger.ledger;

import lombok.Value;

/**
 * Validated limit/offset pair for paginated ledger reads.
 */
@Value
public class PageRequest {
    int limit;
    int offset;
}
