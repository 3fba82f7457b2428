package com.flagship.balance_ledger.config;

import com.flagship.balance_ledger.exception.ValidationException;
import com.flagship.balance_ledger.ledger.PageRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns caller supplied limit/offset into a bounded {@link PageRequest}.
 */
@Component
public class PaginationPolicy {

    private final int defaultLimit;
    private final int maxLimit;

    public PaginationPolicy(@Value("${ledger.pagination.default-limit:50}") int defaultLimit,
                            @Value("${ledger.pagination.max-limit:500}") int maxLimit) {
        if (defaultLimit <= 0 || maxLimit < defaultLimit) {
            throw new IllegalArgumentException(String.format(
                    "Invalid pagination settings: default-limit=%d, max-limit=%d", defaultLimit, maxLimit));
        }
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * @param limit requested page size, null for the default; capped at the configured maximum
     * @param offset rows to skip, null for zero
     */
    public PageRequest resolve(Integer limit, Integer offset) {
        int effectiveLimit = limit == null ? defaultLimit : limit;
        int effectiveOffset = offset == null ? 0 : offset;

        if (effectiveLimit <= 0) {
            throw new ValidationException("limit", "limit must be greater than zero, got " + effectiveLimit);
        }
        if (effectiveOffset < 0) {
            throw new ValidationException("offset", "offset must not be negative, got " + effectiveOffset);
        }
        return new PageRequest(Math.min(effectiveLimit, maxLimit), effectiveOffset);
    }
}
