package com.flagship.balance_ledger.config;

import com.flagship.balance_ledger.exception.ValidationException;
import com.flagship.balance_ledger.ledger.PageRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaginationPolicyTest {

    private final PaginationPolicy policy = new PaginationPolicy(50, 500);

    @Test
    @DisplayName("Missing limit and offset fall back to defaults")
    void defaults() {
        PageRequest page = policy.resolve(null, null);

        assertEquals(50, page.getLimit());
        assertEquals(0, page.getOffset());
    }

    @Test
    @DisplayName("Limit is capped at the configured maximum")
    void capsLimit() {
        assertEquals(500, policy.resolve(10_000, 0).getLimit());
        assertEquals(20, policy.resolve(20, 40).getLimit());
        assertEquals(40, policy.resolve(20, 40).getOffset());
    }

    @Test
    @DisplayName("Non-positive limit and negative offset are rejected")
    void rejectsInvalidValues() {
        ValidationException limit = assertThrows(ValidationException.class, () -> policy.resolve(0, 0));
        assertEquals("limit", limit.getField());

        ValidationException offset = assertThrows(ValidationException.class, () -> policy.resolve(10, -1));
        assertEquals("offset", offset.getField());
    }

    @Test
    @DisplayName("Inconsistent settings fail fast")
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new PaginationPolicy(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new PaginationPolicy(100, 10));
    }
}
