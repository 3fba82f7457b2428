package com.flagship.balance_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;

/**
 * Appends rows to {@code balance_history}. Rows are only ever inserted.
 */
@Component
@RequiredArgsConstructor
public class BalanceHistoryWriter {

    private final JdbcTemplate jdbcTemplate;

    public void append(BalanceHistoryEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO balance_history (account_id, resulting_balance, change_amount, transaction_id, created_at) " +
            "VALUES (?, ?, ?, ?, ?)",
            entry.getAccountId(),
            entry.getResultingBalance(),
            entry.getChangeAmount(),
            entry.getTransactionId(),
            Timestamp.from(entry.getCreatedAt())
        );
    }
}
