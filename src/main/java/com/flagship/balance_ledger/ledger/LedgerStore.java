package com.flagship.balance_ledger.ledger;

import com.flagship.balance_ledger.exception.BalanceLimitExceededException;
import com.flagship.balance_ledger.exception.InsufficientFundsException;
import com.flagship.balance_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of balances and the balance history.
 *
 * The one mutating primitive is {@link #applyDelta}. It must run inside an
 * atomic unit opened by the caller and holds the balance row's exclusive lock
 * from the read until that unit commits, which makes the non-negative check
 * authoritative across threads and processes alike.
 *
 * Plain JDBC on purpose: every statement that touches money is visible here,
 * locks included.
 */
@Repository
@Slf4j
public class LedgerStore {

    private final JdbcTemplate jdbcTemplate;
    private final BalanceHistoryWriter historyWriter;
    private final TransactionTemplate savepointTemplate;
    private final LedgerMetrics ledgerMetrics;
    private final HistoryWriteMode historyMode;

    public LedgerStore(JdbcTemplate jdbcTemplate,
                       BalanceHistoryWriter historyWriter,
                       @Qualifier("savepointTransactionTemplate") TransactionTemplate savepointTemplate,
                       LedgerMetrics ledgerMetrics,
                       @Value("${ledger.history.mode:atomic}") String historyMode) {
        this.jdbcTemplate = jdbcTemplate;
        this.historyWriter = historyWriter;
        this.savepointTemplate = savepointTemplate;
        this.ledgerMetrics = ledgerMetrics;
        this.historyMode = HistoryWriteMode.fromProperty(historyMode);
        log.info("Ledger store initialised: historyMode={}", this.historyMode);
    }

    public HistoryWriteMode getHistoryMode() {
        return historyMode;
    }

    /**
     * Applies a signed change to an account balance.
     *
     * 1. Creates the balance row at zero if it does not exist yet
     * 2. Reads the balance with an exclusive row lock
     * 3. Rejects the change if the result would be negative or overflow
     *    the balance column
     * 4. Persists the new balance and appends a history row
     *
     * @param accountId account to change
     * @param delta signed change, negative for withdrawals
     * @param transactionId transaction record the change belongs to, may be null
     * @return the balance after the change
     * @throws InsufficientFundsException if the balance would go below zero;
     *         nothing has been written when this is thrown
     * @throws BalanceLimitExceededException if the balance would exceed
     *         {@link LedgerValidation#MAX_BALANCE}; nothing has been written either
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AccountBalance applyDelta(long accountId, BigDecimal delta, Long transactionId) {
        AccountBalance current = lockBalance(accountId);
        BigDecimal updated = current.getAmount().add(delta);

        if (updated.signum() < 0) {
            throw new InsufficientFundsException(accountId, current.getAmount(), delta.negate());
        }
        if (updated.compareTo(LedgerValidation.MAX_BALANCE) > 0) {
            throw new BalanceLimitExceededException(accountId, current.getAmount(), delta);
        }

        Instant now = LedgerTimestamps.now();
        jdbcTemplate.update(
            "UPDATE balances SET amount = ?, updated_at = ? WHERE account_id = ?",
            updated,
            Timestamp.from(now),
            accountId
        );

        recordHistory(BalanceHistoryEntry.pending(accountId, updated, delta, transactionId, now));

        log.debug("Applied balance change: accountId={}, delta={}, balance={}, transactionId={}",
                accountId, delta.toPlainString(), updated.toPlainString(), transactionId);

        return new AccountBalance(accountId, updated, now);
    }

    /**
     * Reads a balance holding its exclusive row lock until the surrounding
     * unit ends. Creates the row at zero first if it is missing.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AccountBalance lockBalance(long accountId) {
        initializeIfAbsent(accountId);
        return jdbcTemplate.queryForObject(
            "SELECT account_id, amount, updated_at FROM balances WHERE account_id = ? FOR UPDATE",
            balanceRowMapper(),
            accountId
        );
    }

    /**
     * Returns the balance row, creating it at zero when the account has never
     * been seen.
     */
    @Transactional
    public AccountBalance getOrCreateBalance(long accountId) {
        initializeIfAbsent(accountId);
        return jdbcTemplate.queryForObject(
            "SELECT account_id, amount, updated_at FROM balances WHERE account_id = ?",
            balanceRowMapper(),
            accountId
        );
    }

    /**
     * Reads the balance row without side effects and without locking.
     */
    public Optional<AccountBalance> findBalance(long accountId) {
        List<AccountBalance> rows = jdbcTemplate.query(
            "SELECT account_id, amount, updated_at FROM balances WHERE account_id = ?",
            balanceRowMapper(),
            accountId
        );
        return rows.stream().findFirst();
    }

    /**
     * History of one account, newest first.
     */
    public List<BalanceHistoryEntry> findHistory(long accountId, PageRequest page) {
        return jdbcTemplate.query(
            "SELECT id, account_id, resulting_balance, change_amount, transaction_id, created_at " +
            "FROM balance_history WHERE account_id = ? " +
            "ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?",
            historyRowMapper(),
            accountId,
            page.getLimit(),
            page.getOffset()
        );
    }

    /**
     * Latest history row written at or before {@code at}.
     */
    public Optional<BalanceHistoryEntry> findLatestHistoryAtOrBefore(long accountId, Instant at) {
        List<BalanceHistoryEntry> rows = jdbcTemplate.query(
            "SELECT id, account_id, resulting_balance, change_amount, transaction_id, created_at " +
            "FROM balance_history WHERE account_id = ? AND created_at <= ? " +
            "ORDER BY created_at DESC, id DESC LIMIT 1",
            historyRowMapper(),
            accountId,
            Timestamp.from(at)
        );
        return rows.stream().findFirst();
    }

    /**
     * Sum of every recorded change for an account, zero when it has none.
     */
    public BigDecimal sumHistoryChanges(long accountId) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(change_amount), 0) FROM balance_history WHERE account_id = ?",
            BigDecimal.class,
            accountId
        );
        return sum != null ? sum : BigDecimal.ZERO;
    }

    public List<Long> findAccountIds(PageRequest page) {
        return jdbcTemplate.queryForList(
            "SELECT account_id FROM balances ORDER BY account_id LIMIT ? OFFSET ?",
            Long.class,
            page.getLimit(),
            page.getOffset()
        );
    }

    private void initializeIfAbsent(long accountId) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO balances (account_id, amount, updated_at) VALUES (?, 0, ?) ON CONFLICT DO NOTHING",
            accountId,
            Timestamp.from(LedgerTimestamps.now())
        );
        if (inserted > 0) {
            log.info("Initialised balance at zero: accountId={}", accountId);
        }
    }

    private void recordHistory(BalanceHistoryEntry entry) {
        if (historyMode == HistoryWriteMode.ATOMIC) {
            historyWriter.append(entry);
            return;
        }

        // Savepoint keeps the enclosing unit usable after a failed insert.
        try {
            savepointTemplate.executeWithoutResult(status -> historyWriter.append(entry));
        } catch (RuntimeException e) {
            ledgerMetrics.recordHistoryAppendFailure();
            log.warn("Failed to record balance history, balance change kept: accountId={}, change={}, transactionId={}, error={}",
                    entry.getAccountId(), entry.getChangeAmount().toPlainString(), entry.getTransactionId(),
                    e.getMessage());
        }
    }

    private RowMapper<AccountBalance> balanceRowMapper() {
        return (rs, rowNum) -> new AccountBalance(
            rs.getLong("account_id"),
            rs.getBigDecimal("amount"),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    private RowMapper<BalanceHistoryEntry> historyRowMapper() {
        return (rs, rowNum) -> {
            long rawTransactionId = rs.getLong("transaction_id");
            Long transactionId = rs.wasNull() ? null : rawTransactionId;
            return new BalanceHistoryEntry(
                rs.getLong("id"),
                rs.getLong("account_id"),
                rs.getBigDecimal("resulting_balance"),
                rs.getBigDecimal("change_amount"),
                transactionId,
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }
}
