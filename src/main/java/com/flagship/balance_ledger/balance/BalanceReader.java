package com.flagship.balance_ledger.balance;

import com.flagship.balance_ledger.config.PaginationPolicy;
import com.flagship.balance_ledger.exception.StorageException;
import com.flagship.balance_ledger.exception.ValidationException;
import com.flagship.balance_ledger.ledger.AccountBalance;
import com.flagship.balance_ledger.ledger.BalanceHistoryEntry;
import com.flagship.balance_ledger.ledger.LedgerStore;
import com.flagship.balance_ledger.ledger.LedgerValidation;
import com.flagship.balance_ledger.ledger.PageRequest;
import com.flagship.balance_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Read access to balances and their history.
 *
 * Read-only apart from one side effect: the first read of an unknown account
 * creates its balance row at zero. Persistence failures surface as
 * {@link StorageException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceReader {

    private final LedgerStore ledgerStore;
    private final PaginationPolicy paginationPolicy;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Current balance; an unknown account gets a zero row and reads as zero.
     */
    @Transactional
    public AccountBalance getBalance(long accountId) {
        LedgerValidation.requirePositiveId("account_id", accountId);
        return read("balance of account " + accountId, () -> ledgerStore.getOrCreateBalance(accountId));
    }

    /**
     * Balance history, newest first.
     */
    @Transactional(readOnly = true)
    public List<BalanceHistoryEntry> getHistory(long accountId, Integer limit, Integer offset) {
        LedgerValidation.requirePositiveId("account_id", accountId);
        PageRequest page = paginationPolicy.resolve(limit, offset);
        return read("history of account " + accountId, () -> ledgerStore.findHistory(accountId, page));
    }

    /**
     * Balance as recorded by the latest history row at or before {@code at};
     * zero if the account has no history that old.
     */
    @Transactional(readOnly = true)
    public BigDecimal getBalanceAtTime(long accountId, Instant at) {
        LedgerValidation.requirePositiveId("account_id", accountId);
        if (at == null) {
            throw new ValidationException("timestamp", "timestamp is required");
        }
        return read("history of account " + accountId, () -> ledgerStore.findLatestHistoryAtOrBefore(accountId, at))
            .map(BalanceHistoryEntry::getResultingBalance)
            .orElse(BigDecimal.ZERO);
    }

    @Transactional(readOnly = true)
    public BigDecimal calculateBalanceFromHistory(long accountId) {
        LedgerValidation.requirePositiveId("account_id", accountId);
        return read("history of account " + accountId, () -> ledgerStore.sumHistoryChanges(accountId));
    }

    /**
     * Compares the stored balance with the sum of all history changes.
     *
     * The balance row is locked while the history is summed, so no mutation
     * of this account can land between the two reads. A mismatch is logged
     * and counted; it is never corrected here.
     */
    @Transactional
    public ReconciliationResult reconcile(long accountId) {
        LedgerValidation.requirePositiveId("account_id", accountId);

        AccountBalance stored = read("balance of account " + accountId, () -> ledgerStore.lockBalance(accountId));
        BigDecimal fromHistory = read("history of account " + accountId, () -> ledgerStore.sumHistoryChanges(accountId));
        ReconciliationResult result = new ReconciliationResult(accountId, stored.getAmount(), fromHistory);

        ledgerMetrics.recordReconciliation(result.isConsistent());
        if (!result.isConsistent()) {
            log.warn("Balance discrepancy detected: accountId={}, storedBalance={}, historyBalance={}, discrepancy={}",
                    accountId, stored.getAmount().toPlainString(), fromHistory.toPlainString(),
                    result.getDiscrepancy().toPlainString());
        }
        return result;
    }

    private <T> T read(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read " + what, e);
        }
    }
}
