package com.flagship.balance_ledger.transaction;

import com.flagship.balance_ledger.exception.InsufficientFundsException;
import com.flagship.balance_ledger.exception.LedgerException;
import com.flagship.balance_ledger.exception.StorageException;
import com.flagship.balance_ledger.exception.TransactionNotFoundException;
import com.flagship.balance_ledger.exception.ValidationException;
import com.flagship.balance_ledger.guard.AccountLockGuard;
import com.flagship.balance_ledger.guard.GuardHandle;
import com.flagship.balance_ledger.ledger.AccountBalance;
import com.flagship.balance_ledger.ledger.LedgerStore;
import com.flagship.balance_ledger.ledger.LedgerValidation;
import com.flagship.balance_ledger.observability.CorrelationContext;
import com.flagship.balance_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Credit, debit, transfer and rollback as single atomic units.
 *
 * Every operation follows the same protocol:
 * 1. Validate the request (before any lock or unit)
 * 2. Acquire the in-process guard for the involved accounts, in fixed order
 * 3. Open one atomic unit; create or lock the transaction record
 * 4. Apply balance changes through {@link LedgerStore#applyDelta}, rows locked in ascending account order
 * 5. Move the record along its state machine
 * 6. Commit, then release the guard
 *
 * The status change and the balance changes always commit together. Any
 * failure after step 1 rolls back the whole unit: no balance, history row or
 * transaction record survives it.
 */
@Service
@Slf4j
public class TransactionOrchestrator {

    private final LedgerStore ledgerStore;
    private final TransactionRecordRepository transactionRepository;
    private final AccountLockGuard lockGuard;
    private final TransactionTemplate transactionTemplate;
    private final LedgerMetrics ledgerMetrics;
    private final boolean preCheckEnabled;

    public TransactionOrchestrator(LedgerStore ledgerStore,
                                   TransactionRecordRepository transactionRepository,
                                   AccountLockGuard lockGuard,
                                   TransactionTemplate transactionTemplate,
                                   LedgerMetrics ledgerMetrics,
                                   @Value("${ledger.precheck.enabled:true}") boolean preCheckEnabled) {
        this.ledgerStore = ledgerStore;
        this.transactionRepository = transactionRepository;
        this.lockGuard = lockGuard;
        this.transactionTemplate = transactionTemplate;
        this.ledgerMetrics = ledgerMetrics;
        this.preCheckEnabled = preCheckEnabled;
    }

    /**
     * Adds {@code amount} to an account.
     *
     * @return the COMPLETED transaction record
     * @throws ValidationException for a non-positive account id or amount
     */
    public TransactionRecord credit(long accountId, BigDecimal amount) {
        LedgerValidation.requirePositiveId("account_id", accountId);
        LedgerValidation.requireValidAmount(amount);

        return execute(TransactionRecord.credit(accountId, amount));
    }

    /**
     * Removes {@code amount} from an account.
     *
     * @return the COMPLETED transaction record
     * @throws InsufficientFundsException if the balance does not cover the amount
     */
    public TransactionRecord debit(long accountId, BigDecimal amount) {
        LedgerValidation.requirePositiveId("account_id", accountId);
        LedgerValidation.requireValidAmount(amount);

        preCheckBalance(accountId, amount, TransactionType.DEBIT);
        return execute(TransactionRecord.debit(accountId, amount));
    }

    /**
     * Moves {@code amount} from one account to another.
     *
     * Either both balances change and exactly one COMPLETED record exists
     * afterwards, or nothing changes.
     *
     * @throws ValidationException if source and destination are the same account
     * @throws InsufficientFundsException if the source balance does not cover the amount
     */
    public TransactionRecord transfer(long sourceAccountId, long destAccountId, BigDecimal amount) {
        LedgerValidation.requirePositiveId("source_account_id", sourceAccountId);
        LedgerValidation.requirePositiveId("dest_account_id", destAccountId);
        LedgerValidation.requireValidAmount(amount);
        if (sourceAccountId == destAccountId) {
            throw new ValidationException("dest_account_id", "Cannot transfer to the same account");
        }

        preCheckBalance(sourceAccountId, amount, TransactionType.TRANSFER);
        return execute(TransactionRecord.transfer(sourceAccountId, destAccountId, amount));
    }

    /**
     * Compensates a COMPLETED transaction with reverse balance changes and
     * marks it ROLLED_BACK. History rows are never removed; the compensation
     * shows up as new rows linked to the same transaction id.
     *
     * @return the ROLLED_BACK transaction record
     * @throws TransactionNotFoundException if no such record exists
     * @throws com.flagship.balance_ledger.exception.AlreadyRolledBackException if it was already rolled back
     * @throws InsufficientFundsException if reversing would drive a balance negative
     */
    public TransactionRecord rollback(long transactionId) {
        LedgerValidation.requirePositiveId("transaction_id", transactionId);

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transactionId));

        try {
            TransactionRecord snapshot = findRecord(transactionId);
            // Fast reject outside the guard; re-checked under the row lock below.
            snapshot.ensureRollbackAllowed();

            TransactionRecord rolledBack;
            try (GuardHandle ignored = lockGuard.acquireAll(snapshot.involvedAccounts())) {
                rolledBack = inAtomicUnit(() -> {
                    TransactionRecord current = transactionRepository.findByIdForUpdate(transactionId)
                        .orElseThrow(() -> new TransactionNotFoundException(transactionId));
                    TransactionRecord next = current.rollBack();

                    current.compensatingDeltas().forEach((accountId, delta) ->
                        ledgerStore.applyDelta(accountId, delta, transactionId));

                    transactionRepository.updateStatus(next, TransactionStatus.COMPLETED);
                    return next;
                });
            }

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordTransaction("rollback", "success");
            ledgerMetrics.recordLatency("rollback", duration);

            log.info("Transaction rolled back: type={}, amount={}, duration={}ms",
                    rolledBack.getType(), rolledBack.getAmount().toPlainString(), duration);
            return rolledBack;

        } catch (LedgerException e) {
            ledgerMetrics.recordTransaction("rollback", e.getErrorCode());
            ledgerMetrics.recordLatency("rollback", System.currentTimeMillis() - startTime);
            log.warn("Rollback rejected: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private TransactionRecord execute(TransactionRecord pending) {
        long startTime = System.currentTimeMillis();
        String type = pending.getType().name().toLowerCase();

        try (GuardHandle ignored = lockGuard.acquireAll(pending.involvedAccounts())) {
            TransactionRecord completed = inAtomicUnit(() -> {
                TransactionRecord created = transactionRepository.insert(pending);
                MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(created.getId()));

                created.balanceDeltas().forEach((accountId, delta) ->
                    ledgerStore.applyDelta(accountId, delta, created.getId()));

                TransactionRecord done = created.complete();
                transactionRepository.updateStatus(done, TransactionStatus.PENDING);
                return done;
            });

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordTransaction(type, "success");
            ledgerMetrics.recordLatency(type, duration);

            log.info("{} transaction completed: source={}, dest={}, amount={}, duration={}ms",
                    completed.getType(), completed.getSourceAccountId(), completed.getDestAccountId(),
                    completed.getAmount().toPlainString(), duration);
            return completed;

        } catch (LedgerException e) {
            ledgerMetrics.recordTransaction(type, e.getErrorCode());
            ledgerMetrics.recordLatency(type, System.currentTimeMillis() - startTime);
            log.warn("{} transaction failed: source={}, dest={}, amount={}, error={}",
                    pending.getType(), pending.getSourceAccountId(), pending.getDestAccountId(),
                    pending.getAmount().toPlainString(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Runs {@code work} as one atomic unit. Persistence failures surface as
     * {@link StorageException}; ledger exceptions pass through unchanged.
     */
    private <T> T inAtomicUnit(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("Atomic unit aborted by storage failure", e);
            throw new StorageException("Ledger storage failure: " + e.getMessage(), e);
        }
    }

    /**
     * Advisory fast reject. Racy by nature: the authoritative check is the one
     * {@link LedgerStore#applyDelta} makes under the row lock.
     */
    private void preCheckBalance(long accountId, BigDecimal amount, TransactionType type) {
        if (!preCheckEnabled) {
            return;
        }
        BigDecimal current;
        try {
            current = ledgerStore.findBalance(accountId)
                .map(AccountBalance::getAmount)
                .orElse(BigDecimal.ZERO);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read balance of account " + accountId, e);
        }

        if (current.compareTo(amount) < 0) {
            String metricType = type.name().toLowerCase();
            InsufficientFundsException rejected = new InsufficientFundsException(accountId, current, amount);
            ledgerMetrics.recordTransaction(metricType, rejected.getErrorCode());
            log.info("{} rejected by balance pre-check: accountId={}, balance={}, amount={}",
                    type, accountId, current.toPlainString(), amount.toPlainString());
            throw rejected;
        }
    }

    private TransactionRecord findRecord(long transactionId) {
        try {
            return transactionRepository.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read transaction " + transactionId, e);
        }
    }
}
