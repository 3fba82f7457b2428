package com.flagship.balance_ledger.transaction;

import com.flagship.balance_ledger.exception.AlreadyRolledBackException;
import com.flagship.balance_ledger.exception.InvalidStateTransitionException;
import com.flagship.balance_ledger.ledger.LedgerTimestamps;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Transaction record domain object.
 *
 * Key principles:
 * - Amount, type and accounts are fixed at creation
 * - Status transitions are explicit and validated
 * - State changes are immutable (a transition returns a new record)
 */
@Value
public class TransactionRecord {
    Long id;
    Long sourceAccountId;
    Long destAccountId;
    BigDecimal amount;
    TransactionType type;
    TransactionStatus status;
    Instant createdAt;
    Instant updatedAt;

    public static TransactionRecord credit(long destAccountId, BigDecimal amount) {
        return pending(null, destAccountId, amount, TransactionType.CREDIT);
    }

    public static TransactionRecord debit(long sourceAccountId, BigDecimal amount) {
        return pending(sourceAccountId, null, amount, TransactionType.DEBIT);
    }

    public static TransactionRecord transfer(long sourceAccountId, long destAccountId, BigDecimal amount) {
        return pending(sourceAccountId, destAccountId, amount, TransactionType.TRANSFER);
    }

    private static TransactionRecord pending(Long sourceAccountId, Long destAccountId,
                                             BigDecimal amount, TransactionType type) {
        Instant now = LedgerTimestamps.now();
        return new TransactionRecord(null, sourceAccountId, destAccountId, amount, type,
                TransactionStatus.PENDING, now, now);
    }

    /**
     * Returns this record with the identifier the store assigned to it.
     */
    public TransactionRecord withId(long assignedId) {
        return new TransactionRecord(assignedId, sourceAccountId, destAccountId, amount, type,
                status, createdAt, updatedAt);
    }

    /**
     * PENDING → COMPLETED.
     *
     * @throws InvalidStateTransitionException from any other status
     */
    public TransactionRecord complete() {
        if (!canTransitionTo(TransactionStatus.COMPLETED)) {
            throw new InvalidStateTransitionException(requireId(), status, TransactionStatus.COMPLETED);
        }
        return withStatus(TransactionStatus.COMPLETED);
    }

    /**
     * COMPLETED → ROLLED_BACK.
     *
     * @throws AlreadyRolledBackException if the record is already rolled back
     * @throws InvalidStateTransitionException if the record is still pending
     */
    public TransactionRecord rollBack() {
        ensureRollbackAllowed();
        return withStatus(TransactionStatus.ROLLED_BACK);
    }

    public void ensureRollbackAllowed() {
        if (status == TransactionStatus.ROLLED_BACK) {
            throw new AlreadyRolledBackException(requireId());
        }
        if (!canTransitionTo(TransactionStatus.ROLLED_BACK)) {
            throw new InvalidStateTransitionException(requireId(), status, TransactionStatus.ROLLED_BACK);
        }
    }

    /**
     * Allowed moves: PENDING → COMPLETED and COMPLETED → ROLLED_BACK.
     */
    public boolean canTransitionTo(TransactionStatus target) {
        return switch (status) {
            case PENDING -> target == TransactionStatus.COMPLETED;
            case COMPLETED -> target == TransactionStatus.ROLLED_BACK;
            case ROLLED_BACK -> false;
        };
    }

    /**
     * Balance changes this transaction makes, keyed by account id in ascending
     * order so callers lock rows in the same order everywhere.
     */
    public SortedMap<Long, BigDecimal> balanceDeltas() {
        TreeMap<Long, BigDecimal> deltas = new TreeMap<>();
        switch (type) {
            case CREDIT -> deltas.put(destAccountId, amount);
            case DEBIT -> deltas.put(sourceAccountId, amount.negate());
            case TRANSFER -> {
                deltas.put(sourceAccountId, amount.negate());
                deltas.put(destAccountId, amount);
            }
        }
        return Collections.unmodifiableSortedMap(deltas);
    }

    /**
     * Reverse of {@link #balanceDeltas()}: a credit is compensated by debiting
     * the destination, a debit by crediting the source, a transfer by both.
     */
    public SortedMap<Long, BigDecimal> compensatingDeltas() {
        TreeMap<Long, BigDecimal> reversed = new TreeMap<>();
        balanceDeltas().forEach((accountId, delta) -> reversed.put(accountId, delta.negate()));
        return Collections.unmodifiableSortedMap(reversed);
    }

    public List<Long> involvedAccounts() {
        List<Long> accounts = new ArrayList<>(2);
        if (sourceAccountId != null) {
            accounts.add(sourceAccountId);
        }
        if (destAccountId != null) {
            accounts.add(destAccountId);
        }
        return accounts;
    }

    private TransactionRecord withStatus(TransactionStatus next) {
        return new TransactionRecord(id, sourceAccountId, destAccountId, amount, type,
                next, createdAt, LedgerTimestamps.now());
    }

    private long requireId() {
        if (id == null) {
            throw new IllegalStateException("Transaction record has not been persisted yet");
        }
        return id;
    }
}
