package com.flagship.balance_ledger.exception;

import com.flagship.balance_ledger.transaction.TransactionStatus;
import lombok.Getter;

/**
 * A transaction record was asked to move along an edge its state machine
 * does not have (for example PENDING to ROLLED_BACK).
 */
@Getter
public class InvalidStateTransitionException extends LedgerException {

    private final long transactionId;
    private final TransactionStatus currentStatus;
    private final TransactionStatus targetStatus;

    public InvalidStateTransitionException(long transactionId,
                                           TransactionStatus currentStatus,
                                           TransactionStatus targetStatus) {
        this(transactionId, currentStatus, targetStatus,
                String.format("Cannot move transaction %d from %s to %s",
                        transactionId, currentStatus, targetStatus));
    }

    protected InvalidStateTransitionException(long transactionId,
                                              TransactionStatus currentStatus,
                                              TransactionStatus targetStatus,
                                              String message) {
        super(message);
        this.transactionId = transactionId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    @Override
    public String getErrorCode() {
        return "invalid_state_transition";
    }
}
