package com.flagship.balance_ledger.exception;

import com.flagship.balance_ledger.transaction.TransactionStatus;

public class AlreadyRolledBackException extends InvalidStateTransitionException {

    public AlreadyRolledBackException(long transactionId) {
        super(transactionId, TransactionStatus.ROLLED_BACK, TransactionStatus.ROLLED_BACK,
                "Transaction " + transactionId + " has already been rolled back");
    }

    @Override
    public String getErrorCode() {
        return "already_rolled_back";
    }
}
