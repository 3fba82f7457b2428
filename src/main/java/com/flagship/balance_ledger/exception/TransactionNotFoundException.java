package com.flagship.balance_ledger.exception;

import lombok.Getter;

@Getter
public class TransactionNotFoundException extends LedgerException {

    private final long transactionId;

    public TransactionNotFoundException(long transactionId) {
        super("Transaction not found: " + transactionId);
        this.transactionId = transactionId;
    }

    @Override
    public String getErrorCode() {
        return "transaction_not_found";
    }
}
