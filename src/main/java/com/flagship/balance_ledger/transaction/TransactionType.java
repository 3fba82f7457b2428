package com.flagship.balance_ledger.transaction;

public enum TransactionType {
    /**
     * Money enters the destination account from outside the ledger.
     */
    CREDIT,

    /**
     * Money leaves the source account to outside the ledger.
     */
    DEBIT,

    /**
     * Money moves from the source account to a different destination account.
     */
    TRANSFER
}
