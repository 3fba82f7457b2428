package com.flagship.balance_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * A credit would push the balance past what the money columns can hold.
 * Raised under the row lock; nothing has been written when it is thrown.
 */
@Getter
public class BalanceLimitExceededException extends LedgerException {

    private final long accountId;
    private final BigDecimal currentBalance;
    private final BigDecimal requestedAmount;

    public BalanceLimitExceededException(long accountId, BigDecimal currentBalance, BigDecimal requestedAmount) {
        super(String.format(
                "Balance limit exceeded for account %d. Balance: %s, Requested: %s",
                accountId, currentBalance.toPlainString(), requestedAmount.toPlainString()
        ));
        this.accountId = accountId;
        this.currentBalance = currentBalance;
        this.requestedAmount = requestedAmount;
    }

    @Override
    public String getErrorCode() {
        return "balance_limit_exceeded";
    }
}
