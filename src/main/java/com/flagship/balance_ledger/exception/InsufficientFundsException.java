package com.flagship.balance_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientFundsException extends LedgerException {

    private final long accountId;
    private final BigDecimal currentBalance;
    private final BigDecimal requestedAmount;

    public InsufficientFundsException(long accountId, BigDecimal currentBalance, BigDecimal requestedAmount) {
        super(String.format(
                "Insufficient funds in account %d. Balance: %s, Requested: %s",
                accountId, currentBalance.toPlainString(), requestedAmount.toPlainString()
        ));
        this.accountId = accountId;
        this.currentBalance = currentBalance;
        this.requestedAmount = requestedAmount;
    }

    @Override
    public String getErrorCode() {
        return "insufficient_funds";
    }
}
