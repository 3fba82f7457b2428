package com.flagship.balance_ledger.ledger;

import com.flagship.balance_ledger.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Input checks shared by the orchestrator and the readers. Everything here
 * runs before an atomic unit is opened.
 */
public final class LedgerValidation {

    /**
     * Matches the NUMERIC(19, 4) money columns.
     */
    public static final int AMOUNT_SCALE = 4;
    public static final int AMOUNT_INTEGER_DIGITS = 15;
    public static final BigDecimal MAX_BALANCE = new BigDecimal("999999999999999.9999");

    private LedgerValidation() {
    }

    public static void requirePositiveId(String field, long id) {
        if (id <= 0) {
            throw new ValidationException(field, field + " must be a positive integer, got " + id);
        }
    }

    public static void requireValidAmount(BigDecimal amount) {
        if (amount == null) {
            throw new ValidationException("amount", "amount is required");
        }
        if (amount.signum() <= 0) {
            throw new ValidationException("amount", "amount must be greater than zero, got " + amount.toPlainString());
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        if (normalized.scale() > AMOUNT_SCALE) {
            throw new ValidationException("amount",
                    "amount supports at most " + AMOUNT_SCALE + " decimal places, got " + amount.toPlainString());
        }
        if (normalized.precision() - normalized.scale() > AMOUNT_INTEGER_DIGITS) {
            throw new ValidationException("amount", "amount is too large: " + amount.toPlainString());
        }
    }
}
