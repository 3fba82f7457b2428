package com.flagship.balance_ledger.exception;

import lombok.Getter;

/**
 * Request rejected before any atomic unit was opened: non-positive amount,
 * same-account transfer, malformed identifiers or pagination.
 */
@Getter
public class ValidationException extends LedgerException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    @Override
    public String getErrorCode() {
        return "validation_failed";
    }
}
