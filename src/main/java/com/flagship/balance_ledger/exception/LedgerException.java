package com.flagship.balance_ledger.exception;

/**
 * Base type for every failure the ledger core reports to its callers.
 *
 * Subclasses map one-to-one onto the error taxonomy the REST layer renders,
 * see {@link com.flagship.balance_ledger.api.GlobalExceptionHandler}.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable, machine readable code used in API error bodies and metric tags.
     */
    public abstract String getErrorCode();
}
