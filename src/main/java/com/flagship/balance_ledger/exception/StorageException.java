package com.flagship.balance_ledger.exception;

/**
 * Underlying persistence failure. The atomic unit it happened in has been
 * rolled back by the time callers see this.
 */
public class StorageException extends LedgerException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "storage_error";
    }
}
