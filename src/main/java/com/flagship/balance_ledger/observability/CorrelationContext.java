package com.flagship.balance_ledger.observability;

import java.util.UUID;

/**
 * Header and MDC key names shared by the web layer and the services.
 *
 * The caller identity comes from the upstream authentication layer and is
 * trusted as-is. It is only recorded for log correlation, never evaluated.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CALLER_ID_HEADER = "X-Caller-Id";
    public static final String CALLER_ROLE_HEADER = "X-Caller-Role";

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CALLER_ID_MDC_KEY = "callerId";
    public static final String CALLER_ROLE_MDC_KEY = "callerRole";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
