package com.flagship.crypto_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys and correlation ID handling for ledger work.
 *
 * There is no inbound HTTP surface, so a correlation ID is opened per unit of
 * work (an append, a disposal, a wallet run) and every log line written
 * inside it carries the same ID.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";
    public static final String ASSET_MDC_KEY = "asset";
    public static final String WALLET_ACCOUNT_ID_MDC_KEY = "walletAccountId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Opens a correlation scope. Reuses the caller's ID when one is already set,
     * so a disposal that journalizes its P&L logs under a single ID.
     */
    public static Scope open() {
        String existing = MDC.get(CORRELATION_ID_MDC_KEY);
        if (existing != null) {
            return () -> { };
        }
        MDC.put(CORRELATION_ID_MDC_KEY, generateCorrelationId());
        return () -> MDC.remove(CORRELATION_ID_MDC_KEY);
    }

    public static String getCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    /**
     * Shorter than a full UUID for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Closing a scope never throws.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
