package com.flagship.pharmacy_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Thread-local correlation ID and the MDC keys every ledger log line carries.
 *
 * An HTTP request or an intake record binds one correlation ID for its whole processing
 * ({@link #bind}); the stock and cash services add the batch or account they work on and the
 * external reference being applied ({@link #ledgerScope}). The log pattern prints
 * {@code correlationId} and {@code reference}, so every movement of a POS receipt or bank
 * statement line can be traced back to the request or record that carried it.
 *
 * Incoming IDs come from callers we do not control and end up in log lines, so only short
 * IDs made of letters, digits, '.', '_', ':' and '-' are kept. Anything else is replaced by a
 * generated ID.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ENTITY_KEY_MDC_KEY = "entityKey";
    public static final String REFERENCE_MDC_KEY = "reference";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * The incoming ID if it is safe to log, otherwise a fresh one.
     */
    public static String accept(String incoming) {
        if (incoming != null && ACCEPTED_ID.matcher(incoming).matches()) {
            return incoming;
        }
        return generateCorrelationId();
    }

    /**
     * Binds {@code id} to the current thread and its MDC. Pair with {@link #clear()}.
     */
    public static String bind(String id) {
        correlationId.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Clears the correlation ID and the ledger keys from the current thread.
     * Must be called at the end of request or record processing.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(ENTITY_KEY_MDC_KEY);
        MDC.remove(REFERENCE_MDC_KEY);
    }

    /**
     * Puts the batch or account key and the applied reference in MDC until the scope is closed.
     * Null values are left out.
     */
    public static LedgerScope ledgerScope(String entityKey, String reference) {
        return new LedgerScope(entityKey, reference);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static final class LedgerScope implements AutoCloseable {

        private final boolean entityKeySet;
        private final boolean referenceSet;

        private LedgerScope(String entityKey, String reference) {
            this.entityKeySet = entityKey != null;
            this.referenceSet = reference != null;
            if (entityKeySet) {
                MDC.put(ENTITY_KEY_MDC_KEY, entityKey);
            }
            if (referenceSet) {
                MDC.put(REFERENCE_MDC_KEY, reference);
            }
        }

        @Override
        public void close() {
            if (entityKeySet) {
                MDC.remove(ENTITY_KEY_MDC_KEY);
            }
            if (referenceSet) {
                MDC.remove(REFERENCE_MDC_KEY);
            }
        }
    }
}
