package com.kiisha.ai.gateway.audit;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * Per-thread correlation id for the call being served. The id is mirrored into the SLF4J
 * MDC under {@link #MDC_KEY} so every log line written during the call carries it.
 */
public final class CorrelationContext {

    public static final String MDC_KEY = "correlationId";

    private static final ThreadLocal<String> CURRENT_CORRELATION_ID = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public static Optional<String> current() {
        return Optional.ofNullable(CURRENT_CORRELATION_ID.get());
    }

    /**
     * Binds the id to the current thread until the returned scope is closed, which restores
     * whatever was bound before. Use with try-with-resources.
     */
    public static Scope bind(String correlationId) {
        String previous = CURRENT_CORRELATION_ID.get();
        set(correlationId);
        return new Scope(previous);
    }

    private static void set(String correlationId) {
        if (correlationId == null) {
            CURRENT_CORRELATION_ID.remove();
            MDC.remove(MDC_KEY);
        } else {
            CURRENT_CORRELATION_ID.set(correlationId);
            MDC.put(MDC_KEY, correlationId);
        }
    }

    public static final class Scope implements AutoCloseable {

        private final String previous;

        private Scope(String previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            set(previous);
        }
    }
}
