package com.onevault.observability;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * Setting a context populates every MDC key; clearing removes them. Work handed to another
 * thread must carry the context across explicitly with {@link #callWithContext}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code work} with {@code context} installed, then restores whatever context the
     * thread had before (or clears it).
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    public static void runWithContext(CorrelationContext context, Runnable work) {
        callWithContext(context, () -> {
            work.run();
            return null;
        });
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_KEY, ctx.tenantKey());
        setMdc(CorrelationContext.MDC_ACTOR_KEY, ctx.actorKey());
        setMdc(CorrelationContext.MDC_SESSION_REF, ctx.sessionRef());
        setMdc(CorrelationContext.MDC_SPAN_ID, ctx.spanId());
        setMdc(CorrelationContext.MDC_TRACE_ID, ctx.traceId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_KEY);
        MDC.remove(CorrelationContext.MDC_ACTOR_KEY);
        MDC.remove(CorrelationContext.MDC_SESSION_REF);
        MDC.remove(CorrelationContext.MDC_SPAN_ID);
        MDC.remove(CorrelationContext.MDC_TRACE_ID);
    }
}
