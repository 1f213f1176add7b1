package com.onevault.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} for the core's own operations.
 * <p>
 * Each span gets the correlation attributes of the current {@link CorrelationContextHolder}, and
 * while the span is open the holder (and so MDC) carries its span and trace ids. This class
 * does NOT configure the SDK; the hosting service supplies the tracer.
 */
public final class SpanHelper {

    public static final String ATTR_CORRELATION_ID = "onevault.correlation_id";
    public static final String ATTR_TENANT_KEY = "onevault.tenant_key";
    public static final String ATTR_ACTOR_KEY = "onevault.actor_key";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a new INTERNAL span. Runtime exceptions mark the span as ERROR,
     * are recorded on it and are re-thrown unchanged.
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContext outer = CorrelationContextHolder.get().orElse(null);
        if (outer != null) {
            span.setAttribute(ATTR_CORRELATION_ID, outer.correlationId());
            if (outer.tenantKey() != null) {
                span.setAttribute(ATTR_TENANT_KEY, outer.tenantKey());
            }
            if (outer.actorKey() != null) {
                span.setAttribute(ATTR_ACTOR_KEY, outer.actorKey());
            }
        }

        try (Scope ignored = span.makeCurrent()) {
            if (outer != null) {
                SpanContext spanContext = span.getSpanContext();
                CorrelationContextHolder.set(outer.withTrace(spanContext.getSpanId(), spanContext.getTraceId()));
            }
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            if (outer != null) {
                CorrelationContextHolder.set(outer);
            }
            span.end();
        }
    }

    /** Adds an attribute to the span active on this thread, if any. */
    public static void annotate(String key, String value) {
        if (value != null) {
            Span.current().setAttribute(key, value);
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
