package io.otel.messaging.context;

import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;

import java.util.Objects;

/**
 * Immutable identifying triple of a span: trace id, span id and sampling flag.
 *
 * Ids are kept in their W3C lowercase hex form (32 chars for the trace id, 16 for
 * the span id). A child span never mutates its parent's context; it gets a new one.
 */
public final class TraceContext {

    private static final TraceContext INVALID = new TraceContext(
            SpanContext.getInvalid().getTraceId(), SpanContext.getInvalid().getSpanId(), false);

    private final String traceId;
    private final String spanId;
    private final boolean sampled;

    private TraceContext(String traceId, String spanId, boolean sampled) {
        this.traceId = traceId;
        this.spanId = spanId;
        this.sampled = sampled;
    }

    /**
     * Create a context from hex ids. Ids are not validated here; use {@link #isValid()}.
     */
    public static TraceContext of(String traceId, String spanId, boolean sampled) {
        return new TraceContext(
                Objects.requireNonNull(traceId, "traceId"),
                Objects.requireNonNull(spanId, "spanId"),
                sampled);
    }

    /**
     * The "no parent" context: all-zero ids, not sampled.
     */
    public static TraceContext invalid() {
        return INVALID;
    }

    public static TraceContext fromSpanContext(SpanContext spanContext) {
        if (spanContext == null || !spanContext.isValid()) {
            return INVALID;
        }
        return new TraceContext(spanContext.getTraceId(), spanContext.getSpanId(), spanContext.isSampled());
    }

    /**
     * Convert to a remote OpenTelemetry span context, suitable as a parent.
     */
    public SpanContext toSpanContext() {
        if (!isValid()) {
            return SpanContext.getInvalid();
        }
        return SpanContext.createFromRemoteParent(
                traceId, spanId, sampled ? TraceFlags.getSampled() : TraceFlags.getDefault(), TraceState.getDefault());
    }

    public boolean isValid() {
        return SpanContext.create(traceId, spanId, TraceFlags.getDefault(), TraceState.getDefault()).isValid();
    }

    public String getTraceId() { return traceId; }

    public String getSpanId() { return spanId; }

    public boolean isSampled() { return sampled; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceContext)) return false;
        TraceContext that = (TraceContext) o;
        return sampled == that.sampled && traceId.equals(that.traceId) && spanId.equals(that.spanId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(traceId, spanId, sampled);
    }

    @Override
    public String toString() {
        return "TraceContext{traceId=" + traceId + ", spanId=" + spanId + ", sampled=" + sampled + '}';
    }
}
