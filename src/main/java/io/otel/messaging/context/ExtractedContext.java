package io.otel.messaging.context;

import io.opentelemetry.api.baggage.Baggage;

import java.util.Objects;

/**
 * Result of reading a carrier: the remote trace context plus the baggage that travelled with it.
 */
public final class ExtractedContext {

    private static final ExtractedContext EMPTY = new ExtractedContext(TraceContext.invalid(), Baggage.empty());

    private final TraceContext traceContext;
    private final Baggage baggage;

    public ExtractedContext(TraceContext traceContext, Baggage baggage) {
        this.traceContext = Objects.requireNonNull(traceContext, "traceContext");
        this.baggage = Objects.requireNonNull(baggage, "baggage");
    }

    /**
     * No parent, unsampled, empty baggage.
     */
    public static ExtractedContext empty() {
        return EMPTY;
    }

    public TraceContext getTraceContext() { return traceContext; }

    public Baggage getBaggage() { return baggage; }

    public boolean hasParent() {
        return traceContext.isValid();
    }

    @Override
    public String toString() {
        return "ExtractedContext{" + traceContext + ", baggage=" + baggage.asMap().keySet() + '}';
    }
}
