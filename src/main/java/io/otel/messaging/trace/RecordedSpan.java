package io.otel.messaging.trace;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.otel.messaging.context.TraceContext;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An open (or ended) span owned by the operation that started it.
 *
 * Once {@link SpanRecorder#endSpan} has run, attributes, events and status are frozen and
 * further mutations are ignored.
 */
public class RecordedSpan {

    private final String name;
    private final SpanKind kind;
    private final TraceContext context;
    private final TraceContext parent;
    private final Instant startTime;
    private final Span delegate;
    private final AtomicBoolean ended = new AtomicBoolean(false);

    private volatile SpanStatus status = SpanStatus.UNSET;
    private volatile Throwable exception;
    private volatile Instant endTime;

    RecordedSpan(String name, SpanKind kind, TraceContext parent, Instant startTime, Span delegate) {
        this.name = name;
        this.kind = kind;
        this.parent = parent;
        this.startTime = startTime;
        this.delegate = delegate;
        this.context = TraceContext.fromSpanContext(delegate.getSpanContext());
    }

    public RecordedSpan setAttribute(String key, Object value) {
        if (!ended.get() && value != null) {
            AttributesBuilder builder = Attributes.builder();
            AttributeValues.put(builder, key, value);
            delegate.setAllAttributes(builder.build());
        }
        return this;
    }

    public RecordedSpan addEvent(String eventName) {
        if (!ended.get()) {
            delegate.addEvent(eventName);
        }
        return this;
    }

    /**
     * End the underlying span. Returns false if it had already ended.
     */
    boolean end(SpanStatus finalStatus, Throwable error) {
        if (!ended.compareAndSet(false, true)) {
            return false;
        }
        this.status = finalStatus == null ? SpanStatus.UNSET : finalStatus;
        this.exception = error;
        if (error != null) {
            delegate.recordException(error);
        }
        if (this.status == SpanStatus.ERROR) {
            delegate.setStatus(this.status.toStatusCode(), error != null ? String.valueOf(error.getMessage()) : "");
        } else {
            delegate.setStatus(this.status.toStatusCode());
        }
        this.endTime = Instant.now();
        delegate.end(this.endTime);
        return true;
    }

    /**
     * OpenTelemetry context with this span as the current span, on top of {@code base}.
     */
    public Context storeIn(Context base) {
        return base.with(delegate);
    }

    public Span getOtelSpan() { return delegate; }

    public String getName() { return name; }

    public SpanKind getKind() { return kind; }

    public TraceContext getContext() { return context; }

    /**
     * Parent context, or {@link TraceContext#invalid()} for a root span.
     */
    public TraceContext getParent() { return parent; }

    public Instant getStartTime() { return startTime; }

    public Instant getEndTime() { return endTime; }

    public SpanStatus getStatus() { return status; }

    public Throwable getException() { return exception; }

    public boolean isEnded() { return ended.get(); }
}
