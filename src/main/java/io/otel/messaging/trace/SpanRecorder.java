package io.otel.messaging.trace;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.otel.messaging.context.TraceContext;
import io.otel.messaging.logging.MdcCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Starts and ends spans on top of an OpenTelemetry {@link Tracer}.
 *
 * Export is handled by the tracer provider's batch processor; ending a span only hands it
 * over, so a dead collector never surfaces here.
 *
 * Usage:
 * <pre>
 * RecordedSpan span = recorder.startSpan("load-config", SpanKind.INTERNAL, Map.of(), parent);
 * try {
 *     ...
 *     recorder.endSpan(span, SpanStatus.OK, null);
 * } catch (Exception e) {
 *     recorder.endSpan(span, SpanStatus.ERROR, e);
 *     throw e;
 * }
 *
 * // or scoped
 * recorder.inSpan("load-config", SpanKind.INTERNAL, Map.of(), span -&gt; loader.load());
 * </pre>
 */
public class SpanRecorder {
    private static final Logger log = LoggerFactory.getLogger(SpanRecorder.class);

    public static final String SERVICE_NAME_ATTRIBUTE = "service.name";

    private final Tracer tracer;
    private final String serviceName;

    public SpanRecorder(Tracer tracer, String serviceName) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.serviceName = serviceName;
    }

    /**
     * Start a span under an explicit parent. A null or invalid parent starts a new trace,
     * whose sampling the process-wide sampler decides.
     */
    public RecordedSpan startSpan(String name, SpanKind kind, Map<String, ?> attributes, TraceContext parent) {
        Context parentContext = Context.root();
        if (parent != null && parent.isValid()) {
            parentContext = parentContext.with(Span.wrap(parent.toSpanContext()));
        }
        return startSpan(name, kind, attributes, parentContext);
    }

    /**
     * Start a span whose parent is the span stored in {@code parentContext}, if any.
     */
    public RecordedSpan startSpan(String name, SpanKind kind, Map<String, ?> attributes, Context parentContext) {
        Objects.requireNonNull(name, "name");
        Context parent = parentContext == null ? Context.root() : parentContext;
        SpanContext parentSpanContext = Span.fromContext(parent).getSpanContext();

        Instant start = Instant.now();
        SpanBuilder builder = tracer.spanBuilder(name)
                .setSpanKind(kind == null ? SpanKind.INTERNAL : kind)
                .setStartTimestamp(start)
                .setAllAttributes(AttributeValues.toAttributes(attributes));
        if (parentSpanContext.isValid()) {
            builder.setParent(parent);
        } else {
            builder.setNoParent();
        }
        if (serviceName != null) {
            builder.setAttribute(SERVICE_NAME_ATTRIBUTE, serviceName);
        }

        Span span = builder.startSpan();
        log.debug("Started span {} kind={} trace_id={}", name, kind, span.getSpanContext().getTraceId());
        return new RecordedSpan(name, kind, TraceContext.fromSpanContext(parentSpanContext), start, span);
    }

    /**
     * End the span with a final status. Terminal and idempotent; never throws.
     */
    public void endSpan(RecordedSpan span, SpanStatus status, Throwable exception) {
        if (span == null) {
            return;
        }
        try {
            if (!span.end(status, exception)) {
                log.debug("Span {} already ended", span.getName());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to end span {}", span.getName(), e);
        }
    }

    /**
     * Run {@code work} inside a span that is current (OpenTelemetry context and MDC) for its
     * duration. The span ends OK on return and ERROR on any throwable, which is rethrown as is.
     */
    public <T> T inSpan(String name, SpanKind kind, Map<String, ?> attributes, Context parentContext,
                        SpanCallable<T> work) throws Exception {
        Context parent = parentContext == null ? Context.root() : parentContext;
        RecordedSpan span = startSpan(name, kind, attributes, parent);
        try (MdcCorrelation.MdcScope scope = MdcCorrelation.makeCurrent(span.storeIn(parent))) {
            T result = work.call(span);
            endSpan(span, SpanStatus.OK, null);
            return result;
        } catch (Exception | Error e) {
            endSpan(span, SpanStatus.ERROR, e);
            throw e;
        }
    }

    /**
     * {@link #inSpan(String, SpanKind, Map, Context, SpanCallable)} under the current context.
     */
    public <T> T inSpan(String name, SpanKind kind, Map<String, ?> attributes, SpanCallable<T> work) throws Exception {
        return inSpan(name, kind, attributes, Context.current(), work);
    }

    /**
     * Wrap a callable so that every invocation runs in its own span. The returned callable
     * has the same result and failure behaviour as the original.
     */
    public <T> Callable<T> wrap(String name, SpanKind kind, Map<String, ?> attributes, Callable<T> callable) {
        Objects.requireNonNull(callable, "callable");
        return () -> inSpan(name, kind, attributes, Context.current(), span -> callable.call());
    }

    /**
     * Context of the span current on this thread, or {@link TraceContext#invalid()}.
     */
    public TraceContext currentContext() {
        return TraceContext.fromSpanContext(Span.current().getSpanContext());
    }

    public String getServiceName() {
        return serviceName;
    }
}
