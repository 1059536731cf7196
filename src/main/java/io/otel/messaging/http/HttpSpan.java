package io.otel.messaging.http;

import io.opentelemetry.context.Context;
import io.otel.messaging.logging.MdcCorrelation;
import io.otel.messaging.metrics.EndpointInstruments;
import io.otel.messaging.trace.RecordedSpan;
import io.otel.messaging.trace.SpanRecorder;
import io.otel.messaging.trace.SpanStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One in-flight HTTP exchange: its span, its endpoint instruments and its start time.
 *
 * Finish with exactly one of {@link #complete(int)} or {@link #fail(Throwable)}; later calls
 * are ignored. Neither throws.
 */
public class HttpSpan {
    private static final Logger log = LoggerFactory.getLogger(HttpSpan.class);

    public static final String HTTP_STATUS_CODE = "http.status_code";

    private final SpanRecorder spanRecorder;
    private final RecordedSpan span;
    private final EndpointInstruments instruments;
    private final Context context;
    private final long startNanos = System.nanoTime();
    private final AtomicBoolean finished = new AtomicBoolean(false);

    HttpSpan(SpanRecorder spanRecorder, RecordedSpan span, EndpointInstruments instruments, Context parent) {
        this.spanRecorder = spanRecorder;
        this.span = span;
        this.instruments = instruments;
        this.context = span != null ? span.storeIn(parent) : parent;
    }

    /**
     * Finish with a response status. Anything outside 2xx is an error of kind {@code http_<status>}.
     */
    public void complete(int statusCode) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        boolean success = statusCode >= 200 && statusCode < 300;
        recordDuration();
        try {
            if (span != null) {
                span.setAttribute(HTTP_STATUS_CODE, statusCode);
            }
            if (!success && instruments != null) {
                instruments.recordError("http_" + statusCode);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record HTTP status {}", statusCode, e);
        }
        spanRecorder.endSpan(span, success ? SpanStatus.OK : SpanStatus.ERROR, null);
    }

    /**
     * Finish with a transport failure. The error kind is the exception's simple class name.
     */
    public void fail(Throwable error) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        recordDuration();
        try {
            if (instruments != null) {
                instruments.recordError(error == null ? "unknown" : error.getClass().getSimpleName());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record HTTP error", e);
        }
        spanRecorder.endSpan(span, SpanStatus.ERROR, error);
    }

    /**
     * Make this exchange's span current (OpenTelemetry context and MDC).
     */
    public MdcCorrelation.MdcScope makeCurrent() {
        return MdcCorrelation.makeCurrent(context);
    }

    public RecordedSpan getSpan() {
        return span;
    }

    public boolean isFinished() {
        return finished.get();
    }

    private void recordDuration() {
        try {
            if (instruments != null) {
                instruments.recordDuration((System.nanoTime() - startNanos) / 1_000_000d);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record HTTP duration", e);
        }
    }
}
