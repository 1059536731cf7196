package io.otel.messaging.trace;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link SpanExporter} decorator that requeues a failed batch a bounded number of times
 * before dropping it.
 *
 * Dropped spans are counted both in memory ({@link #getDroppedSpans()}) and, once a meter is
 * attached, on the {@code otel.sdk.spans.dropped} counter. Failures never propagate to the
 * code that ended the spans.
 */
public class RetryingSpanExporter implements SpanExporter {
    private static final Logger log = LoggerFactory.getLogger(RetryingSpanExporter.class);

    static final String DROPPED_SPANS_METRIC = "otel.sdk.spans.dropped";
    private static final AttributeKey<String> EXPORTER_KEY = AttributeKey.stringKey("exporter");

    private final SpanExporter delegate;
    private final int maxAttempts;
    private final Duration backoff;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong droppedSpans = new AtomicLong();
    private final AtomicLong droppedBatches = new AtomicLong();
    private final AtomicLong retriedBatches = new AtomicLong();
    private final Attributes exporterAttributes;

    private volatile LongCounter droppedCounter;

    public RetryingSpanExporter(SpanExporter delegate, int maxAttempts, Duration backoff) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be non-negative");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.exporterAttributes = Attributes.of(EXPORTER_KEY, delegate.getClass().getSimpleName());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "span-export-retry");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Attach the meter used for the dropped-span counter. The meter provider is usually
     * built after the tracer provider, hence not a constructor argument.
     */
    public void bindMeter(Meter meter) {
        this.droppedCounter = meter.counterBuilder(DROPPED_SPANS_METRIC)
                .setDescription("Spans dropped after exhausting export retries")
                .setUnit("{span}")
                .build();
    }

    @Override
    public CompletableResultCode export(Collection<SpanData> spans) {
        List<SpanData> batch = new ArrayList<>(spans);
        CompletableResultCode result = new CompletableResultCode();
        attempt(batch, 1, result);
        return result;
    }

    private void attempt(List<SpanData> batch, int attempt, CompletableResultCode result) {
        CompletableResultCode delegateResult;
        try {
            delegateResult = delegate.export(batch);
        } catch (RuntimeException e) {
            log.debug("Span exporter threw on attempt {}/{}", attempt, maxAttempts, e);
            delegateResult = CompletableResultCode.ofFailure();
        }
        CompletableResultCode pending = delegateResult;
        pending.whenComplete(() -> {
            if (pending.isSuccess()) {
                result.succeed();
            } else if (attempt < maxAttempts) {
                retriedBatches.incrementAndGet();
                log.debug("Span batch of {} failed to export, retrying ({}/{})", batch.size(), attempt, maxAttempts);
                scheduleRetry(batch, attempt + 1, result);
            } else {
                drop(batch);
                result.fail();
            }
        });
    }

    private void scheduleRetry(List<SpanData> batch, int nextAttempt, CompletableResultCode result) {
        try {
            scheduler.schedule(() -> attempt(batch, nextAttempt, result), backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            // scheduler already shut down
            log.debug("Cannot schedule span export retry", e);
            drop(batch);
            result.fail();
        }
    }

    private void drop(List<SpanData> batch) {
        droppedBatches.incrementAndGet();
        droppedSpans.addAndGet(batch.size());
        LongCounter counter = droppedCounter;
        if (counter != null) {
            counter.add(batch.size(), exporterAttributes);
        }
        log.warn("Dropping batch of {} spans after {} failed export attempts", batch.size(), maxAttempts);
    }

    @Override
    public CompletableResultCode flush() {
        return delegate.flush();
    }

    @Override
    public CompletableResultCode shutdown() {
        scheduler.shutdown();
        return delegate.shutdown();
    }

    public long getDroppedSpans() {
        return droppedSpans.get();
    }

    public long getDroppedBatches() {
        return droppedBatches.get();
    }

    public long getRetriedBatches() {
        return retriedBatches.get();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
