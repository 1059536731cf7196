package io.otel.messaging.metrics;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;

/**
 * The fixed instrument set of one destination (queue, routing key).
 *
 * Instruments are shared across destinations; each set binds them to its own
 * {@code messaging.destination.name} attribute. Obtain through
 * {@link MetricRegistry#getOrCreate(String)} only.
 */
public class DestinationInstruments {

    private final String destination;
    private final Attributes attributes;
    private final LongCounter published;
    private final LongCounter consumed;
    private final LongHistogram messageSize;
    private final DoubleHistogram processingTime;
    private final DoubleHistogram queueTime;
    private final LongCounter retries;

    DestinationInstruments(String destination,
                           LongCounter published,
                           LongCounter consumed,
                           LongHistogram messageSize,
                           DoubleHistogram processingTime,
                           DoubleHistogram queueTime,
                           LongCounter retries) {
        this.destination = destination;
        this.attributes = Attributes.of(MetricRegistry.DESTINATION_KEY, destination);
        this.published = published;
        this.consumed = consumed;
        this.messageSize = messageSize;
        this.processingTime = processingTime;
        this.queueTime = queueTime;
        this.retries = retries;
    }

    public void recordPublished() {
        published.add(1, attributes);
    }

    public void recordConsumed() {
        consumed.add(1, attributes);
    }

    public void recordMessageSize(long bytes) {
        if (bytes >= 0) {
            messageSize.record(bytes, attributes);
        }
    }

    public void recordProcessingTime(double millis) {
        processingTime.record(Math.max(0d, millis), attributes);
    }

    /**
     * Time between the producer's timestamp and delivery. Clock skew can make it negative; clamped to 0.
     */
    public void recordQueueTime(double millis) {
        queueTime.record(Math.max(0d, millis), attributes);
    }

    public void recordRetry() {
        retries.add(1, attributes);
    }

    public String getDestination() {
        return destination;
    }
}
