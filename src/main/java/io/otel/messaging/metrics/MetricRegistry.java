package io.otel.messaging.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keyed registry of per-destination and per-endpoint instrument sets.
 *
 * Each distinct destination name gets exactly one {@link DestinationInstruments} for the
 * lifetime of the registry, even when many threads ask for a new name at the same time.
 * Recording only touches the OpenTelemetry in-memory aggregators; export runs on the
 * meter provider's periodic reader.
 */
public class MetricRegistry {
    private static final Logger log = LoggerFactory.getLogger(MetricRegistry.class);

    public static final AttributeKey<String> DESTINATION_KEY = AttributeKey.stringKey("messaging.destination.name");
    public static final AttributeKey<String> HTTP_METHOD_KEY = AttributeKey.stringKey("http.method");
    public static final AttributeKey<String> HTTP_ENDPOINT_KEY = AttributeKey.stringKey("http.endpoint");

    public static final String PUBLISHED = "messaging.published";
    public static final String CONSUMED = "messaging.consumed";
    public static final String MESSAGE_SIZE = "messaging.message.size";
    public static final String PROCESSING_TIME = "messaging.processing.time";
    public static final String QUEUE_TIME = "messaging.queue.time";
    public static final String RETRIES = "messaging.retries";
    public static final String HTTP_CLIENT_DURATION = "http.client.duration";
    public static final String HTTP_SERVER_DURATION = "http.server.duration";
    public static final String HTTP_CLIENT_ERRORS = "http.client.errors";
    public static final String HTTP_SERVER_ERRORS = "http.server.errors";

    private final ConcurrentMap<String, DestinationInstruments> destinations = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, EndpointInstruments> clientEndpoints = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, EndpointInstruments> serverEndpoints = new ConcurrentHashMap<>();

    private final LongCounter published;
    private final LongCounter consumed;
    private final LongHistogram messageSize;
    private final DoubleHistogram processingTime;
    private final DoubleHistogram queueTime;
    private final LongCounter retries;
    private final DoubleHistogram clientDuration;
    private final DoubleHistogram serverDuration;
    private final LongCounter clientErrors;
    private final LongCounter serverErrors;

    public MetricRegistry(Meter meter) {
        Objects.requireNonNull(meter, "meter");
        this.published = meter.counterBuilder(PUBLISHED)
                .setDescription("Number of messages published")
                .setUnit("{message}")
                .build();
        this.consumed = meter.counterBuilder(CONSUMED)
                .setDescription("Number of messages consumed")
                .setUnit("{message}")
                .build();
        this.messageSize = meter.histogramBuilder(MESSAGE_SIZE)
                .setDescription("Size of message bodies")
                .setUnit("By")
                .ofLongs()
                .build();
        this.processingTime = meter.histogramBuilder(PROCESSING_TIME)
                .setDescription("Time taken to process a delivered message")
                .setUnit("ms")
                .build();
        this.queueTime = meter.histogramBuilder(QUEUE_TIME)
                .setDescription("Time a message spent in the broker before delivery")
                .setUnit("ms")
                .build();
        this.retries = meter.counterBuilder(RETRIES)
                .setDescription("Number of redelivered messages")
                .setUnit("{message}")
                .build();
        this.clientDuration = meter.histogramBuilder(HTTP_CLIENT_DURATION)
                .setDescription("Duration of outbound HTTP requests")
                .setUnit("ms")
                .build();
        this.serverDuration = meter.histogramBuilder(HTTP_SERVER_DURATION)
                .setDescription("Duration of inbound HTTP requests")
                .setUnit("ms")
                .build();
        this.clientErrors = meter.counterBuilder(HTTP_CLIENT_ERRORS)
                .setDescription("Failed outbound HTTP requests")
                .setUnit("{request}")
                .build();
        this.serverErrors = meter.counterBuilder(HTTP_SERVER_ERRORS)
                .setDescription("Failed inbound HTTP requests")
                .setUnit("{request}")
                .build();
    }

    /**
     * Instrument set for a destination, created on first use.
     */
    public DestinationInstruments getOrCreate(String destination) {
        Objects.requireNonNull(destination, "destination");
        return destinations.computeIfAbsent(destination, name -> {
            log.debug("Registering instruments for destination {}", name);
            return new DestinationInstruments(name, published, consumed, messageSize, processingTime, queueTime, retries);
        });
    }

    public EndpointInstruments clientEndpoint(String method, String url) {
        return clientEndpoints.computeIfAbsent(key(method, url),
                k -> new EndpointInstruments(method, url, clientDuration, clientErrors));
    }

    public EndpointInstruments serverEndpoint(String method, String route) {
        return serverEndpoints.computeIfAbsent(key(method, route),
                k -> new EndpointInstruments(method, route, serverDuration, serverErrors));
    }

    /**
     * Destination names seen so far.
     */
    public Set<String> destinations() {
        return Collections.unmodifiableSet(destinations.keySet());
    }

    private static String key(String method, String endpoint) {
        return Objects.requireNonNull(method, "method") + ' ' + Objects.requireNonNull(endpoint, "endpoint");
    }
}
