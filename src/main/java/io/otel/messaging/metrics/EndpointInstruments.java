package io.otel.messaging.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;

/**
 * Duration and error instruments of one HTTP endpoint (method + url or route).
 */
public class EndpointInstruments {

    static final AttributeKey<String> ERROR_KIND_KEY = AttributeKey.stringKey("error.kind");

    private final String method;
    private final String endpoint;
    private final Attributes attributes;
    private final DoubleHistogram duration;
    private final LongCounter errors;

    EndpointInstruments(String method, String endpoint, DoubleHistogram duration, LongCounter errors) {
        this.method = method;
        this.endpoint = endpoint;
        this.attributes = Attributes.of(
                MetricRegistry.HTTP_METHOD_KEY, method,
                MetricRegistry.HTTP_ENDPOINT_KEY, endpoint);
        this.duration = duration;
        this.errors = errors;
    }

    public void recordDuration(double millis) {
        duration.record(Math.max(0d, millis), attributes);
    }

    /**
     * Count a failed call. {@code errorKind} is e.g. {@code http_503} or an exception class name.
     */
    public void recordError(String errorKind) {
        errors.add(1, attributes.toBuilder().put(ERROR_KIND_KEY, errorKind).build());
    }

    public String getMethod() { return method; }

    public String getEndpoint() { return endpoint; }
}
