package io.otel.messaging.trace;

import io.opentelemetry.api.trace.StatusCode;

/**
 * Final outcome of a recorded span.
 */
public enum SpanStatus {
    UNSET(StatusCode.UNSET),
    OK(StatusCode.OK),
    ERROR(StatusCode.ERROR);

    private final StatusCode statusCode;

    SpanStatus(StatusCode statusCode) {
        this.statusCode = statusCode;
    }

    public StatusCode toStatusCode() {
        return statusCode;
    }
}
