package io.otel.messaging.http;

import java.util.Map;

/**
 * An HTTP call to run under a span. Receives the request headers: for an outbound call
 * they already carry the trace context to send.
 */
@FunctionalInterface
public interface HttpCall<R, E extends Exception> {
    R execute(Map<String, String> headers) throws E;
}
