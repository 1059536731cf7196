package io.otel.messaging.http;

import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.otel.messaging.context.ContextCodec;
import io.otel.messaging.context.ExtractedContext;
import io.otel.messaging.metrics.EndpointInstruments;
import io.otel.messaging.metrics.MetricRegistry;
import io.otel.messaging.trace.RecordedSpan;
import io.otel.messaging.trace.SpanRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToIntFunction;

/**
 * CLIENT and SERVER spans plus endpoint metrics around synchronous HTTP calls.
 *
 * Outbound: the current context is injected into the request headers. Inbound: the
 * caller's context is extracted from the request headers and becomes the parent.
 * Non-2xx statuses and transport exceptions mark the span ERROR and count an endpoint
 * error; the exception itself is rethrown untouched.
 *
 * Usage:
 * <pre>
 * HttpResponse&lt;String&gt; response = httpTracing.outbound("GET", url, new HashMap&lt;&gt;(),
 *     headers -&gt; client.get(url, headers),
 *     HttpResponse::statusCode);
 * </pre>
 */
public class HttpTracing {
    private static final Logger log = LoggerFactory.getLogger(HttpTracing.class);

    public static final String HTTP_METHOD = "http.method";
    public static final String HTTP_URL = "http.url";
    public static final String HTTP_ROUTE = "http.route";

    private final SpanRecorder spanRecorder;
    private final MetricRegistry metricRegistry;
    private final ContextCodec contextCodec;

    public HttpTracing(SpanRecorder spanRecorder, MetricRegistry metricRegistry, ContextCodec contextCodec) {
        this.spanRecorder = Objects.requireNonNull(spanRecorder, "spanRecorder");
        this.metricRegistry = Objects.requireNonNull(metricRegistry, "metricRegistry");
        this.contextCodec = Objects.requireNonNull(contextCodec, "contextCodec");
    }

    /**
     * Start a CLIENT span under the current context and write its context into {@code headers}.
     * Userinfo never leaves the process; the endpoint metrics drop the query as well.
     */
    public HttpSpan startOutbound(String method, String url, Map<String, String> headers) {
        String httpMethod = method.toUpperCase(Locale.ROOT);
        Context parent = Context.current();
        String safeUrl = HttpUrls.redact(url);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(HTTP_METHOD, httpMethod);
        attributes.put(HTTP_URL, safeUrl);
        RecordedSpan span = startSpan(httpMethod, SpanKind.CLIENT, attributes, parent);

        if (span != null && headers != null) {
            try {
                contextCodec.inject(span.getContext(), Baggage.fromContext(parent), headers);
            } catch (RuntimeException e) {
                log.warn("Failed to inject trace context into request to {}", safeUrl, e);
            }
        }
        return new HttpSpan(spanRecorder, span, endpoint(true, httpMethod, HttpUrls.endpoint(url)), parent);
    }

    /**
     * Start a SERVER span whose parent is whatever context the caller sent in {@code headers}.
     */
    public HttpSpan startInbound(String method, String route, Map<String, String> headers) {
        String httpMethod = method.toUpperCase(Locale.ROOT);
        ExtractedContext extracted = contextCodec.extract(headers);
        Context parent = contextCodec.toOtelContext(extracted);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(HTTP_METHOD, httpMethod);
        attributes.put(HTTP_ROUTE, route);
        RecordedSpan span = startSpan(httpMethod + " " + route, SpanKind.SERVER, attributes, parent);
        return new HttpSpan(spanRecorder, span, endpoint(false, httpMethod, route), parent);
    }

    /**
     * Run an outbound call under a CLIENT span. {@code headers} must be mutable.
     */
    public <R, E extends Exception> R outbound(String method, String url, Map<String, String> headers,
                                               HttpCall<R, E> call, ToIntFunction<R> statusOf) throws E {
        HttpSpan exchange = startOutbound(method, url, headers);
        R response;
        try {
            response = call.execute(headers);
        } catch (Exception | Error e) {
            exchange.fail(e);
            throw e;
        }
        exchange.complete(statusOf(statusOf, response));
        return response;
    }

    /**
     * Run an inbound handler under a SERVER span that is current while the handler runs.
     */
    public <R, E extends Exception> R inbound(String method, String route, Map<String, String> headers,
                                              HttpCall<R, E> handler, ToIntFunction<R> statusOf) throws E {
        HttpSpan exchange = startInbound(method, route, headers);
        R response;
        try (var scope = exchange.makeCurrent()) {
            response = handler.execute(headers);
        } catch (Exception | Error e) {
            exchange.fail(e);
            throw e;
        }
        exchange.complete(statusOf(statusOf, response));
        return response;
    }

    private static <R> int statusOf(ToIntFunction<R> statusOf, R response) {
        try {
            return statusOf.applyAsInt(response);
        } catch (RuntimeException e) {
            log.warn("Could not read HTTP status from response", e);
            return 0;
        }
    }

    private RecordedSpan startSpan(String name, SpanKind kind, Map<String, ?> attributes, Context parent) {
        try {
            return spanRecorder.startSpan(name, kind, attributes, parent);
        } catch (RuntimeException e) {
            log.warn("Failed to start span {}, continuing untraced", name, e);
            return null;
        }
    }

    private EndpointInstruments endpoint(boolean client, String method, String endpoint) {
        try {
            return client ? metricRegistry.clientEndpoint(method, endpoint) : metricRegistry.serverEndpoint(method, endpoint);
        } catch (RuntimeException e) {
            log.warn("Failed to resolve instruments for {} {}", method, endpoint, e);
            return null;
        }
    }
}
