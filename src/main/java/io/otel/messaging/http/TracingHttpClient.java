package io.otel.messaging.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Wraps a JDK {@link HttpClient} so that {@link #send} runs under a CLIENT span and carries
 * the trace context in its request headers.
 */
public class TracingHttpClient {

    private final HttpClient delegate;
    private final HttpTracing httpTracing;

    public TracingHttpClient(HttpClient delegate, HttpTracing httpTracing) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.httpTracing = Objects.requireNonNull(httpTracing, "httpTracing");
    }

    /**
     * Same contract as {@link HttpClient#send(HttpRequest, HttpResponse.BodyHandler)}.
     */
    public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
            throws IOException, InterruptedException {
        Map<String, String> headers = new HashMap<>();
        HttpSpan exchange = httpTracing.startOutbound(request.method(), request.uri().toString(), headers);

        HttpRequest.Builder builder = HttpRequest.newBuilder(request, (name, value) -> !headers.containsKey(name));
        headers.forEach(builder::header);

        HttpResponse<T> response;
        try {
            response = delegate.send(builder.build(), bodyHandler);
        } catch (IOException | InterruptedException | RuntimeException e) {
            exchange.fail(e);
            throw e;
        }
        exchange.complete(response.statusCode());
        return response;
    }

    public HttpClient getDelegate() {
        return delegate;
    }
}
