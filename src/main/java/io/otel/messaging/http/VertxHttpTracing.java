package io.otel.messaging.http;

import io.reactivex.rxjava3.core.Single;
import io.vertx.core.Handler;
import io.vertx.rxjava3.core.MultiMap;
import io.vertx.rxjava3.ext.web.Route;
import io.vertx.rxjava3.ext.web.RoutingContext;
import io.vertx.rxjava3.ext.web.client.HttpRequest;
import io.vertx.rxjava3.ext.web.client.HttpResponse;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Vert.x Web integration of {@link HttpTracing}.
 *
 * Usage:
 * <pre>
 * // Inbound: SERVER span per request, ended when the response body is written
 * router.get("/v1/orders").handler(vertxTracing.traced(ordersHandler::list));
 *
 * // Outbound: CLIENT span around a WebClient request
 * vertxTracing.send("GET", url, webClient.getAbs(url))
 *     .subscribe(response -&gt; ...);
 * </pre>
 */
public class VertxHttpTracing {

    private final HttpTracing httpTracing;

    public VertxHttpTracing(HttpTracing httpTracing) {
        this.httpTracing = Objects.requireNonNull(httpTracing, "httpTracing");
    }

    /**
     * Wrap a route handler. The SERVER span is current while {@code handler} runs and ends
     * with the response status once the body has been written.
     */
    public Handler<RoutingContext> traced(Handler<RoutingContext> handler) {
        Objects.requireNonNull(handler, "handler");
        return ctx -> {
            HttpSpan exchange = httpTracing.startInbound(
                    ctx.request().method().name(), routeOf(ctx), headersOf(ctx.request().headers()));
            ctx.addBodyEndHandler(v -> exchange.complete(ctx.response().getStatusCode()));
            try (var scope = exchange.makeCurrent()) {
                handler.handle(ctx);
            } catch (RuntimeException e) {
                exchange.fail(e);
                throw e;
            }
        };
    }

    /**
     * Send a WebClient request under a CLIENT span. The span starts at subscription.
     */
    public <T> Single<HttpResponse<T>> send(String method, String url, HttpRequest<T> request) {
        return Single.defer(() -> {
            Map<String, String> headers = new HashMap<>();
            HttpSpan exchange = httpTracing.startOutbound(method, url, headers);
            headers.forEach(request::putHeader);
            return request.rxSend()
                    .doOnSuccess(response -> exchange.complete(response.statusCode()))
                    .doOnError(exchange::fail);
        });
    }

    private static String routeOf(RoutingContext ctx) {
        Route route = ctx.currentRoute();
        if (route != null && route.getPath() != null) {
            return route.getPath();
        }
        return ctx.request().path();
    }

    static Map<String, String> headersOf(MultiMap multiMap) {
        Map<String, String> headers = new HashMap<>();
        for (String name : multiMap.names()) {
            headers.put(name.toLowerCase(Locale.ROOT), multiMap.get(name));
        }
        return headers;
    }
}
