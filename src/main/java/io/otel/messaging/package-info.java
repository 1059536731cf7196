/**
 * Tracing, metrics and log correlation for services that talk through a message broker
 * and over HTTP.
 *
 * <h2>Quick Start</h2>
 * <pre>
 * // 1. Initialize once at application startup
 * TelemetrySdk sdk = TelemetrySdk.builder()
 *     .serviceName("order-service")
 *     .otlpEndpoint("http://localhost:4318")
 *     .build();
 *
 * // 2. Publish with a PRODUCER span and trace headers
 * TracingChannelPublisher publisher = new TracingChannelPublisher(channel, sdk.messagingInterceptor());
 * publisher.publish("", "orders", null, payload);
 *
 * // 3. Consume with a CONSUMER span that continues the producer's trace
 * RetryPolicy policy = RetryPolicy.forQueue("orders").maxRetries(3).build();
 * policy.declare(new ChannelTopologyDeclarer(channel));
 * new TracingConsumer(channel, "orders", sdk.messagingInterceptor(), orders::process, policy).start();
 *
 * // 4. Trace HTTP calls and routes
 * VertxHttpTracing http = new VertxHttpTracing(sdk.httpTracing());
 * router.get("/v1/orders").handler(http.traced(ordersHandler::list));
 * </pre>
 *
 * <h2>Log Correlation</h2>
 * Add trace_id and span_id to your logback pattern:
 * <pre>
 * &lt;pattern&gt;%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - trace_id=%X{trace_id} span_id=%X{span_id} - %msg%n&lt;/pattern&gt;
 * </pre>
 *
 * @see io.otel.messaging.core.TelemetrySdk
 * @see io.otel.messaging.broker.MessagingInterceptor
 * @see io.otel.messaging.retry.RetryPolicy
 * @see io.otel.messaging.http.HttpTracing
 */
package io.otel.messaging;
