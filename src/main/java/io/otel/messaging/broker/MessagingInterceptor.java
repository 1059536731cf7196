package io.otel.messaging.broker;

import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.otel.messaging.context.ContextCodec;
import io.otel.messaging.context.ExtractedContext;
import io.otel.messaging.logging.MdcCorrelation;
import io.otel.messaging.metrics.DestinationInstruments;
import io.otel.messaging.metrics.MetricRegistry;
import io.otel.messaging.trace.RecordedSpan;
import io.otel.messaging.trace.SpanRecorder;
import io.otel.messaging.trace.SpanStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Wraps broker publish calls and consumer callbacks with PRODUCER/CONSUMER spans, context
 * propagation through message headers, and per-destination metrics.
 *
 * Instrumentation never changes the outcome of the wrapped call: a failing publish or
 * handler throws the very same exception after the span is marked ERROR, and a failure
 * in the instrumentation's own bookkeeping is logged and otherwise ignored.
 *
 * Usage:
 * <pre>
 * Publisher publisher = interceptor.wrapPublisher(envelope -&gt; client.send(envelope));
 * publisher.publish(MessageEnvelope.builder().routingKey("orders").body(payload).build());
 *
 * MessageHandler handler = interceptor.wrapHandler("orders", envelope -&gt; orders.process(envelope));
 * </pre>
 */
public class MessagingInterceptor {
    private static final Logger log = LoggerFactory.getLogger(MessagingInterceptor.class);

    public static final String MESSAGING_SYSTEM = "messaging.system";
    public static final String MESSAGING_DESTINATION = "messaging.destination";
    public static final String MESSAGING_DESTINATION_KIND = "messaging.destination_kind";
    public static final String MESSAGING_PROTOCOL = "messaging.protocol";
    public static final String MESSAGING_MESSAGE_ID = "messaging.message_id";
    public static final String MESSAGING_CORRELATION_ID = "messaging.correlation_id";
    public static final String MESSAGING_OPERATION = "messaging.operation";
    public static final String MESSAGING_ROUTING_KEY = "messaging.rabbitmq.routing_key";
    public static final String MESSAGING_EXCHANGE = "messaging.rabbitmq.exchange";
    public static final String MESSAGING_PAYLOAD_SIZE = "messaging.message.payload_size_bytes";
    public static final String MESSAGING_REDELIVERED = "messaging.rabbitmq.redelivered";
    public static final String MESSAGING_DELIVERY_COUNT = "messaging.rabbitmq.delivery_count";

    /**
     * Publish time in epoch milliseconds. The AMQP timestamp property only carries whole
     * seconds, so queue time is measured from this header when present.
     */
    public static final String PUBLISHED_AT_HEADER = "x-published-at-ms";

    private final SpanRecorder spanRecorder;
    private final MetricRegistry metricRegistry;
    private final ContextCodec contextCodec;
    private final RedeliveryDetector redeliveryDetector;
    private final String messagingSystem;

    public MessagingInterceptor(SpanRecorder spanRecorder, MetricRegistry metricRegistry, ContextCodec contextCodec) {
        this(spanRecorder, metricRegistry, contextCodec, new RedeliveryDetector(), "rabbitmq");
    }

    public MessagingInterceptor(SpanRecorder spanRecorder,
                                MetricRegistry metricRegistry,
                                ContextCodec contextCodec,
                                RedeliveryDetector redeliveryDetector,
                                String messagingSystem) {
        this.spanRecorder = Objects.requireNonNull(spanRecorder, "spanRecorder");
        this.metricRegistry = Objects.requireNonNull(metricRegistry, "metricRegistry");
        this.contextCodec = Objects.requireNonNull(contextCodec, "contextCodec");
        this.redeliveryDetector = Objects.requireNonNull(redeliveryDetector, "redeliveryDetector");
        this.messagingSystem = Objects.requireNonNull(messagingSystem, "messagingSystem");
    }

    /**
     * Return a publisher with the same contract as {@code delegate} that also traces and
     * measures each publish.
     */
    public Publisher wrapPublisher(Publisher delegate) {
        Objects.requireNonNull(delegate, "delegate");
        return envelope -> publish(envelope, delegate);
    }

    /**
     * Return a handler with the same contract as {@code handler} that also traces and
     * measures each delivery from {@code queue}.
     */
    public MessageHandler wrapHandler(String queue, MessageHandler handler) {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(handler, "handler");
        return envelope -> consume(queue, envelope, handler);
    }

    private void publish(MessageEnvelope envelope, Publisher delegate) throws IOException {
        String routingKey = envelope.getRoutingKey();
        Context parent = Context.current();
        RecordedSpan span = startSpan("publish " + routingKey, SpanKind.PRODUCER, publishAttributes(envelope), parent);

        if (span != null) {
            bookkeeping("inject context", () -> {
                contextCodec.inject(span.getContext(), Baggage.fromContext(parent), envelope.getHeaders());
                if (envelope.getCorrelationId() == null || envelope.getCorrelationId().isEmpty()) {
                    envelope.setCorrelationId(span.getContext().getSpanId());
                    span.setAttribute(MESSAGING_CORRELATION_ID, envelope.getCorrelationId());
                }
            });
        }

        bookkeeping("stamp publish time", () -> {
            Instant publishedAt = envelope.getTimestamp() != null ? envelope.getTimestamp() : Instant.now();
            envelope.getHeaders().put(PUBLISHED_AT_HEADER, publishedAt.toEpochMilli());
        });

        Context publishContext = span != null ? span.storeIn(parent) : parent;
        try (MdcCorrelation.MdcScope scope = MdcCorrelation.makeCurrent(publishContext)) {
            delegate.publish(envelope);
        } catch (IOException | RuntimeException | Error e) {
            spanRecorder.endSpan(span, SpanStatus.ERROR, e);
            throw e;
        }

        bookkeeping("record publish metrics", () -> {
            DestinationInstruments instruments = metricRegistry.getOrCreate(routingKey);
            instruments.recordPublished();
            instruments.recordMessageSize(envelope.size());
        });
        spanRecorder.endSpan(span, SpanStatus.OK, null);
    }

    private void consume(String queue, MessageEnvelope envelope, MessageHandler handler) throws Exception {
        ExtractedContext extracted = contextCodec.extract(envelope.getHeaders());
        Context parent = contextCodec.toOtelContext(extracted);
        boolean redelivered = redeliveryDetector.isRedelivery(envelope.getHeaders());

        Map<String, Object> attributes = consumeAttributes(queue, envelope);
        attributes.put(MESSAGING_REDELIVERED, redelivered);
        long deaths = RedeliveryDetector.deathCount(envelope.getHeaders(), queue);
        if (deaths > 0) {
            attributes.put(MESSAGING_DELIVERY_COUNT, deaths + 1);
        }
        RecordedSpan span = startSpan("consume " + queue, SpanKind.CONSUMER, attributes, parent);

        bookkeeping("record consume metrics", () -> {
            DestinationInstruments instruments = metricRegistry.getOrCreate(queue);
            instruments.recordConsumed();
            instruments.recordMessageSize(envelope.size());
            if (redelivered) {
                instruments.recordRetry();
            }
            Instant sentAt = publishedAt(envelope);
            if (sentAt != null) {
                instruments.recordQueueTime(Duration.between(sentAt, Instant.now()).toMillis());
            }
        });

        Context consumerContext = span != null ? span.storeIn(parent) : parent;
        RecordedSpan processSpan = startSpan("process " + queue, SpanKind.INTERNAL,
                Map.of(MESSAGING_OPERATION, "process"), consumerContext);
        Context processContext = processSpan != null ? processSpan.storeIn(consumerContext) : consumerContext;

        long startNanos = System.nanoTime();
        try (MdcCorrelation.MdcScope scope = MdcCorrelation.makeCurrent(processContext)) {
            handler.handle(envelope);
        } catch (Exception | Error e) {
            spanRecorder.endSpan(processSpan, SpanStatus.ERROR, e);
            spanRecorder.endSpan(span, SpanStatus.ERROR, e);
            throw e;
        } finally {
            double elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000d;
            bookkeeping("record processing time",
                    () -> metricRegistry.getOrCreate(queue).recordProcessingTime(elapsedMillis));
        }
        spanRecorder.endSpan(processSpan, SpanStatus.OK, null);
        spanRecorder.endSpan(span, SpanStatus.OK, null);
    }

    /**
     * Millisecond publish time from {@link #PUBLISHED_AT_HEADER}, else the envelope timestamp.
     */
    static Instant publishedAt(MessageEnvelope envelope) {
        Object header = envelope.getHeaders().get(PUBLISHED_AT_HEADER);
        if (header instanceof Number) {
            return Instant.ofEpochMilli(((Number) header).longValue());
        }
        if (header != null) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(header.toString().trim()));
            } catch (NumberFormatException e) {
                log.debug("Ignoring malformed {} header: {}", PUBLISHED_AT_HEADER, header);
            }
        }
        return envelope.getTimestamp();
    }

    private Map<String, Object> publishAttributes(MessageEnvelope envelope) {
        Map<String, Object> attributes = baseAttributes(envelope.getRoutingKey());
        attributes.put(MESSAGING_EXCHANGE, envelope.getExchange());
        attributes.put(MESSAGING_ROUTING_KEY, envelope.getRoutingKey());
        attributes.put(MESSAGING_MESSAGE_ID, envelope.getMessageId());
        attributes.put(MESSAGING_CORRELATION_ID, envelope.getCorrelationId());
        attributes.put(MESSAGING_PAYLOAD_SIZE, envelope.size());
        return attributes;
    }

    private Map<String, Object> consumeAttributes(String queue, MessageEnvelope envelope) {
        Map<String, Object> attributes = baseAttributes(queue);
        attributes.put(MESSAGING_ROUTING_KEY, envelope.getRoutingKey());
        attributes.put(MESSAGING_MESSAGE_ID, envelope.getMessageId());
        attributes.put(MESSAGING_CORRELATION_ID, envelope.getCorrelationId());
        attributes.put(MESSAGING_PAYLOAD_SIZE, envelope.size());
        return attributes;
    }

    private Map<String, Object> baseAttributes(String destination) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(MESSAGING_SYSTEM, messagingSystem);
        attributes.put(MESSAGING_DESTINATION, destination);
        attributes.put(MESSAGING_DESTINATION_KIND, "queue");
        attributes.put(MESSAGING_PROTOCOL, "AMQP");
        return attributes;
    }

    private RecordedSpan startSpan(String name, SpanKind kind, Map<String, ?> attributes, Context parent) {
        try {
            return spanRecorder.startSpan(name, kind, attributes, parent);
        } catch (RuntimeException e) {
            log.warn("Failed to start span {}, continuing untraced", name, e);
            return null;
        }
    }

    private static void bookkeeping(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Instrumentation step '{}' failed", what, e);
        }
    }

    public RedeliveryDetector getRedeliveryDetector() {
        return redeliveryDetector;
    }
}
