package io.otel.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.otel.messaging.broker.MessageEnvelope;
import io.otel.messaging.broker.MessagingInterceptor;

import java.io.IOException;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Publishes through a RabbitMQ {@link Channel} with a PRODUCER span, trace headers and
 * publish metrics around each {@code basicPublish}.
 *
 * Usage:
 * <pre>
 * TracingChannelPublisher publisher = new TracingChannelPublisher(channel, sdk.messagingInterceptor());
 * publisher.publish("", "orders", null, payload);
 * </pre>
 */
public class TracingChannelPublisher {

    private final Channel channel;
    private final MessagingInterceptor interceptor;

    public TracingChannelPublisher(Channel channel, MessagingInterceptor interceptor) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.interceptor = Objects.requireNonNull(interceptor, "interceptor");
    }

    /**
     * Same contract as {@link Channel#basicPublish(String, String, AMQP.BasicProperties, byte[])}.
     * The properties' headers are copied, never modified in place.
     */
    public void publish(String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body)
            throws IOException {
        AMQP.BasicProperties base = properties == null ? new AMQP.BasicProperties() : properties;
        Map<String, Object> headers = base.getHeaders() == null ? new HashMap<>() : new HashMap<>(base.getHeaders());

        MessageEnvelope envelope = MessageEnvelope.builder()
                .exchange(exchange)
                .routingKey(routingKey)
                .body(body)
                .headers(headers)
                .messageId(base.getMessageId())
                .correlationId(base.getCorrelationId())
                .timestamp(base.getTimestamp() != null ? base.getTimestamp().toInstant() : Instant.now())
                .build();

        interceptor.wrapPublisher(message -> channel.basicPublish(
                message.getExchange(), message.getRoutingKey(), toProperties(base, message), message.getBody()))
                .publish(envelope);
    }

    static AMQP.BasicProperties toProperties(AMQP.BasicProperties base, MessageEnvelope envelope) {
        return base.builder()
                .headers(envelope.getHeaders())
                .messageId(envelope.getMessageId())
                .correlationId(envelope.getCorrelationId())
                .timestamp(envelope.getTimestamp() != null ? Date.from(envelope.getTimestamp()) : null)
                .build();
    }
}
