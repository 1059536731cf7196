package io.otel.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import io.otel.messaging.broker.MessageEnvelope;
import io.otel.messaging.broker.MessageHandler;
import io.otel.messaging.broker.MessagingInterceptor;
import io.otel.messaging.retry.RetryPolicy;
import io.otel.messaging.retry.RetryTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * RabbitMQ consumer that runs each delivery through an instrumented {@link MessageHandler}
 * and settles it with the broker.
 *
 * Success acks the delivery. Failure rejects it without requeue, so the queue's
 * dead-letter settings take over (see {@link RetryPolicy}). Once the policy reports the
 * retries as exhausted, the message is published to the parking queue and acked instead.
 *
 * Usage:
 * <pre>
 * TracingConsumer consumer = new TracingConsumer(channel, "orders", interceptor, orders::process, policy);
 * consumer.start();
 * </pre>
 */
public class TracingConsumer extends DefaultConsumer {
    private static final Logger log = LoggerFactory.getLogger(TracingConsumer.class);

    private final String queue;
    private final MessageHandler handler;
    private final RetryPolicy retryPolicy;

    public TracingConsumer(Channel channel, String queue, MessagingInterceptor interceptor,
                           MessageHandler handler, RetryPolicy retryPolicy) {
        super(channel);
        this.queue = Objects.requireNonNull(queue, "queue");
        this.handler = interceptor.wrapHandler(queue, handler);
        this.retryPolicy = retryPolicy;
    }

    public TracingConsumer(Channel channel, String queue, MessagingInterceptor interceptor, MessageHandler handler) {
        this(channel, queue, interceptor, handler, null);
    }

    /**
     * Register with manual acknowledgement. Returns the consumer tag.
     */
    public String start() throws IOException {
        return getChannel().basicConsume(queue, false, this);
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body)
            throws IOException {
        MessageEnvelope message = toMessage(envelope, properties, body);
        long deliveryTag = envelope.getDeliveryTag();
        try {
            handler.handle(message);
        } catch (Exception e) {
            settleFailure(deliveryTag, message, properties, e);
            return;
        }
        getChannel().basicAck(deliveryTag, false);
    }

    private void settleFailure(long deliveryTag, MessageEnvelope message, AMQP.BasicProperties properties, Exception e)
            throws IOException {
        if (retryPolicy != null && retryPolicy.isExhausted(message.getHeaders())) {
            RetryTopology topology = retryPolicy.getTopology();
            log.warn("Message {} from {} exhausted {} retries, parking in {}",
                    message.getMessageId(), queue, topology.getMaxAttempts(), topology.getParkingQueue(), e);
            getChannel().basicPublish(topology.getDeadLetterExchange(), topology.getParkingQueue(), properties, message.getBody());
            getChannel().basicAck(deliveryTag, false);
        } else {
            log.warn("Processing of message {} from {} failed, rejecting for dead-lettering",
                    message.getMessageId(), queue, e);
            getChannel().basicReject(deliveryTag, false);
        }
    }

    static MessageEnvelope toMessage(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        AMQP.BasicProperties props = properties == null ? new AMQP.BasicProperties() : properties;
        Map<String, Object> headers = props.getHeaders() == null ? new HashMap<>() : new HashMap<>(props.getHeaders());
        return MessageEnvelope.builder()
                .exchange(envelope.getExchange())
                .routingKey(envelope.getRoutingKey())
                .body(body)
                .headers(headers)
                .messageId(props.getMessageId())
                .correlationId(props.getCorrelationId())
                .timestamp(props.getTimestamp() != null ? props.getTimestamp().toInstant() : null)
                .build();
    }

    public String getQueue() {
        return queue;
    }
}
