package io.otel.messaging.rabbitmq;

import com.rabbitmq.client.Channel;
import io.otel.messaging.retry.TopologyDeclarer;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * {@link TopologyDeclarer} over a RabbitMQ channel. Exchanges and queues are durable.
 */
public class ChannelTopologyDeclarer implements TopologyDeclarer {

    private final Channel channel;

    public ChannelTopologyDeclarer(Channel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public void declareExchange(String exchange, String type) throws IOException {
        channel.exchangeDeclare(exchange, type, true);
    }

    @Override
    public void declareQueue(String queue, Map<String, Object> arguments) throws IOException {
        channel.queueDeclare(queue, true, false, false, arguments);
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
        channel.queueBind(queue, exchange, routingKey);
    }
}
