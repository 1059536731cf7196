package io.otel.messaging.retry;

import io.otel.messaging.broker.RedeliveryDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative retry/dead-letter setup for one queue.
 *
 * The broker does the actual work: a rejected message is dead-lettered into a delay queue,
 * waits out the TTL there, and is dead-lettered back to the primary queue. Nothing here
 * runs a timer or counts attempts in memory; {@link #isExhausted(Map)} only reads the
 * broker's {@code x-death} history.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.forQueue("orders")
 *     .maxRetries(3)
 *     .delay(Duration.ofSeconds(30))
 *     .build();
 * policy.declare(new ChannelTopologyDeclarer(channel));
 * </pre>
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final String MESSAGE_TTL = "x-message-ttl";
    public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    public static final String DEFAULT_EXCHANGE = "";

    private final RetryTopology topology;

    private RetryPolicy(RetryTopology topology) {
        this.topology = topology;
    }

    public static Builder forQueue(String queue) {
        return new Builder(queue);
    }

    /**
     * Declare the dead-letter exchange, delay queue, parking queue and the primary queue.
     */
    public RetryTopology declare(TopologyDeclarer declarer) throws IOException {
        Objects.requireNonNull(declarer, "declarer");
        String primary = topology.getPrimaryQueue();
        String dlx = topology.getDeadLetterExchange();

        declarer.declareExchange(dlx, "direct");

        declarer.declareQueue(topology.getDelayQueue(), delayQueueArguments());
        declarer.bindQueue(topology.getDelayQueue(), dlx, primary);

        declarer.declareQueue(topology.getParkingQueue(), new HashMap<>());
        declarer.bindQueue(topology.getParkingQueue(), dlx, topology.getParkingQueue());

        declarer.declareQueue(primary, primaryQueueArguments());

        log.info("Declared retry topology {}", topology);
        return topology;
    }

    /**
     * Arguments for the delay queue: hold for the backoff, then route back to the primary queue.
     */
    public Map<String, Object> delayQueueArguments() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put(MESSAGE_TTL, topology.getDelayMs());
        arguments.put(DEAD_LETTER_EXCHANGE, DEFAULT_EXCHANGE);
        arguments.put(DEAD_LETTER_ROUTING_KEY, topology.getPrimaryQueue());
        return arguments;
    }

    /**
     * Arguments for the primary queue: rejected messages go to the dead-letter exchange.
     */
    public Map<String, Object> primaryQueueArguments() {
        Map<String, Object> arguments = new HashMap<>();
        arguments.put(DEAD_LETTER_EXCHANGE, topology.getDeadLetterExchange());
        arguments.put(DEAD_LETTER_ROUTING_KEY, topology.getPrimaryQueue());
        return arguments;
    }

    /**
     * True once the message has already been retried {@code maxRetries} times, i.e. a
     * further failure should park it instead of sending it round the delay loop again.
     */
    public boolean isExhausted(Map<String, ?> headers) {
        return RedeliveryDetector.deathCount(headers, topology.getPrimaryQueue()) >= topology.getMaxAttempts();
    }

    public RetryTopology getTopology() {
        return topology;
    }

    public static class Builder {
        private final String queue;
        private int maxRetries = 3;
        private Duration delay = Duration.ofSeconds(30);

        private Builder(String queue) {
            this.queue = Objects.requireNonNull(queue, "queue");
            if (queue.isEmpty()) {
                throw new IllegalArgumentException("queue must not be empty");
            }
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 1) {
                throw new IllegalArgumentException("maxRetries must be >= 1, got " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder delay(Duration delay) {
            if (delay == null || delay.isNegative() || delay.isZero()) {
                throw new IllegalArgumentException("delay must be positive");
            }
            this.delay = delay;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(new RetryTopology(queue, delay.toMillis(), maxRetries));
        }
    }
}
