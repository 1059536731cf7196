package io.otel.messaging.broker;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Broker-neutral view of one message on its way out or in.
 *
 * The headers map is the propagation carrier and is mutable: the publish path writes
 * {@code traceparent}/{@code baggage} into it. Redelivery markers placed by the broker
 * are only ever read.
 */
public class MessageEnvelope {

    private final String exchange;
    private final String routingKey;
    private final byte[] body;
    private final Map<String, Object> headers;
    private String messageId;
    private String correlationId;
    private Instant timestamp;

    private MessageEnvelope(Builder builder) {
        this.exchange = builder.exchange == null ? "" : builder.exchange;
        this.routingKey = Objects.requireNonNull(builder.routingKey, "routingKey");
        this.body = builder.body == null ? new byte[0] : builder.body;
        this.headers = builder.headers == null ? new HashMap<>() : builder.headers;
        this.messageId = builder.messageId;
        this.correlationId = builder.correlationId;
        this.timestamp = builder.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getExchange() { return exchange; }

    public String getRoutingKey() { return routingKey; }

    public byte[] getBody() { return body; }

    /**
     * Body length in bytes.
     */
    public int size() { return body.length; }

    public Map<String, Object> getHeaders() { return headers; }

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getCorrelationId() { return correlationId; }
    public void setCorrelationId(String correlationId) { this.correlationId = correlationId; }

    public Instant getTimestamp() { return timestamp; }
    public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }

    @Override
    public String toString() {
        return "MessageEnvelope{exchange='" + exchange + "', routingKey='" + routingKey
                + "', size=" + body.length + ", messageId=" + messageId + ", correlationId=" + correlationId + '}';
    }

    public static class Builder {
        private String exchange;
        private String routingKey;
        private byte[] body;
        private Map<String, Object> headers;
        private String messageId;
        private String correlationId;
        private Instant timestamp;

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        /**
         * Headers are used as given (not copied) so that propagation keys land in the
         * caller's map. A null map is replaced by a fresh one.
         */
        public Builder headers(Map<String, Object> headers) {
            this.headers = headers;
            return this;
        }

        public Builder header(String key, Object value) {
            if (this.headers == null) {
                this.headers = new HashMap<>();
            }
            this.headers.put(key, value);
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MessageEnvelope build() {
            return new MessageEnvelope(this);
        }
    }
}
