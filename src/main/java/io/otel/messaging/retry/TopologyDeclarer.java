package io.otel.messaging.retry;

import java.io.IOException;
import java.util.Map;

/**
 * The broker operations needed to lay out a retry topology. All declarations are
 * idempotent on the broker side.
 */
public interface TopologyDeclarer {

    void declareExchange(String exchange, String type) throws IOException;

    void declareQueue(String queue, Map<String, Object> arguments) throws IOException;

    void bindQueue(String queue, String exchange, String routingKey) throws IOException;
}
