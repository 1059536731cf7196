package io.otel.messaging.broker;

import java.io.IOException;

/**
 * The real publish operation of a broker client.
 */
@FunctionalInterface
public interface Publisher {
    void publish(MessageEnvelope envelope) throws IOException;
}
