package io.otel.messaging.broker;

/**
 * User-supplied processing of one delivered message. Throwing signals failure to the
 * broker's delivery loop, which decides between redelivery and dead-lettering.
 */
@FunctionalInterface
public interface MessageHandler {
    void handle(MessageEnvelope envelope) throws Exception;
}
