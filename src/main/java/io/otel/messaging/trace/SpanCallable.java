package io.otel.messaging.trace;

/**
 * Work executed inside a span. Receives the open span so it can add attributes or events.
 */
@FunctionalInterface
public interface SpanCallable<T> {
    T call(RecordedSpan span) throws Exception;
}
