package io.otel.messaging.context;

import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Encodes a {@link TraceContext} and {@link Baggage} into a flat header carrier and back.
 *
 * Uses the W3C {@code traceparent} and {@code baggage} headers. The carrier can be HTTP
 * headers ({@code Map<String, String>}) or AMQP message headers ({@code Map<String, Object>}).
 *
 * Usage:
 * <pre>
 * Map&lt;String, Object&gt; headers = new HashMap&lt;&gt;();
 * codec.inject(span.getContext(), Baggage.current(), headers);
 *
 * ExtractedContext parent = codec.extract(headers);
 * </pre>
 *
 * Extraction never throws. A missing or malformed {@code traceparent} yields an invalid,
 * unsampled parent.
 */
public class ContextCodec {
    private static final Logger log = LoggerFactory.getLogger(ContextCodec.class);

    public static final String TRACEPARENT_HEADER = "traceparent";
    public static final String BAGGAGE_HEADER = "baggage";

    private static final TextMapSetter<Map<String, ? super String>> SETTER = (carrier, key, value) -> {
        if (carrier != null) {
            carrier.put(key, value);
        }
    };

    private static final TextMapGetter<Map<String, ?>> GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(Map<String, ?> carrier) {
            return carrier.keySet();
        }

        @Override
        public String get(Map<String, ?> carrier, String key) {
            if (carrier == null) {
                return null;
            }
            Object value = carrier.get(key);
            if (value == null) {
                // AMQP and HTTP/1.1 header names are not guaranteed to keep their case
                for (Map.Entry<String, ?> entry : carrier.entrySet()) {
                    if (key.equalsIgnoreCase(entry.getKey())) {
                        value = entry.getValue();
                        break;
                    }
                }
            }
            return asString(value);
        }
    };

    private final TextMapPropagator propagator;

    public ContextCodec() {
        this(TextMapPropagator.composite(
                W3CTraceContextPropagator.getInstance(),
                W3CBaggagePropagator.getInstance()));
    }

    public ContextCodec(TextMapPropagator propagator) {
        this.propagator = propagator;
    }

    /**
     * Write {@code traceparent} (and {@code baggage} when non-empty) into the carrier.
     * Unrelated keys are left alone; existing propagation keys are overwritten.
     */
    public void inject(TraceContext traceContext, Baggage baggage, Map<String, ? super String> carrier) {
        propagator.inject(toOtelContext(traceContext, baggage), carrier, SETTER);
    }

    /**
     * Inject whatever span and baggage are current on this thread.
     */
    public void injectCurrent(Map<String, ? super String> carrier) {
        propagator.inject(Context.current(), carrier, SETTER);
    }

    /**
     * Read the remote context from a carrier. Degrades to {@link ExtractedContext#empty()}.
     */
    public ExtractedContext extract(Map<String, ?> carrier) {
        if (carrier == null || carrier.isEmpty()) {
            return ExtractedContext.empty();
        }
        try {
            Context extracted = propagator.extract(Context.root(), carrier, GETTER);
            SpanContext spanContext = Span.fromContext(extracted).getSpanContext();
            Baggage baggage = Baggage.fromContext(extracted);
            if (!spanContext.isValid() && carrier.containsKey(TRACEPARENT_HEADER)) {
                log.debug("Ignoring malformed traceparent: {}", carrier.get(TRACEPARENT_HEADER));
            }
            return new ExtractedContext(TraceContext.fromSpanContext(spanContext), baggage);
        } catch (RuntimeException e) {
            log.debug("Failed to extract trace context from carrier {}", carrier.keySet(), e);
            return ExtractedContext.empty();
        }
    }

    /**
     * Build an OpenTelemetry parent context from an extracted one.
     */
    public Context toOtelContext(ExtractedContext extracted) {
        return toOtelContext(extracted.getTraceContext(), extracted.getBaggage());
    }

    private static Context toOtelContext(TraceContext traceContext, Baggage baggage) {
        Context context = Context.root();
        if (traceContext != null && traceContext.isValid()) {
            context = context.with(Span.wrap(traceContext.toSpanContext()));
        }
        if (baggage != null) {
            context = context.with(baggage);
        }
        return context;
    }

    static String asString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return value.toString();
    }
}
