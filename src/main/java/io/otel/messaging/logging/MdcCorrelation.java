package io.otel.messaging.logging;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;

/**
 * Keeps SLF4J MDC in step with the current OpenTelemetry span so log lines carry the trace.
 *
 * MDC keys populated:
 * - trace_id: The W3C trace ID
 * - span_id: The current span ID
 * - trace_flags: The trace flags (sampled, etc.)
 * - service.name: The service name, on every thread that enters a scope
 *
 * Usage in logback.xml:
 * <pre>
 * &lt;pattern&gt;%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - trace_id=%X{trace_id} span_id=%X{span_id} - %msg%n&lt;/pattern&gt;
 * </pre>
 */
public class MdcCorrelation {

    public static final String TRACE_ID_KEY = "trace_id";
    public static final String SPAN_ID_KEY = "span_id";
    public static final String TRACE_FLAGS_KEY = "trace_flags";
    public static final String SERVICE_NAME_KEY = "service.name";

    private static volatile String serviceName;

    private MdcCorrelation() {
        // Utility class
    }

    /**
     * Update MDC with the span context of the current span, if any
     */
    public static void updateMdc() {
        updateMdc(Span.current().getSpanContext());
    }

    public static void updateMdc(SpanContext spanContext) {
        if (spanContext != null && spanContext.isValid()) {
            MDC.put(TRACE_ID_KEY, spanContext.getTraceId());
            MDC.put(SPAN_ID_KEY, spanContext.getSpanId());
            MDC.put(TRACE_FLAGS_KEY, spanContext.getTraceFlags().asHex());
        }
    }

    /**
     * Set the process-wide service name. MDC is per thread, so the name is also held here
     * and copied into MDC by every {@link MdcScope}.
     */
    public static void setServiceName(String name) {
        serviceName = name;
        if (name != null) {
            MDC.put(SERVICE_NAME_KEY, name);
        } else {
            MDC.remove(SERVICE_NAME_KEY);
        }
    }

    public static String getServiceName() {
        return serviceName;
    }

    public static void clearMdc() {
        MDC.remove(TRACE_ID_KEY);
        MDC.remove(SPAN_ID_KEY);
        MDC.remove(TRACE_FLAGS_KEY);
    }

    /**
     * Trace identifiers of the current span, as attributes for a log record or metric
     * exemplar. Empty when no valid span is current.
     */
    public static Map<String, String> correlationAttributes() {
        Map<String, String> attributes = new HashMap<>();
        SpanContext spanContext = Span.current().getSpanContext();
        if (spanContext.isValid()) {
            attributes.put(TRACE_ID_KEY, spanContext.getTraceId());
            attributes.put(SPAN_ID_KEY, spanContext.getSpanId());
            attributes.put(TRACE_FLAGS_KEY, spanContext.getTraceFlags().asHex());
        }
        String name = serviceName;
        if (name != null) {
            attributes.put(SERVICE_NAME_KEY, name);
        }
        return attributes;
    }

    /**
     * Make the given context current and mirror it into MDC.
     * Use with try-with-resources so both are restored.
     */
    public static MdcScope makeCurrent(Context otelContext) {
        return new MdcScope(otelContext);
    }

    /**
     * A scope that manages both OpenTelemetry context and MDC together
     */
    public static class MdcScope implements AutoCloseable {
        private final Scope otelScope;
        private final String previousTraceId;
        private final String previousSpanId;
        private final String previousTraceFlags;
        private final String previousServiceName;

        MdcScope(Context otelContext) {
            this.previousTraceId = MDC.get(TRACE_ID_KEY);
            this.previousSpanId = MDC.get(SPAN_ID_KEY);
            this.previousTraceFlags = MDC.get(TRACE_FLAGS_KEY);
            this.previousServiceName = MDC.get(SERVICE_NAME_KEY);

            this.otelScope = otelContext.makeCurrent();

            updateMdc();
            String name = serviceName;
            if (name != null) {
                MDC.put(SERVICE_NAME_KEY, name);
            }
        }

        @Override
        public void close() {
            restoreOrRemove(TRACE_ID_KEY, previousTraceId);
            restoreOrRemove(SPAN_ID_KEY, previousSpanId);
            restoreOrRemove(TRACE_FLAGS_KEY, previousTraceFlags);
            restoreOrRemove(SERVICE_NAME_KEY, previousServiceName);

            otelScope.close();
        }

        private void restoreOrRemove(String key, String value) {
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        }
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID_KEY);
    }

    public static String getSpanId() {
        return MDC.get(SPAN_ID_KEY);
    }
}
