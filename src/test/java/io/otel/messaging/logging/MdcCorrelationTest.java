package io.otel.messaging.logging;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.context.Context;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MdcCorrelationTest {

    private static final SpanContext OUTER = SpanContext.create(
            "4bf92f3577b34da6a3ce929d0e0e4736", "00f067aa0ba902b7", TraceFlags.getSampled(), TraceState.getDefault());
    private static final SpanContext INNER = SpanContext.create(
            "4bf92f3577b34da6a3ce929d0e0e4736", "1111111111111111", TraceFlags.getSampled(), TraceState.getDefault());

    @AfterEach
    void tearDown() {
        MdcCorrelation.setServiceName(null);
        MDC.clear();
    }

    @Test
    void testScopeSetsAndRestoresMdc() {
        try (MdcCorrelation.MdcScope outer = MdcCorrelation.makeCurrent(Context.root().with(Span.wrap(OUTER)))) {
            assertEquals(OUTER.getSpanId(), MdcCorrelation.getSpanId());

            try (MdcCorrelation.MdcScope inner = MdcCorrelation.makeCurrent(Context.root().with(Span.wrap(INNER)))) {
                assertEquals(INNER.getSpanId(), MdcCorrelation.getSpanId());
                assertEquals(INNER.getSpanId(), Span.current().getSpanContext().getSpanId());
            }

            assertEquals(OUTER.getSpanId(), MdcCorrelation.getSpanId());
            assertEquals("01", MDC.get(MdcCorrelation.TRACE_FLAGS_KEY));
        }

        assertNull(MdcCorrelation.getTraceId());
        assertNull(MdcCorrelation.getSpanId());
        assertFalse(Span.current().getSpanContext().isValid());
    }

    @Test
    void testCorrelationAttributes() {
        MdcCorrelation.setServiceName("order-service");

        assertEquals(Map.of(MdcCorrelation.SERVICE_NAME_KEY, "order-service"), MdcCorrelation.correlationAttributes());

        try (MdcCorrelation.MdcScope scope = MdcCorrelation.makeCurrent(Context.root().with(Span.wrap(OUTER)))) {
            Map<String, String> attributes = MdcCorrelation.correlationAttributes();
            assertEquals(OUTER.getTraceId(), attributes.get(MdcCorrelation.TRACE_ID_KEY));
            assertEquals(OUTER.getSpanId(), attributes.get(MdcCorrelation.SPAN_ID_KEY));
            assertEquals("order-service", attributes.get(MdcCorrelation.SERVICE_NAME_KEY));
        }
    }

    @Test
    void testServiceNameReachesOtherThreads() throws Exception {
        MdcCorrelation.setServiceName("order-service");
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            Map<String, String> attributes = worker.submit(MdcCorrelation::correlationAttributes)
                    .get(5, TimeUnit.SECONDS);
            assertEquals("order-service", attributes.get(MdcCorrelation.SERVICE_NAME_KEY));

            String[] seen = worker.submit(() -> {
                String inside;
                try (MdcCorrelation.MdcScope scope = MdcCorrelation.makeCurrent(Context.root().with(Span.wrap(OUTER)))) {
                    inside = MDC.get(MdcCorrelation.SERVICE_NAME_KEY);
                }
                return new String[] {inside, MDC.get(MdcCorrelation.SERVICE_NAME_KEY)};
            }).get(5, TimeUnit.SECONDS);
            assertEquals("order-service", seen[0]);
            assertNull(seen[1]);
        } finally {
            worker.shutdownNow();
        }
    }

    @Test
    void testInvalidSpanLeavesMdcAlone() {
        MdcCorrelation.updateMdc(SpanContext.getInvalid());
        assertNull(MdcCorrelation.getTraceId());

        MdcCorrelation.updateMdc(OUTER);
        MdcCorrelation.clearMdc();
        assertNull(MdcCorrelation.getTraceId());
    }
}
