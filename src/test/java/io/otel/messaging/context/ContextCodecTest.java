package io.otel.messaging.context;

import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextCodecTest {

    private static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";
    private static final String SPAN_ID = "00f067aa0ba902b7";

    private final ContextCodec codec = new ContextCodec();

    @Test
    void testInjectThenExtractRoundTrip() {
        TraceContext context = TraceContext.of(TRACE_ID, SPAN_ID, true);
        Baggage baggage = Baggage.builder().put("tenant", "acme").build();
        Map<String, Object> headers = new HashMap<>();

        codec.inject(context, baggage, headers);

        assertEquals("00-" + TRACE_ID + "-" + SPAN_ID + "-01", headers.get(ContextCodec.TRACEPARENT_HEADER));
        ExtractedContext extracted = codec.extract(headers);
        assertTrue(extracted.hasParent());
        assertEquals(context, extracted.getTraceContext());
        assertEquals("acme", extracted.getBaggage().getEntryValue("tenant"));
    }

    @Test
    void testUnsampledFlagSurvivesRoundTrip() {
        Map<String, String> headers = new HashMap<>();
        codec.inject(TraceContext.of(TRACE_ID, SPAN_ID, false), Baggage.empty(), headers);

        assertTrue(headers.get(ContextCodec.TRACEPARENT_HEADER).endsWith("-00"));
        assertFalse(headers.containsKey(ContextCodec.BAGGAGE_HEADER));
        assertFalse(codec.extract(headers).getTraceContext().isSampled());
    }

    @Test
    void testExtractFromEmptyCarrier() {
        ExtractedContext extracted = codec.extract(new HashMap<>());

        assertFalse(extracted.hasParent());
        assertFalse(extracted.getTraceContext().isSampled());
        assertTrue(extracted.getBaggage().isEmpty());
    }

    @Test
    void testExtractFromNullCarrier() {
        ExtractedContext extracted = codec.extract(null);

        assertFalse(extracted.hasParent());
        assertTrue(extracted.getBaggage().isEmpty());
    }

    @Test
    void testMalformedTraceparentDegradesToNoParent() {
        Map<String, Object> headers = new HashMap<>();
        headers.put(ContextCodec.TRACEPARENT_HEADER, "not-a-traceparent");

        ExtractedContext extracted = codec.extract(headers);

        assertFalse(extracted.hasParent());
        assertFalse(extracted.getTraceContext().isValid());
    }

    @Test
    void testAllZeroTraceIdIsRejected() {
        Map<String, Object> headers = new HashMap<>();
        headers.put(ContextCodec.TRACEPARENT_HEADER, "00-00000000000000000000000000000000-" + SPAN_ID + "-01");

        assertFalse(codec.extract(headers).hasParent());
    }

    @Test
    void testBaggageKeptWithoutTraceparent() {
        Map<String, Object> headers = new HashMap<>();
        headers.put(ContextCodec.BAGGAGE_HEADER, "user_id=42");

        ExtractedContext extracted = codec.extract(headers);

        assertFalse(extracted.hasParent());
        assertEquals("42", extracted.getBaggage().getEntryValue("user_id"));
    }

    @Test
    void testInjectOverwritesAndKeepsUnrelatedKeys() {
        Map<String, Object> headers = new HashMap<>();
        headers.put("content-type", "application/json");

        codec.inject(TraceContext.of(TRACE_ID, SPAN_ID, true), Baggage.empty(), headers);
        codec.inject(TraceContext.of(TRACE_ID, "1111111111111111", true), Baggage.empty(), headers);

        assertEquals("application/json", headers.get("content-type"));
        assertEquals("00-" + TRACE_ID + "-1111111111111111-01", headers.get(ContextCodec.TRACEPARENT_HEADER));
        assertEquals(2, headers.size());
    }

    @Test
    void testInvalidContextWritesNoTraceparent() {
        Map<String, Object> headers = new HashMap<>();

        codec.inject(TraceContext.invalid(), Baggage.empty(), headers);

        assertFalse(headers.containsKey(ContextCodec.TRACEPARENT_HEADER));
    }

    @Test
    void testExtractBinaryAndMixedCaseHeaders() {
        // AMQP clients may hand header values back as bytes and header names in any case
        Map<String, Object> headers = new HashMap<>();
        headers.put("TraceParent", ("00-" + TRACE_ID + "-" + SPAN_ID + "-01").getBytes(StandardCharsets.UTF_8));

        ExtractedContext extracted = codec.extract(headers);

        assertTrue(extracted.hasParent());
        assertEquals(TRACE_ID, extracted.getTraceContext().getTraceId());
        assertEquals(SPAN_ID, extracted.getTraceContext().getSpanId());
    }

    @Test
    void testInjectCurrentUsesActiveSpan() {
        TraceContext active = TraceContext.of(TRACE_ID, SPAN_ID, true);
        Map<String, String> headers = new HashMap<>();

        try (var scope = Context.root().with(Span.wrap(active.toSpanContext())).makeCurrent()) {
            codec.injectCurrent(headers);
        }

        assertEquals(active, codec.extract(headers).getTraceContext());
    }

    @Test
    void testToOtelContextCarriesParentAndBaggage() {
        ExtractedContext extracted = new ExtractedContext(
                TraceContext.of(TRACE_ID, SPAN_ID, true),
                Baggage.builder().put("region", "eu").build());

        Context context = codec.toOtelContext(extracted);

        assertEquals(TRACE_ID, Span.fromContext(context).getSpanContext().getTraceId());
        assertTrue(Span.fromContext(context).getSpanContext().isRemote());
        assertEquals("eu", Baggage.fromContext(context).getEntryValue("region"));
    }
}
