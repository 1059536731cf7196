package io.otel.messaging.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.otel.messaging.InMemoryTelemetry;
import io.otel.messaging.context.ContextCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TracingChannelPublisherTest {

    private static final byte[] BODY = "{\"id\":1}".getBytes(StandardCharsets.UTF_8);

    private final InMemoryTelemetry telemetry = new InMemoryTelemetry();
    private final Channel channel = mock(Channel.class);
    private final TracingChannelPublisher publisher =
            new TracingChannelPublisher(channel, telemetry.messagingInterceptor());

    @AfterEach
    void tearDown() {
        telemetry.close();
    }

    @Test
    void testPublishAddsTraceHeadersToCopy() throws Exception {
        Map<String, Object> original = new HashMap<>();
        original.put("tenant", "acme");
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType("application/json")
                .headers(original)
                .build();

        publisher.publish("", "orders", properties, BODY);

        ArgumentCaptor<AMQP.BasicProperties> sent = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq(""), eq("orders"), sent.capture(), same(BODY));
        AMQP.BasicProperties published = sent.getValue();
        SpanData span = telemetry.span("publish orders");

        assertEquals("application/json", published.getContentType());
        assertEquals("acme", published.getHeaders().get("tenant"));
        assertEquals(span.getTraceId(),
                new ContextCodec().extract(published.getHeaders()).getTraceContext().getTraceId());
        assertEquals(span.getSpanId(), published.getCorrelationId());
        assertNotNull(published.getTimestamp());
        assertFalse(original.containsKey(ContextCodec.TRACEPARENT_HEADER));
    }

    @Test
    void testPublishWithoutProperties() throws Exception {
        publisher.publish("events", "orders.created", null, BODY);

        ArgumentCaptor<AMQP.BasicProperties> sent = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq("events"), eq("orders.created"), sent.capture(), same(BODY));
        assertTrue(sent.getValue().getHeaders().containsKey(ContextCodec.TRACEPARENT_HEADER));
    }

    @Test
    void testChannelFailureIsRethrown() throws Exception {
        IOException failure = new IOException("channel closed");
        doThrow(failure).when(channel).basicPublish(anyString(), anyString(), any(), any());

        IOException thrown = assertThrows(IOException.class, () -> publisher.publish("", "orders", null, BODY));

        assertSame(failure, thrown);
        assertEquals(StatusCode.ERROR, telemetry.span("publish orders").getStatus().getStatusCode());
    }
}
