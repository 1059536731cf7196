package io.otel.messaging;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.otel.messaging.broker.MessagingInterceptor;
import io.otel.messaging.context.ContextCodec;
import io.otel.messaging.http.HttpTracing;
import io.otel.messaging.metrics.MetricRegistry;
import io.otel.messaging.trace.SpanRecorder;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Tracer and meter backed by in-memory exporters, with helpers to read back what was recorded.
 */
public class InMemoryTelemetry implements AutoCloseable {

    public static final String SERVICE_NAME = "test-service";

    private final InMemorySpanExporter spanExporter = InMemorySpanExporter.create();
    private final InMemoryMetricReader metricReader = InMemoryMetricReader.create();
    private final SdkTracerProvider tracerProvider;
    private final SdkMeterProvider meterProvider;

    public InMemoryTelemetry() {
        this(Sampler.parentBased(Sampler.alwaysOn()));
    }

    public InMemoryTelemetry(Sampler sampler) {
        this.tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .setSampler(sampler)
                .build();
        this.meterProvider = SdkMeterProvider.builder()
                .registerMetricReader(metricReader)
                .build();
    }

    public Tracer tracer() {
        return tracerProvider.get("test");
    }

    public Meter meter() {
        return meterProvider.get("test");
    }

    public SpanRecorder spanRecorder() {
        return new SpanRecorder(tracer(), SERVICE_NAME);
    }

    public MetricRegistry metricRegistry() {
        return new MetricRegistry(meter());
    }

    public MessagingInterceptor messagingInterceptor() {
        return new MessagingInterceptor(spanRecorder(), metricRegistry(), new ContextCodec());
    }

    public HttpTracing httpTracing() {
        return new HttpTracing(spanRecorder(), metricRegistry(), new ContextCodec());
    }

    public List<SpanData> spans() {
        return spanExporter.getFinishedSpanItems();
    }

    public SpanData span(String name) {
        return spans().stream()
                .filter(span -> span.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No span named " + name + " in " + spanNames()));
    }

    public List<String> spanNames() {
        return spans().stream().map(SpanData::getName).collect(Collectors.toList());
    }

    public List<MetricData> metrics() {
        return List.copyOf(metricReader.collectAllMetrics());
    }

    /**
     * Value of a long counter for the given attributes, 0 when never recorded.
     */
    public long counter(String name, Attributes attributes) {
        return findMetric(name)
                .map(metric -> metric.getLongSumData().getPoints().stream()
                        .filter(point -> point.getAttributes().equals(attributes))
                        .mapToLong(LongPointData::getValue)
                        .sum())
                .orElse(0L);
    }

    /**
     * Histogram point for the given attributes, or null when never recorded.
     */
    public HistogramPointData histogram(String name, Attributes attributes) {
        return findMetric(name)
                .flatMap(metric -> metric.getHistogramData().getPoints().stream()
                        .filter(point -> point.getAttributes().equals(attributes))
                        .findFirst())
                .orElse(null);
    }

    /**
     * Number of attribute sets (streams) the metric currently exports, 0 when never recorded.
     */
    public int streams(String name) {
        return findMetric(name).map(metric -> metric.getData().getPoints().size()).orElse(0);
    }

    private Optional<MetricData> findMetric(String name) {
        return metrics().stream().filter(metric -> metric.getName().equals(name)).findFirst();
    }

    public void reset() {
        spanExporter.reset();
    }

    @Override
    public void close() {
        tracerProvider.close();
        meterProvider.close();
    }
}
