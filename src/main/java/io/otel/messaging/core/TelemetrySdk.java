package io.otel.messaging.core;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.exporter.otlp.http.logs.OtlpHttpLogRecordExporter;
import io.opentelemetry.exporter.otlp.http.metrics.OtlpHttpMetricExporter;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.logs.OtlpGrpcLogRecordExporter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.instrumentation.logback.appender.v1_0.OpenTelemetryAppender;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.OpenTelemetrySdkBuilder;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.logs.SdkLoggerProvider;
import io.opentelemetry.sdk.logs.export.BatchLogRecordProcessor;
import io.opentelemetry.sdk.logs.export.LogRecordExporter;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricExporter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.opentelemetry.semconv.ResourceAttributes;
import io.otel.messaging.broker.MessagingInterceptor;
import io.otel.messaging.context.ContextCodec;
import io.otel.messaging.http.HttpTracing;
import io.otel.messaging.logging.MdcCorrelation;
import io.otel.messaging.metrics.MetricRegistry;
import io.otel.messaging.operators.RxContextPropagation;
import io.otel.messaging.trace.RetryingSpanExporter;
import io.otel.messaging.trace.SpanRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the tracer, meter and logger providers of a service and hands the same providers
 * to every messaging and HTTP component.
 *
 * Usage:
 * <pre>
 * TelemetrySdk sdk = TelemetrySdk.builder()
 *     .serviceName("order-service")
 *     .otlpEndpoint("http://localhost:4318")
 *     .build();
 *
 * Publisher publisher = sdk.messagingInterceptor().wrapPublisher(rawPublisher);
 * ...
 * sdk.close();
 * </pre>
 *
 * Unset builder options fall back to the usual {@code OTEL_*} environment variables.
 */
public class TelemetrySdk implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(TelemetrySdk.class);

    private static final String INSTRUMENTATION_NAME = "io.otel.messaging";

    private final String serviceName;
    private final OpenTelemetrySdk openTelemetry;
    private final SdkTracerProvider tracerProvider;
    private final SdkMeterProvider meterProvider;
    private final SdkLoggerProvider loggerProvider;
    private final RetryingSpanExporter retryingExporter;
    private final Tracer tracer;
    private final Meter meter;

    private final SpanRecorder spanRecorder;
    private final MetricRegistry metricRegistry;
    private final ContextCodec contextCodec;
    private final MessagingInterceptor messagingInterceptor;
    private final HttpTracing httpTracing;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private TelemetrySdk(Builder builder) {
        this.serviceName = builder.serviceName;

        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.builder()
                        .put(ResourceAttributes.SERVICE_NAME, builder.serviceName)
                        .put(ResourceAttributes.SERVICE_VERSION, builder.serviceVersion)
                        .put(ResourceAttributes.DEPLOYMENT_ENVIRONMENT, builder.environment)
                        .build()));

        // Metrics first so the exporter's drop counter has somewhere to go
        MetricReader metricReader = builder.metricReader != null
                ? builder.metricReader
                : PeriodicMetricReader.builder(buildMetricExporter(builder))
                        .setInterval(builder.metricExportInterval)
                        .build();
        this.meterProvider = SdkMeterProvider.builder()
                .registerMetricReader(metricReader)
                .setResource(resource)
                .build();

        SpanExporter spanExporter = builder.spanExporter != null ? builder.spanExporter : buildSpanExporter(builder);
        this.retryingExporter = new RetryingSpanExporter(spanExporter,
                builder.exportRetryAttempts, builder.exportRetryBackoff);
        this.retryingExporter.bindMeter(meterProvider.get(INSTRUMENTATION_NAME));

        this.tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(retryingExporter)
                        .setMaxQueueSize(builder.maxQueueSize)
                        .setMaxExportBatchSize(builder.maxExportBatchSize)
                        .setScheduleDelay(builder.scheduleDelay)
                        .build())
                .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(builder.samplerRatio)))
                .setResource(resource)
                .build();

        LogRecordExporter logExporter = builder.logRecordExporter != null
                ? builder.logRecordExporter
                : buildLogExporter(builder);
        this.loggerProvider = SdkLoggerProvider.builder()
                .addLogRecordProcessor(BatchLogRecordProcessor.builder(logExporter).build())
                .setResource(resource)
                .build();

        OpenTelemetrySdkBuilder sdkBuilder = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setMeterProvider(meterProvider)
                .setLoggerProvider(loggerProvider)
                .setPropagators(ContextPropagators.create(TextMapPropagator.composite(
                        W3CTraceContextPropagator.getInstance(),
                        W3CBaggagePropagator.getInstance())));
        this.openTelemetry = builder.registerGlobal ? sdkBuilder.buildAndRegisterGlobal() : sdkBuilder.build();

        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.meter = openTelemetry.getMeter(INSTRUMENTATION_NAME);

        this.spanRecorder = new SpanRecorder(tracer, serviceName);
        this.metricRegistry = new MetricRegistry(meter);
        this.contextCodec = new ContextCodec(openTelemetry.getPropagators().getTextMapPropagator());
        this.messagingInterceptor = new MessagingInterceptor(spanRecorder, metricRegistry, contextCodec);
        this.httpTracing = new HttpTracing(spanRecorder, metricRegistry, contextCodec);

        MdcCorrelation.setServiceName(serviceName);

        if (builder.installLogbackAppender) {
            OpenTelemetryAppender.install(openTelemetry);
        }
        if (builder.enableRxContextPropagation) {
            RxContextPropagation.enable();
        }
        if (builder.shutdownHook) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::close, "telemetry-shutdown"));
        }

        log.info("TelemetrySdk initialized for service: {}, environment: {}, endpoint: {}",
                builder.serviceName, builder.environment, builder.otlpEndpoint);
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public Tracer getTracer() {
        return tracer;
    }

    public Meter getMeter() {
        return meter;
    }

    public String getServiceName() {
        return serviceName;
    }

    public SpanRecorder spanRecorder() {
        return spanRecorder;
    }

    public MetricRegistry metricRegistry() {
        return metricRegistry;
    }

    public ContextCodec contextCodec() {
        return contextCodec;
    }

    public MessagingInterceptor messagingInterceptor() {
        return messagingInterceptor;
    }

    public HttpTracing httpTracing() {
        return httpTracing;
    }

    public RetryingSpanExporter getRetryingExporter() {
        return retryingExporter;
    }

    /**
     * Push buffered spans, metrics and log records to their exporters and wait up to 10 seconds.
     */
    public CompletableResultCode forceFlush() {
        return CompletableResultCode.ofAll(Arrays.asList(
                tracerProvider.forceFlush(),
                meterProvider.forceFlush(),
                loggerProvider.forceFlush()))
                .join(10, TimeUnit.SECONDS);
    }

    /**
     * Flush and shut down every provider. Calling it again does nothing.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down OpenTelemetry SDK");
        // Tracer provider shutdown also shuts down the retrying exporter and its scheduler
        tracerProvider.close();
        meterProvider.close();
        loggerProvider.close();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private static SpanExporter buildSpanExporter(Builder builder) {
        if (builder.useGrpc) {
            var grpcBuilder = OtlpGrpcSpanExporter.builder()
                    .setEndpoint(builder.otlpEndpoint);
            parseHeaders(builder.headers).forEach(grpcBuilder::addHeader);
            return grpcBuilder.build();
        }
        var httpBuilder = OtlpHttpSpanExporter.builder()
                .setEndpoint(signalEndpoint(builder.otlpEndpoint, "/v1/traces"));
        parseHeaders(builder.headers).forEach(httpBuilder::addHeader);
        return httpBuilder.build();
    }

    private static MetricExporter buildMetricExporter(Builder builder) {
        if (builder.useGrpc) {
            var grpcBuilder = OtlpGrpcMetricExporter.builder()
                    .setEndpoint(builder.otlpEndpoint);
            parseHeaders(builder.headers).forEach(grpcBuilder::addHeader);
            return grpcBuilder.build();
        }
        var httpBuilder = OtlpHttpMetricExporter.builder()
                .setEndpoint(signalEndpoint(builder.otlpEndpoint, "/v1/metrics"));
        parseHeaders(builder.headers).forEach(httpBuilder::addHeader);
        return httpBuilder.build();
    }

    private static LogRecordExporter buildLogExporter(Builder builder) {
        if (builder.useGrpc) {
            var grpcBuilder = OtlpGrpcLogRecordExporter.builder()
                    .setEndpoint(builder.otlpEndpoint);
            parseHeaders(builder.headers).forEach(grpcBuilder::addHeader);
            return grpcBuilder.build();
        }
        var httpBuilder = OtlpHttpLogRecordExporter.builder()
                .setEndpoint(signalEndpoint(builder.otlpEndpoint, "/v1/logs"));
        parseHeaders(builder.headers).forEach(httpBuilder::addHeader);
        return httpBuilder.build();
    }

    static String signalEndpoint(String base, String path) {
        if (base.endsWith(path)) {
            return base;
        }
        return base.endsWith("/") ? base.substring(0, base.length() - 1) + path : base + path;
    }

    static Map<String, String> parseHeaders(String headers) {
        Map<String, String> result = new HashMap<>();
        if (headers != null && !headers.isEmpty()) {
            for (String header : headers.split(",")) {
                String[] parts = header.split("=", 2);
                if (parts.length == 2) {
                    result.put(parts[0].trim(), parts[1].trim());
                }
            }
        }
        return result;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for TelemetrySdk configuration
     */
    public static class Builder {
        private String serviceName = env("OTEL_SERVICE_NAME", "unknown-service");
        private String serviceVersion = env("OTEL_SERVICE_VERSION", "1.0.0");
        private String environment = env("DEPLOYMENT_ENV", "development");
        private String otlpEndpoint = env("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4318");
        private String headers = env("OTEL_EXPORTER_OTLP_HEADERS", "");
        private boolean useGrpc = "grpc".equals(env("OTEL_EXPORTER_OTLP_PROTOCOL", "http"));
        private double samplerRatio = clampRatio(parseDouble(env("OTEL_TRACES_SAMPLER_ARG", "1.0"), 1.0));
        private int maxQueueSize = (int) parseLong(env("OTEL_BSP_MAX_QUEUE_SIZE", "2048"), 2048);
        private int maxExportBatchSize = (int) parseLong(env("OTEL_BSP_MAX_EXPORT_BATCH_SIZE", "512"), 512);
        private Duration scheduleDelay = Duration.ofMillis(parseLong(env("OTEL_BSP_SCHEDULE_DELAY", "5000"), 5000));
        private Duration metricExportInterval =
                Duration.ofMillis(parseLong(env("OTEL_METRIC_EXPORT_INTERVAL", "60000"), 60000));
        private int exportRetryAttempts = 3;
        private Duration exportRetryBackoff = Duration.ofSeconds(1);
        private SpanExporter spanExporter;
        private MetricReader metricReader;
        private LogRecordExporter logRecordExporter;
        private boolean registerGlobal = false;
        private boolean enableRxContextPropagation = true;
        private boolean installLogbackAppender = true;
        private boolean shutdownHook = false;

        private static String env(String key, String defaultValue) {
            String value = System.getenv(key);
            return (value != null && !value.isEmpty()) ? value : defaultValue;
        }

        private static long parseLong(String value, long defaultValue) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid numeric setting '{}', using {}", value, defaultValue);
                return defaultValue;
            }
        }

        private static double parseDouble(String value, double defaultValue) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring invalid sampler ratio '{}', using {}", value, defaultValue);
                return defaultValue;
            }
        }

        private static double clampRatio(double ratio) {
            if (Double.isNaN(ratio)) {
                return 1.0;
            }
            return Math.max(0.0, Math.min(1.0, ratio));
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder serviceVersion(String serviceVersion) {
            this.serviceVersion = serviceVersion;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder otlpEndpoint(String otlpEndpoint) {
            this.otlpEndpoint = otlpEndpoint;
            return this;
        }

        public Builder headers(String headers) {
            this.headers = headers;
            return this;
        }

        public Builder useGrpc(boolean useGrpc) {
            this.useGrpc = useGrpc;
            return this;
        }

        /**
         * Fraction of new root traces to sample, clamped to [0, 1]. Children follow their parent.
         */
        public Builder samplerRatio(double samplerRatio) {
            this.samplerRatio = clampRatio(samplerRatio);
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = maxQueueSize;
            return this;
        }

        public Builder maxExportBatchSize(int maxExportBatchSize) {
            this.maxExportBatchSize = maxExportBatchSize;
            return this;
        }

        public Builder scheduleDelay(Duration scheduleDelay) {
            this.scheduleDelay = scheduleDelay;
            return this;
        }

        public Builder metricExportInterval(Duration metricExportInterval) {
            this.metricExportInterval = metricExportInterval;
            return this;
        }

        public Builder exportRetryAttempts(int exportRetryAttempts) {
            this.exportRetryAttempts = exportRetryAttempts;
            return this;
        }

        public Builder exportRetryBackoff(Duration exportRetryBackoff) {
            this.exportRetryBackoff = exportRetryBackoff;
            return this;
        }

        /**
         * Export spans here instead of OTLP.
         */
        public Builder spanExporter(SpanExporter spanExporter) {
            this.spanExporter = spanExporter;
            return this;
        }

        /**
         * Read metrics with this reader instead of a periodic OTLP reader.
         */
        public Builder metricReader(MetricReader metricReader) {
            this.metricReader = metricReader;
            return this;
        }

        public Builder logRecordExporter(LogRecordExporter logRecordExporter) {
            this.logRecordExporter = logRecordExporter;
            return this;
        }

        public Builder registerGlobal(boolean registerGlobal) {
            this.registerGlobal = registerGlobal;
            return this;
        }

        public Builder enableRxContextPropagation(boolean enableRxContextPropagation) {
            this.enableRxContextPropagation = enableRxContextPropagation;
            return this;
        }

        public Builder installLogbackAppender(boolean installLogbackAppender) {
            this.installLogbackAppender = installLogbackAppender;
            return this;
        }

        public Builder shutdownHook(boolean shutdownHook) {
            this.shutdownHook = shutdownHook;
            return this;
        }

        public TelemetrySdk build() {
            return new TelemetrySdk(this);
        }
    }
}
