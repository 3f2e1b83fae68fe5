package com.logfire.sdk.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logfire.sdk.capture.ExceptionCapture;
import com.logfire.sdk.config.ConfigurationException;
import com.logfire.sdk.config.LogfireConfig;
import com.logfire.sdk.core.model.AttributeKeys;
import com.logfire.sdk.core.model.CodeLocation;
import com.logfire.sdk.core.model.LogLevel;
import com.logfire.sdk.core.model.TagList;
import com.logfire.sdk.encoding.AttributeEncoder;
import com.logfire.sdk.encoding.EncodedMessage;
import com.logfire.sdk.encoding.JsonValueEncoder;
import com.logfire.sdk.export.FallbackSpanExporter;
import com.logfire.sdk.export.FileSpanExporter;
import com.logfire.sdk.export.GuardedSpanProcessor;
import com.logfire.sdk.export.OtlpTransportSpanExporter;
import com.logfire.sdk.metrics.ExportMetrics;
import com.logfire.sdk.metrics.LogfireOtlpConfig;
import com.logfire.sdk.metrics.MicrometerExportMetrics;
import com.logfire.sdk.metrics.NoOpExportMetrics;
import com.logfire.sdk.transport.HttpTransport;
import com.logfire.sdk.transport.JdkHttpTransport;
import com.logfire.sdk.transport.SizeLimitedTransport;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the SDK: opens spans, emits logs and owns the export pipeline.
 *
 * <pre>
 * try (Logfire logfire = Logfire.builder().config(config).build()) {
 *     try (LogfireSpan span = logfire.span("processing order {order_id}", Args.of("order_id", 42))) {
 *         logfire.info("charged {amount}", Args.of("amount", 9.99));
 *     }
 * }
 * </pre>
 *
 * <p>Every span produces two records: a {@code start_span} record when it opens and a
 * {@code span} record when it ends. Logs produce one {@code log} record. Parents follow the
 * span active on the calling thread.</p>
 *
 * <p>Handles returned by {@link #tags} share this instance's pipeline; closing any of
 * them shuts the pipeline down.</p>
 */
public class Logfire implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Logfire.class);

    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final LogfirePipeline pipeline;
    private final TagList tags;

    private Logfire(LogfirePipeline pipeline, TagList tags) {
        this.pipeline = pipeline;
        this.tags = tags;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---- spans ----

    /**
     * Opens a span named after {@code template}.
     *
     * @throws com.logfire.sdk.encoding.TemplateArgumentException if {@code template}
     *         references a name missing from {@code args}
     */
    public LogfireSpan span(String template, Map<String, ?> args) {
        return span(template, null, args);
    }

    /**
     * Opens a span with an explicit name. The name is available to the template as
     * {@code {span_name}} but is not stored as an attribute.
     */
    public LogfireSpan span(String template, String spanName, Map<String, ?> args) {
        CodeLocation location = CallerLocator.locate();
        EncodedMessage encoded = pipeline.encoder().encode(template, spanName, tags, args);
        if (pipeline.isShutdown()) {
            log.debug("record.dropped_after_shutdown name={}", encoded.message());
        }
        LogfireSpan span = new LogfireSpan(pipeline, spanName != null ? spanName : template, encoded, location);
        span.start();
        return span;
    }

    /**
     * Runs {@code body} inside a span. An exception thrown by the body is recorded on the
     * span, the span is ended, and the exception is rethrown unchanged.
     */
    public <T, E extends Exception> T instrument(String template, Map<String, ?> args, SpanBody<T, E> body) throws E {
        return instrument(template, null, args, body);
    }

    public <T, E extends Exception> T instrument(String template, String spanName, Map<String, ?> args,
                                                 SpanBody<T, E> body) throws E {
        try (LogfireSpan span = span(template, spanName, args)) {
            try {
                return body.run(span);
            } catch (Throwable t) {
                span.recordException(t);
                // precise rethrow: only E or unchecked throwables reach here
                throw t;
            }
        }
    }

    // ---- logs ----

    public void log(LogLevel level, String template, Map<String, ?> args) {
        log(level, template, args, null);
    }

    /**
     * Emits a log record. When {@code throwable} is given it is attached as an
     * {@code exception} event.
     */
    public void log(LogLevel level, String template, Map<String, ?> args, Throwable throwable) {
        CodeLocation location = CallerLocator.locate();
        EncodedMessage encoded = pipeline.encoder().encode(template, null, tags, args);
        if (pipeline.isShutdown()) {
            log.debug("record.dropped_after_shutdown name={}", encoded.message());
            return;
        }
        long timestamp = pipeline.now();
        Span logSpan = pipeline.tracer().spanBuilder(encoded.message())
                .setStartTimestamp(timestamp, TimeUnit.NANOSECONDS)
                .setAllAttributes(pipeline.encoder().logAttributes(encoded, level, location).toOtel())
                .startSpan();
        if (throwable != null) {
            logSpan.addEvent(AttributeKeys.EXCEPTION_EVENT, pipeline.exceptionCapture().attributes(throwable).toOtel(),
                    timestamp, TimeUnit.NANOSECONDS);
            logSpan.setStatus(StatusCode.ERROR, throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
        }
        logSpan.end(timestamp, TimeUnit.NANOSECONDS);
    }

    public void debug(String template) {
        log(LogLevel.DEBUG, template, Map.of(), null);
    }

    public void debug(String template, Map<String, ?> args) {
        log(LogLevel.DEBUG, template, args, null);
    }

    public void info(String template) {
        log(LogLevel.INFO, template, Map.of(), null);
    }

    public void info(String template, Map<String, ?> args) {
        log(LogLevel.INFO, template, args, null);
    }

    public void notice(String template) {
        log(LogLevel.NOTICE, template, Map.of(), null);
    }

    public void notice(String template, Map<String, ?> args) {
        log(LogLevel.NOTICE, template, args, null);
    }

    public void warning(String template) {
        log(LogLevel.WARNING, template, Map.of(), null);
    }

    public void warning(String template, Map<String, ?> args) {
        log(LogLevel.WARNING, template, args, null);
    }

    public void error(String template) {
        log(LogLevel.ERROR, template, Map.of(), null);
    }

    public void error(String template, Map<String, ?> args) {
        log(LogLevel.ERROR, template, args, null);
    }

    public void error(String template, Map<String, ?> args, Throwable throwable) {
        log(LogLevel.ERROR, template, args, throwable);
    }

    public void critical(String template) {
        log(LogLevel.CRITICAL, template, Map.of(), null);
    }

    public void critical(String template, Map<String, ?> args) {
        log(LogLevel.CRITICAL, template, args, null);
    }

    public void critical(String template, Map<String, ?> args, Throwable throwable) {
        log(LogLevel.CRITICAL, template, args, throwable);
    }

    // ---- tags and context ----

    /**
     * A handle whose records carry this handle's tags followed by {@code more}.
     * Duplicates are kept.
     */
    public Logfire tags(String... more) {
        return new Logfire(pipeline, tags.concat(more));
    }

    public TagList getTags() {
        return tags;
    }

    /**
     * Wraps {@code task} so that it runs with the caller's active span as parent.
     */
    public static Runnable wrap(Runnable task) {
        return Context.current().wrap(task);
    }

    public static <T> Callable<T> wrap(Callable<T> task) {
        return Context.current().wrap(task);
    }

    /**
     * An executor that propagates the submitting thread's active span to each task.
     */
    public static Executor wrap(Executor executor) {
        return Context.taskWrapping(executor);
    }

    /**
     * Registry for application metrics, published on the metrics path when enabled.
     * Export diagnostics ({@code logfire.export.*}) are registered here too.
     */
    public MeterRegistry meterRegistry() {
        return pipeline.meterRegistry();
    }

    // ---- lifecycle ----

    public boolean forceFlush(Duration timeout) {
        return pipeline.forceFlush(timeout);
    }

    /**
     * Flushes and stops every processor, waiting at most {@code timeout}. Records produced
     * afterwards are dropped.
     */
    public boolean shutdown(Duration timeout) {
        return pipeline.shutdown(timeout);
    }

    @Override
    public void close() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public static class Builder {
        private LogfireConfig config;
        private ObjectMapper objectMapper;

        public Builder config(LogfireConfig config) {
            this.config = config;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Builds the pipeline. When trace export is enabled, the first processor batches
         * records to the collector with the fallback file behind it; the configured
         * processors follow. When metrics export is enabled, {@link #meterRegistry()}
         * publishes to the collector's metrics endpoint.
         *
         * @throws ConfigurationException if no configuration was given
         */
        public Logfire build() {
            if (config == null) {
                throw new ConfigurationException("A LogfireConfig is required");
            }
            ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
            MeterRegistry meterRegistry = new CompositeMeterRegistry();
            ExportMetrics exportMetrics = NoOpExportMetrics.INSTANCE;

            if (config.isMetricsExportEnabled()) {
                OtlpMeterRegistry otlpRegistry = new OtlpMeterRegistry(new LogfireOtlpConfig(config.getMetricsEndpoint(),
                        config.getExportHeaders(), config.getMetricsStep(), config.getServiceName()), Clock.SYSTEM);
                meterRegistry = otlpRegistry;
                exportMetrics = new MicrometerExportMetrics(otlpRegistry);
            }

            SdkTracerProviderBuilder tracerProvider = SdkTracerProvider.builder()
                    .setIdGenerator(config.getIdGenerator())
                    .setResource(Resource.getDefault().toBuilder()
                            .put("service.name", config.getServiceName())
                            .build());

            if (config.isTraceExportEnabled()) {
                HttpTransport transport = new SizeLimitedTransport(
                        config.getTransport() != null ? config.getTransport() : new JdkHttpTransport(config.getExportTimeout()),
                        config.getMaxBodySizeBytes());
                SpanExporter exporter = new OtlpTransportSpanExporter(transport, config.getTracesEndpoint(),
                        config.getExportHeaders());
                if (config.getExporterFallbackFilePath() != null) {
                    exporter = new FallbackSpanExporter(exporter, new FileSpanExporter(config.getExporterFallbackFilePath()),
                            exportMetrics, config.getExportTimeout());
                }
                SpanProcessor batch = BatchSpanProcessor.builder(exporter)
                        .setScheduleDelay(config.getScheduleDelay())
                        .setMaxQueueSize(config.getMaxQueueSize())
                        .setMaxExportBatchSize(config.getMaxExportBatchSize())
                        .build();
                tracerProvider.addSpanProcessor(new GuardedSpanProcessor(batch, exportMetrics));
            }
            for (SpanProcessor processor : config.getProcessors()) {
                tracerProvider.addSpanProcessor(new GuardedSpanProcessor(processor, exportMetrics));
            }

            LogfirePipeline pipeline = new LogfirePipeline(
                    new AttributeEncoder(new JsonValueEncoder(mapper)),
                    new ExceptionCapture(mapper),
                    config.getTimestampGenerator(),
                    tracerProvider.build(),
                    meterRegistry);
            log.debug("logfire.configured {}", config);
            return new Logfire(pipeline, TagList.empty());
        }
    }
}
