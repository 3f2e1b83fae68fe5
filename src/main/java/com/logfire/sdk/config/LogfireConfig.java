package com.logfire.sdk.config;

import com.logfire.sdk.api.TimestampGenerator;
import com.logfire.sdk.transport.HttpTransport;
import io.opentelemetry.sdk.trace.IdGenerator;
import io.opentelemetry.sdk.trace.SpanProcessor;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable SDK configuration. All settings are validated in {@link Builder#build()},
 * which throws {@link ConfigurationException} on the first invalid value.
 */
public class LogfireConfig {

    public static final String SDK_VERSION = "0.1.0";

    public static final String DEFAULT_BASE_URL = "https://api.logfire.dev";
    public static final String DEFAULT_SERVICE_NAME = "unknown_service";
    public static final Path DEFAULT_FALLBACK_FILE = Path.of("logfire_spans.bin");
    public static final Duration DEFAULT_SCHEDULE_DELAY = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_QUEUE_SIZE = 2048;
    public static final int DEFAULT_MAX_EXPORT_BATCH_SIZE = 512;
    public static final long DEFAULT_MAX_BODY_SIZE = 5L * 1024 * 1024;
    public static final Duration DEFAULT_EXPORT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_METRICS_STEP = Duration.ofSeconds(60);

    public static final String TRACES_EXPORTER_OTLP = "otlp";
    public static final String TRACES_EXPORTER_NONE = "none";

    static final String ENV_SCHEDULE_DELAY = "OTEL_BSP_SCHEDULE_DELAY";
    static final String ENV_TRACES_EXPORTER = "OTEL_TRACES_EXPORTER";

    private final URI baseUrl;
    private final String token;
    private final boolean sendToLogfire;
    private final String serviceName;
    private final Path exporterFallbackFilePath;
    private final Duration scheduleDelay;
    private final int maxQueueSize;
    private final int maxExportBatchSize;
    private final long maxBodySizeBytes;
    private final Duration exportTimeout;
    private final String tracesExporter;
    private final boolean metricsEnabled;
    private final Duration metricsStep;
    private final Map<String, String> additionalHeaders;
    private final IdGenerator idGenerator;
    private final TimestampGenerator timestampGenerator;
    private final List<SpanProcessor> processors;
    private final HttpTransport transport;

    private LogfireConfig(Builder builder, URI baseUrl, String tracesExporter) {
        this.baseUrl = baseUrl;
        this.token = builder.token;
        this.sendToLogfire = builder.sendToLogfire;
        this.serviceName = builder.serviceName;
        this.exporterFallbackFilePath = builder.exporterFallbackFilePath;
        this.scheduleDelay = builder.scheduleDelay;
        this.maxQueueSize = builder.maxQueueSize;
        this.maxExportBatchSize = builder.maxExportBatchSize;
        this.maxBodySizeBytes = builder.maxBodySizeBytes;
        this.exportTimeout = builder.exportTimeout;
        this.tracesExporter = tracesExporter;
        this.metricsEnabled = builder.metricsEnabled;
        this.metricsStep = builder.metricsStep;
        this.additionalHeaders = Map.copyOf(builder.additionalHeaders);
        this.idGenerator = builder.idGenerator;
        this.timestampGenerator = builder.timestampGenerator;
        this.processors = List.copyOf(builder.processors);
        this.transport = builder.transport;
    }

    public URI getBaseUrl() { return baseUrl; }
    public String getToken() { return token; }
    public boolean isSendToLogfire() { return sendToLogfire; }
    public String getServiceName() { return serviceName; }
    public Path getExporterFallbackFilePath() { return exporterFallbackFilePath; }
    public Duration getScheduleDelay() { return scheduleDelay; }
    public int getMaxQueueSize() { return maxQueueSize; }
    public int getMaxExportBatchSize() { return maxExportBatchSize; }
    public long getMaxBodySizeBytes() { return maxBodySizeBytes; }
    public Duration getExportTimeout() { return exportTimeout; }
    public String getTracesExporter() { return tracesExporter; }
    public boolean isMetricsEnabled() { return metricsEnabled; }
    public Duration getMetricsStep() { return metricsStep; }
    public Map<String, String> getAdditionalHeaders() { return additionalHeaders; }
    public IdGenerator getIdGenerator() { return idGenerator; }
    public TimestampGenerator getTimestampGenerator() { return timestampGenerator; }
    public List<SpanProcessor> getProcessors() { return processors; }

    /**
     * Transport override, or {@code null} for the default {@code HttpClient} transport.
     */
    public HttpTransport getTransport() { return transport; }

    /**
     * True if finished records should be exported to the Logfire collector.
     */
    public boolean isTraceExportEnabled() {
        return sendToLogfire && TRACES_EXPORTER_OTLP.equals(tracesExporter);
    }

    /**
     * True if the metrics path should publish to the collector. Independent of the trace
     * exporter setting.
     */
    public boolean isMetricsExportEnabled() {
        return sendToLogfire && metricsEnabled;
    }

    public URI getTracesEndpoint() {
        return URI.create(baseUrl + "/v1/traces");
    }

    public URI getMetricsEndpoint() {
        return URI.create(baseUrl + "/v1/metrics");
    }

    /**
     * Headers sent with every export request: the token verbatim as {@code Authorization},
     * the SDK {@code User-Agent}, then the additional headers.
     */
    public Map<String, String> getExportHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (token != null) {
            headers.put("Authorization", token);
        }
        headers.put("User-Agent", "logfire-java/" + SDK_VERSION);
        headers.putAll(additionalHeaders);
        return headers;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String token;
        private boolean sendToLogfire = true;
        private String serviceName = DEFAULT_SERVICE_NAME;
        private Path exporterFallbackFilePath = DEFAULT_FALLBACK_FILE;
        private Duration scheduleDelay = DEFAULT_SCHEDULE_DELAY;
        private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
        private int maxExportBatchSize = DEFAULT_MAX_EXPORT_BATCH_SIZE;
        private long maxBodySizeBytes = DEFAULT_MAX_BODY_SIZE;
        private Duration exportTimeout = DEFAULT_EXPORT_TIMEOUT;
        private String tracesExporter = TRACES_EXPORTER_OTLP;
        private boolean metricsEnabled = true;
        private Duration metricsStep = DEFAULT_METRICS_STEP;
        private final Map<String, String> additionalHeaders = new LinkedHashMap<>();
        private IdGenerator idGenerator = IdGenerator.random();
        private TimestampGenerator timestampGenerator = TimestampGenerator.wallClock();
        private final List<SpanProcessor> processors = new ArrayList<>();
        private HttpTransport transport;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder sendToLogfire(boolean sendToLogfire) {
            this.sendToLogfire = sendToLogfire;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        /**
         * Fallback file for batches that cannot be sent; {@code null} disables the fallback.
         */
        public Builder exporterFallbackFilePath(Path exporterFallbackFilePath) {
            this.exporterFallbackFilePath = exporterFallbackFilePath;
            return this;
        }

        public Builder scheduleDelay(Duration scheduleDelay) {
            this.scheduleDelay = scheduleDelay;
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

        public Builder maxBodySizeBytes(long maxBodySizeBytes) {
            this.maxBodySizeBytes = maxBodySizeBytes;
            return this;
        }

        public Builder exportTimeout(Duration exportTimeout) {
            this.exportTimeout = exportTimeout;
            return this;
        }

        /**
         * Trace exporter name: {@code otlp} or {@code none}, case-insensitive.
         */
        public Builder tracesExporter(String tracesExporter) {
            this.tracesExporter = tracesExporter;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder metricsStep(Duration metricsStep) {
            this.metricsStep = metricsStep;
            return this;
        }

        public Builder additionalHeader(String name, String value) {
            this.additionalHeaders.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
            return this;
        }

        public Builder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = idGenerator;
            return this;
        }

        public Builder timestampGenerator(TimestampGenerator timestampGenerator) {
            this.timestampGenerator = timestampGenerator;
            return this;
        }

        /**
         * Adds a processor that receives every finished record, after the export processor.
         */
        public Builder addProcessor(SpanProcessor processor) {
            this.processors.add(Objects.requireNonNull(processor, "processor is required"));
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Applies the OpenTelemetry environment variables the SDK honours:
         * {@code OTEL_BSP_SCHEDULE_DELAY} (milliseconds) and {@code OTEL_TRACES_EXPORTER}.
         * Unset and blank variables are ignored.
         *
         * @throws ConfigurationException if {@code OTEL_BSP_SCHEDULE_DELAY} is not an integer
         */
        public Builder applyEnvironment(Map<String, String> environment) {
            String delay = environment.get(ENV_SCHEDULE_DELAY);
            if (delay != null && !delay.isBlank()) {
                try {
                    this.scheduleDelay = Duration.ofMillis(Long.parseLong(delay.trim()));
                } catch (NumberFormatException e) {
                    throw new ConfigurationException(ENV_SCHEDULE_DELAY + " must be an integer number of milliseconds, got '"
                            + delay + "'", e);
                }
            }
            String exporter = environment.get(ENV_TRACES_EXPORTER);
            if (exporter != null && !exporter.isBlank()) {
                this.tracesExporter = exporter.trim();
            }
            return this;
        }

        public LogfireConfig build() {
            URI uri = parseBaseUrl(baseUrl);
            if (sendToLogfire && (token == null || token.isBlank())) {
                throw new ConfigurationException("A token is required to send data to Logfire; "
                        + "set a token or disable sendToLogfire");
            }
            if (serviceName == null || serviceName.isBlank()) {
                throw new ConfigurationException("serviceName must not be blank");
            }
            requirePositive(scheduleDelay, "scheduleDelay");
            requirePositive(exportTimeout, "exportTimeout");
            requirePositive(metricsStep, "metricsStep");
            if (maxQueueSize <= 0) {
                throw new ConfigurationException("maxQueueSize must be > 0");
            }
            if (maxExportBatchSize <= 0) {
                throw new ConfigurationException("maxExportBatchSize must be > 0");
            }
            if (maxExportBatchSize > maxQueueSize) {
                throw new ConfigurationException("maxExportBatchSize cannot exceed maxQueueSize");
            }
            if (maxBodySizeBytes <= 0) {
                throw new ConfigurationException("maxBodySizeBytes must be > 0");
            }
            String exporter = tracesExporter == null ? TRACES_EXPORTER_OTLP : tracesExporter.toLowerCase(Locale.ROOT);
            if (!exporter.equals(TRACES_EXPORTER_OTLP) && !exporter.equals(TRACES_EXPORTER_NONE)) {
                throw new ConfigurationException(
                        "OTEL_TRACES_EXPORTER must be \"otlp\", \"none\" or unset. Logfire does not support other exporters.");
            }
            if (idGenerator == null) {
                throw new ConfigurationException("idGenerator must not be null");
            }
            if (timestampGenerator == null) {
                throw new ConfigurationException("timestampGenerator must not be null");
            }
            return new LogfireConfig(this, uri, exporter);
        }

        private static URI parseBaseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new ConfigurationException("baseUrl must not be blank");
            }
            String trimmed = baseUrl.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            URI uri;
            try {
                uri = new URI(trimmed);
            } catch (URISyntaxException e) {
                throw new ConfigurationException("Invalid baseUrl '" + baseUrl + "'", e);
            }
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ConfigurationException("baseUrl must be an absolute http(s) URL, got '" + baseUrl + "'");
            }
            return uri;
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new ConfigurationException(name + " must be > 0");
            }
        }
    }

    @Override
    public String toString() {
        return "LogfireConfig{" +
                "baseUrl=" + baseUrl +
                ", sendToLogfire=" + sendToLogfire +
                ", serviceName='" + serviceName + '\'' +
                ", exporterFallbackFilePath=" + exporterFallbackFilePath +
                ", scheduleDelay=" + scheduleDelay +
                ", maxQueueSize=" + maxQueueSize +
                ", maxExportBatchSize=" + maxExportBatchSize +
                ", tracesExporter='" + tracesExporter + '\'' +
                ", metricsEnabled=" + metricsEnabled +
                '}';
    }
}
