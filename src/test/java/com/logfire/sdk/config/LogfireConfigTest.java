package com.logfire.sdk.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogfireConfig Tests")
class LogfireConfigTest {

    private static LogfireConfig.Builder withToken() {
        return LogfireConfig.builder().token("pylf_v1_token");
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Should use the documented defaults")
        void defaults() {
            LogfireConfig config = withToken().build();

            assertEquals(URI.create("https://api.logfire.dev"), config.getBaseUrl());
            assertEquals("unknown_service", config.getServiceName());
            assertEquals(Duration.ofMillis(500), config.getScheduleDelay());
            assertEquals(2048, config.getMaxQueueSize());
            assertEquals(512, config.getMaxExportBatchSize());
            assertEquals(5L * 1024 * 1024, config.getMaxBodySizeBytes());
            assertEquals(LogfireConfig.DEFAULT_FALLBACK_FILE, config.getExporterFallbackFilePath());
            assertEquals("otlp", config.getTracesExporter());
            assertTrue(config.isTraceExportEnabled());
            assertTrue(config.getProcessors().isEmpty());
        }

        @Test
        @DisplayName("Should derive endpoints and headers from the base URL and token")
        void derived() {
            LogfireConfig config = withToken()
                    .baseUrl("https://collector.example/")
                    .additionalHeader("X-Team", "payments")
                    .build();

            assertEquals(URI.create("https://collector.example/v1/traces"), config.getTracesEndpoint());
            assertEquals(URI.create("https://collector.example/v1/metrics"), config.getMetricsEndpoint());
            Map<String, String> headers = config.getExportHeaders();
            assertEquals(List.of("Authorization", "User-Agent", "X-Team"), List.copyOf(headers.keySet()));
            assertEquals("pylf_v1_token", headers.get("Authorization"));
            assertEquals("logfire-java/" + LogfireConfig.SDK_VERSION, headers.get("User-Agent"));
        }

        @Test
        @DisplayName("Should not need a token when nothing is sent")
        void localOnly() {
            LogfireConfig config = LogfireConfig.builder().sendToLogfire(false).build();

            assertFalse(config.isTraceExportEnabled());
            assertNull(config.getToken());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should require a token when sending to Logfire")
        void tokenRequired() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> LogfireConfig.builder().build());
            assertTrue(e.getMessage().contains("A token is required"));
        }

        @Test
        @DisplayName("Should reject non-http base URLs")
        void badBaseUrl() {
            assertThrows(ConfigurationException.class, () -> withToken().baseUrl("ftp://collector").build());
            assertThrows(ConfigurationException.class, () -> withToken().baseUrl("not a url").build());
            assertThrows(ConfigurationException.class, () -> withToken().baseUrl(" ").build());
        }

        @Test
        @DisplayName("Should reject a batch size larger than the queue")
        void batchLargerThanQueue() {
            assertThrows(ConfigurationException.class,
                    () -> withToken().maxQueueSize(10).maxExportBatchSize(11).build());
        }

        @Test
        @DisplayName("Should reject non-positive sizes and durations")
        void nonPositive() {
            assertThrows(ConfigurationException.class, () -> withToken().maxBodySizeBytes(0).build());
            assertThrows(ConfigurationException.class, () -> withToken().scheduleDelay(Duration.ZERO).build());
            assertThrows(ConfigurationException.class, () -> withToken().maxQueueSize(-1).build());
        }

        @Test
        @DisplayName("Should reject unsupported trace exporters")
        void unsupportedExporter() {
            ConfigurationException e = assertThrows(ConfigurationException.class,
                    () -> withToken().tracesExporter("zipkin").build());
            assertEquals("OTEL_TRACES_EXPORTER must be \"otlp\", \"none\" or unset. "
                    + "Logfire does not support other exporters.", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Environment")
    class Environment {

        @Test
        @DisplayName("Should read the schedule delay in milliseconds")
        void scheduleDelay() {
            LogfireConfig config = withToken()
                    .applyEnvironment(Map.of(LogfireConfig.ENV_SCHEDULE_DELAY, "1500"))
                    .build();

            assertEquals(Duration.ofMillis(1500), config.getScheduleDelay());
        }

        @Test
        @DisplayName("Should fail on a non-integer schedule delay")
        void badScheduleDelay() {
            assertThrows(ConfigurationException.class,
                    () -> withToken().applyEnvironment(Map.of(LogfireConfig.ENV_SCHEDULE_DELAY, "soon")));
        }

        @Test
        @DisplayName("Should disable trace export for OTEL_TRACES_EXPORTER=none in any case")
        void exporterNone() {
            LogfireConfig config = withToken()
                    .applyEnvironment(Map.of(LogfireConfig.ENV_TRACES_EXPORTER, "NONE"))
                    .build();

            assertEquals("none", config.getTracesExporter());
            assertFalse(config.isTraceExportEnabled());
            assertTrue(config.isMetricsExportEnabled());
        }

        @Test
        @DisplayName("Should normalize the exporter name without changing the builder")
        void builderReusable() {
            LogfireConfig.Builder builder = withToken().tracesExporter("OTLP");

            assertEquals("otlp", builder.build().getTracesExporter());
            assertEquals("none", builder.tracesExporter("None").build().getTracesExporter());
            assertEquals("otlp", builder.tracesExporter(null).build().getTracesExporter());
        }

        @Test
        @DisplayName("Should publish metrics only when sending to Logfire with metrics enabled")
        void metricsExport() {
            assertTrue(withToken().build().isMetricsExportEnabled());
            assertFalse(withToken().metricsEnabled(false).build().isMetricsExportEnabled());
            assertFalse(LogfireConfig.builder().sendToLogfire(false).build().isMetricsExportEnabled());
        }

        @Test
        @DisplayName("Should ignore blank variables")
        void blank() {
            LogfireConfig config = withToken()
                    .applyEnvironment(Map.of(LogfireConfig.ENV_SCHEDULE_DELAY, " ", LogfireConfig.ENV_TRACES_EXPORTER, ""))
                    .build();

            assertEquals(Duration.ofMillis(500), config.getScheduleDelay());
            assertEquals("otlp", config.getTracesExporter());
        }
    }
}
