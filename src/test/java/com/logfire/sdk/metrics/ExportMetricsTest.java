package com.logfire.sdk.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExportMetrics Tests")
class ExportMetricsTest {

    @Nested
    @DisplayName("MicrometerExportMetrics")
    class Micrometer {

        private SimpleMeterRegistry registry;
        private MicrometerExportMetrics metrics;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            metrics = new MicrometerExportMetrics(registry);
        }

        @Test
        @DisplayName("Should count records by outcome")
        void outcomes() {
            metrics.recordExported(5);
            metrics.recordExported(2);
            metrics.recordFallback(3);
            metrics.recordFailed(1);

            assertEquals(7.0, registry.get("logfire.export.spans").tag("outcome", "exported").counter().count());
            assertEquals(3.0, registry.get("logfire.export.spans").tag("outcome", "fallback").counter().count());
            assertEquals(1.0, registry.get("logfire.export.spans").tag("outcome", "failed").counter().count());
        }

        @Test
        @DisplayName("Should count dropped records")
        void dropped() {
            metrics.recordDropped();
            metrics.recordDropped();

            assertEquals(2.0, registry.get("logfire.export.dropped").counter().count());
        }

        @Test
        @DisplayName("Should record batch durations and sizes")
        void batches() {
            metrics.recordExportDuration(Duration.ofMillis(40));
            metrics.recordBatchSize(512);
            metrics.recordBatchSize(10);

            assertEquals(1, registry.get("logfire.export.duration").timer().count());
            assertEquals(2, registry.get("logfire.export.batch.size").summary().count());
            assertEquals(522.0, registry.get("logfire.export.batch.size").summary().totalAmount());
        }
    }

    @Nested
    @DisplayName("NoOpExportMetrics")
    class NoOp {

        @Test
        @DisplayName("Should accept every call")
        void acceptsEverything() {
            ExportMetrics metrics = NoOpExportMetrics.INSTANCE;

            assertDoesNotThrow(() -> {
                metrics.recordExported(1);
                metrics.recordFallback(1);
                metrics.recordFailed(1);
                metrics.recordDropped();
                metrics.recordExportDuration(Duration.ZERO);
                metrics.recordBatchSize(1);
            });
        }
    }
}
