package com.logfire.sdk.metrics;

import java.time.Duration;

/**
 * Diagnostics of the export chain.
 * The default {@link NoOpExportMetrics} records nothing; {@link MicrometerExportMetrics}
 * publishes to a Micrometer registry.
 */
public interface ExportMetrics {

    void recordExported(int spans);

    void recordFallback(int spans);

    void recordFailed(int spans);

    void recordDropped();

    void recordExportDuration(Duration duration);

    void recordBatchSize(int size);
}
