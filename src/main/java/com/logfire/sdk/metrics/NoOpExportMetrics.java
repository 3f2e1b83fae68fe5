package com.logfire.sdk.metrics;

import java.time.Duration;

/**
 * {@link ExportMetrics} that discards everything.
 */
public class NoOpExportMetrics implements ExportMetrics {

    public static final NoOpExportMetrics INSTANCE = new NoOpExportMetrics();

    @Override
    public void recordExported(int spans) {
    }

    @Override
    public void recordFallback(int spans) {
    }

    @Override
    public void recordFailed(int spans) {
    }

    @Override
    public void recordDropped() {
    }

    @Override
    public void recordExportDuration(Duration duration) {
    }

    @Override
    public void recordBatchSize(int size) {
    }
}
