package com.logfire.sdk.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link ExportMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code logfire.export.spans}: Counter (tag: outcome = exported, fallback, failed)</li>
 *   <li>{@code logfire.export.dropped}: Counter, records refused after shutdown began</li>
 *   <li>{@code logfire.export.duration}: Timer, one sample per exported batch</li>
 *   <li>{@code logfire.export.batch.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerExportMetrics implements ExportMetrics {

    private final Counter exportedCounter;
    private final Counter fallbackCounter;
    private final Counter failedCounter;
    private final Counter droppedCounter;
    private final Timer exportTimer;
    private final DistributionSummary batchSizeSummary;

    public MicrometerExportMetrics(MeterRegistry registry) {
        this.exportedCounter = spansCounter(registry, "exported");
        this.fallbackCounter = spansCounter(registry, "fallback");
        this.failedCounter = spansCounter(registry, "failed");
        this.droppedCounter = Counter.builder("logfire.export.dropped")
                .description("Records refused because they ended after shutdown began")
                .register(registry);
        this.exportTimer = Timer.builder("logfire.export.duration")
                .description("Duration of batch exports")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("logfire.export.batch.size")
                .description("Distribution of exported batch sizes")
                .register(registry);
    }

    private static Counter spansCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("logfire.export.spans")
                .description("Records handed to the export chain, by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordExported(int spans) {
        exportedCounter.increment(spans);
    }

    @Override
    public void recordFallback(int spans) {
        fallbackCounter.increment(spans);
    }

    @Override
    public void recordFailed(int spans) {
        failedCounter.increment(spans);
    }

    @Override
    public void recordDropped() {
        droppedCounter.increment();
    }

    @Override
    public void recordExportDuration(Duration duration) {
        exportTimer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }
}
