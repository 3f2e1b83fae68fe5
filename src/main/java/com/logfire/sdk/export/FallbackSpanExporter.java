package com.logfire.sdk.export;

import com.logfire.sdk.logging.LogContext;
import com.logfire.sdk.metrics.ExportMetrics;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Exports to a primary exporter and, when that fails, writes the batch to a fallback
 * exporter instead.
 *
 * <p>A primary failure is an exception, a failed result, or a result not completed within
 * the timeout. A batch saved by the fallback completes successfully; only a failed fallback
 * write completes as failed. This exporter never throws.</p>
 */
public class FallbackSpanExporter implements SpanExporter {
    private static final Logger log = LoggerFactory.getLogger(FallbackSpanExporter.class);

    private final SpanExporter primary;
    private final SpanExporter fallback;
    private final ExportMetrics metrics;
    private final Duration timeout;

    public FallbackSpanExporter(SpanExporter primary, SpanExporter fallback, ExportMetrics metrics, Duration timeout) {
        this.primary = primary;
        this.fallback = fallback;
        this.metrics = metrics;
        this.timeout = timeout;
    }

    @Override
    public CompletableResultCode export(Collection<SpanData> spans) {
        try (LogContext ctx = LogContext.forExport(LogContext.generateBatchId(), spans.size())) {
            metrics.recordBatchSize(spans.size());
            long startNanos = System.nanoTime();
            if (await(primary, spans)) {
                metrics.recordExportDuration(Duration.ofNanos(System.nanoTime() - startNanos));
                metrics.recordExported(spans.size());
                return CompletableResultCode.ofSuccess();
            }
            log.warn("export.primary_failed batchSize={}", spans.size());
            return exportToFallback(spans);
        }
    }

    private CompletableResultCode exportToFallback(Collection<SpanData> spans) {
        if (await(fallback, spans)) {
            log.info("export.fallback batchSize={}", spans.size());
            metrics.recordFallback(spans.size());
            return CompletableResultCode.ofSuccess();
        }
        log.error("export.fallback_failed batchSize={}", spans.size());
        metrics.recordFailed(spans.size());
        return CompletableResultCode.ofFailure();
    }

    private boolean await(SpanExporter exporter, Collection<SpanData> spans) {
        try {
            return exporter.export(spans).join(timeout.toMillis(), TimeUnit.MILLISECONDS).isSuccess();
        } catch (RuntimeException e) {
            log.warn("export.exporter_failed exporter={} error={}", exporter.getClass().getSimpleName(),
                    e.getMessage());
            return false;
        }
    }

    @Override
    public CompletableResultCode flush() {
        return CompletableResultCode.ofAll(List.of(primary.flush(), fallback.flush()));
    }

    @Override
    public CompletableResultCode shutdown() {
        return CompletableResultCode.ofAll(List.of(primary.shutdown(), fallback.shutdown()));
    }
}
