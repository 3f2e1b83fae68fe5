package com.logfire.sdk.api;

import com.logfire.sdk.capture.ExceptionCapture;
import com.logfire.sdk.encoding.AttributeEncoder;
import com.logfire.sdk.logging.LogContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State shared by a {@link Logfire} handle and the handles derived from it with
 * {@link Logfire#tags}: encoders, the time source, and the tracer provider whose
 * processors receive every finished record.
 */
final class LogfirePipeline {
    private static final Logger log = LoggerFactory.getLogger(LogfirePipeline.class);

    static final String INSTRUMENTATION_SCOPE = "logfire";

    private final AttributeEncoder encoder;
    private final ExceptionCapture exceptionCapture;
    private final TimestampGenerator timestampGenerator;
    private final SdkTracerProvider tracerProvider;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final AtomicBoolean shutdownStarted = new AtomicBoolean();

    LogfirePipeline(AttributeEncoder encoder, ExceptionCapture exceptionCapture, TimestampGenerator timestampGenerator,
                    SdkTracerProvider tracerProvider, MeterRegistry meterRegistry) {
        this.encoder = encoder;
        this.exceptionCapture = exceptionCapture;
        this.timestampGenerator = timestampGenerator;
        this.tracerProvider = tracerProvider;
        this.tracer = tracerProvider.get(INSTRUMENTATION_SCOPE);
        this.meterRegistry = meterRegistry;
    }

    AttributeEncoder encoder() {
        return encoder;
    }

    ExceptionCapture exceptionCapture() {
        return exceptionCapture;
    }

    Tracer tracer() {
        return tracer;
    }

    long now() {
        return timestampGenerator.nowNanos();
    }

    MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    boolean isShutdown() {
        return shutdownStarted.get();
    }

    boolean forceFlush(Duration timeout) {
        CompletableResultCode result = tracerProvider.forceFlush().join(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!result.isSuccess()) {
            log.warn("pipeline.flush_incomplete timeoutMs={}", timeout.toMillis());
        }
        return result.isSuccess();
    }

    /**
     * Shuts the tracer provider down, which flushes each processor once, then closes the
     * meter registry. Spans started afterwards are not recorded.
     */
    boolean shutdown(Duration timeout) {
        if (!shutdownStarted.compareAndSet(false, true)) {
            return true;
        }
        try (LogContext ctx = LogContext.forShutdown()) {
            boolean clean = tracerProvider.shutdown().join(timeout.toMillis(), TimeUnit.MILLISECONDS).isSuccess();
            try {
                meterRegistry.close();
            } catch (RuntimeException e) {
                log.warn("metrics.close_failed error={}", e.getMessage());
            }
            log.debug("pipeline.shutdown clean={}", clean);
            return clean;
        }
    }
}
