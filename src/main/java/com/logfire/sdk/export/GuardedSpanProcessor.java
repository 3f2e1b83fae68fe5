package com.logfire.sdk.export;

import com.logfire.sdk.metrics.ExportMetrics;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Wraps a processor so that its failures never reach instrumented code and so that no
 * record reaches it once shutdown has begun.
 *
 * <p>{@link #onEnd} holds the read lock while it checks the shutdown flag and hands the
 * record on; {@link #shutdown} flips the flag under the write lock before shutting the
 * delegate down. Every record accepted before the flip is therefore already in the
 * delegate when its shutdown flush starts. Records arriving later are dropped and counted.</p>
 */
public class GuardedSpanProcessor implements SpanProcessor {
    private static final Logger log = LoggerFactory.getLogger(GuardedSpanProcessor.class);

    private final SpanProcessor delegate;
    private final ExportMetrics metrics;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong dropped = new AtomicLong();
    private boolean shutdown;

    public GuardedSpanProcessor(SpanProcessor delegate, ExportMetrics metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
    }

    @Override
    public void onStart(Context parentContext, ReadWriteSpan span) {
        try {
            delegate.onStart(parentContext, span);
        } catch (RuntimeException e) {
            log.error("processor.start_failed processor={} name={}", name(), span.getName(), e);
        }
    }

    @Override
    public boolean isStartRequired() {
        return delegate.isStartRequired();
    }

    @Override
    public void onEnd(ReadableSpan span) {
        lock.readLock().lock();
        try {
            if (shutdown) {
                dropped.incrementAndGet();
                metrics.recordDropped();
                log.debug("record.dropped_after_shutdown processor={} name={}", name(), span.getName());
                return;
            }
            delegate.onEnd(span);
        } catch (RuntimeException e) {
            log.error("processor.failed processor={} name={}", name(), span.getName(), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isEndRequired() {
        return delegate.isEndRequired();
    }

    @Override
    public CompletableResultCode forceFlush() {
        try {
            return delegate.forceFlush();
        } catch (RuntimeException e) {
            log.error("processor.flush_failed processor={}", name(), e);
            return CompletableResultCode.ofFailure();
        }
    }

    @Override
    public CompletableResultCode shutdown() {
        lock.writeLock().lock();
        try {
            if (shutdown) {
                return CompletableResultCode.ofSuccess();
            }
            shutdown = true;
        } finally {
            lock.writeLock().unlock();
        }
        try {
            return delegate.shutdown();
        } catch (RuntimeException e) {
            log.error("processor.shutdown_failed processor={}", name(), e);
            return CompletableResultCode.ofFailure();
        }
    }

    /**
     * Records refused because they ended after shutdown began.
     */
    public long getDroppedCount() {
        return dropped.get();
    }

    private String name() {
        return delegate.getClass().getSimpleName();
    }
}
