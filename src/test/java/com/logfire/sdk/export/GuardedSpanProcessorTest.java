package com.logfire.sdk.export;

import com.logfire.sdk.metrics.MicrometerExportMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("GuardedSpanProcessor Tests")
class GuardedSpanProcessorTest {

    private SimpleMeterRegistry registry;
    private MicrometerExportMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerExportMetrics(registry);
    }

    private double droppedCounter() {
        return registry.get("logfire.export.dropped").counter().count();
    }

    @Nested
    @DisplayName("Isolation")
    class Isolation {

        @Test
        @DisplayName("Should keep a failing processor's exception away from the caller")
        void failingDelegate() {
            SpanProcessor delegate = mock(SpanProcessor.class);
            ReadableSpan span = mock(ReadableSpan.class);
            doThrow(new IllegalStateException("boom")).when(delegate).onEnd(span);

            GuardedSpanProcessor processor = new GuardedSpanProcessor(delegate, metrics);

            assertDoesNotThrow(() -> processor.onEnd(span));
            verify(delegate).onEnd(span);
        }

        @Test
        @DisplayName("Should still export through other processors when one fails")
        void otherProcessorsStillReceive() {
            SpanProcessor failing = mock(SpanProcessor.class);
            when(failing.isEndRequired()).thenReturn(true);
            doThrow(new IllegalStateException("boom")).when(failing).onEnd(any());
            InMemorySpanExporter exporter = new InMemorySpanExporter();
            SdkTracerProvider provider = SdkTracerProvider.builder()
                    .addSpanProcessor(new GuardedSpanProcessor(failing, metrics))
                    .addSpanProcessor(new GuardedSpanProcessor(SimpleSpanProcessor.create(exporter), metrics))
                    .build();

            assertDoesNotThrow(() -> provider.get("test").spanBuilder("work").startSpan().end());

            assertEquals(1, exporter.getExportedSpans().size());
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class Shutdown {

        @Test
        @DisplayName("Should drop and count records that end after shutdown began")
        void afterShutdown() {
            SpanProcessor delegate = mock(SpanProcessor.class);
            when(delegate.shutdown()).thenReturn(CompletableResultCode.ofSuccess());
            GuardedSpanProcessor processor = new GuardedSpanProcessor(delegate, metrics);

            processor.shutdown();
            processor.onEnd(mock(ReadableSpan.class));

            verify(delegate, never()).onEnd(any());
            assertEquals(1, processor.getDroppedCount());
            assertEquals(1.0, droppedCounter());
        }

        @Test
        @DisplayName("Should shut the delegate down only once")
        void idempotent() {
            SpanProcessor delegate = mock(SpanProcessor.class);
            when(delegate.shutdown()).thenReturn(CompletableResultCode.ofSuccess());
            GuardedSpanProcessor processor = new GuardedSpanProcessor(delegate, metrics);

            assertTrue(processor.shutdown().isSuccess());
            assertTrue(processor.shutdown().isSuccess());

            verify(delegate, times(1)).shutdown();
        }

        @Test
        @DisplayName("Should flush every record accepted while producers race with shutdown")
        void concurrentProducersDuringShutdown() throws Exception {
            int producers = 4;
            int perProducer = 2_000;
            InMemorySpanExporter exporter = new InMemorySpanExporter();
            GuardedSpanProcessor processor = new GuardedSpanProcessor(BatchSpanProcessor.builder(exporter)
                    .setScheduleDelay(Duration.ofMillis(5))
                    .setMaxQueueSize(producers * perProducer)
                    .setMaxExportBatchSize(64)
                    .build(), metrics);
            Tracer tracer = SdkTracerProvider.builder().addSpanProcessor(processor).build().get("test");

            ExecutorService pool = Executors.newFixedThreadPool(producers);
            CountDownLatch running = new CountDownLatch(producers);
            AtomicInteger ended = new AtomicInteger();
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int p = 0; p < producers; p++) {
                    futures.add(pool.submit(() -> {
                        running.countDown();
                        for (int i = 0; i < perProducer; i++) {
                            tracer.spanBuilder("record").startSpan().end();
                            ended.incrementAndGet();
                        }
                    }));
                }
                assertTrue(running.await(10, TimeUnit.SECONDS));

                assertTrue(processor.shutdown().join(10, TimeUnit.SECONDS).isSuccess());
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(producers * perProducer, ended.get());
            assertEquals(ended.get() - processor.getDroppedCount(), exporter.getExportedSpans().size());
            assertEquals((double) processor.getDroppedCount(), droppedCounter());
        }
    }
}
