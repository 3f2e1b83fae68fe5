package com.logfire.sdk.export;

import com.logfire.sdk.metrics.ExportMetrics;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FallbackSpanExporter Tests")
class FallbackSpanExporterTest {

    @Mock
    private SpanExporter primary;

    @Mock
    private SpanExporter fallback;

    @Mock
    private ExportMetrics metrics;

    private FallbackSpanExporter exporter;
    private final List<SpanData> batch = TestRecords.spans(3);

    @BeforeEach
    void setUp() {
        exporter = new FallbackSpanExporter(primary, fallback, metrics, Duration.ofMillis(200));
    }

    @Test
    @DisplayName("Should not touch the fallback when the primary succeeds")
    void primarySucceeds() {
        when(primary.export(batch)).thenReturn(CompletableResultCode.ofSuccess());

        assertTrue(exporter.export(batch).isSuccess());
        verifyNoInteractions(fallback);
        verify(metrics).recordExported(3);
        verify(metrics).recordBatchSize(3);
        verify(metrics).recordExportDuration(any());
    }

    @Test
    @DisplayName("Should write to the fallback when the primary throws")
    void primaryThrows() {
        when(primary.export(batch)).thenThrow(new IllegalStateException("connection refused"));
        when(fallback.export(batch)).thenReturn(CompletableResultCode.ofSuccess());

        assertTrue(exporter.export(batch).isSuccess());
        verify(metrics).recordFallback(3);
    }

    @Test
    @DisplayName("Should write to the fallback when the primary reports failure")
    void primaryFails() {
        when(primary.export(batch)).thenReturn(CompletableResultCode.ofFailure());
        when(fallback.export(batch)).thenReturn(CompletableResultCode.ofSuccess());

        assertTrue(exporter.export(batch).isSuccess());
        verify(fallback).export(batch);
        verify(metrics).recordFallback(3);
        verify(metrics, never()).recordExported(anyInt());
    }

    @Test
    @DisplayName("Should write to the fallback when the primary does not complete in time")
    void primaryTimesOut() {
        when(primary.export(batch)).thenReturn(new CompletableResultCode());
        when(fallback.export(batch)).thenReturn(CompletableResultCode.ofSuccess());

        assertTrue(exporter.export(batch).isSuccess());
        verify(metrics).recordFallback(3);
    }

    @Test
    @DisplayName("Should report failure without throwing when both exporters fail")
    void bothFail() {
        when(primary.export(batch)).thenReturn(CompletableResultCode.ofFailure());
        when(fallback.export(batch)).thenThrow(new IllegalStateException("disk full"));

        CompletableResultCode result = assertDoesNotThrow(() -> exporter.export(batch));
        assertFalse(result.isSuccess());
        verify(metrics).recordFailed(3);
    }

    @Test
    @DisplayName("Should shut down both exporters")
    void shutdown() {
        when(primary.shutdown()).thenReturn(CompletableResultCode.ofSuccess());
        when(fallback.shutdown()).thenReturn(CompletableResultCode.ofSuccess());

        assertTrue(exporter.shutdown().isSuccess());

        verify(primary).shutdown();
        verify(fallback).shutdown();
    }
}
