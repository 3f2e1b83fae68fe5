package com.logfire.sdk.export;

import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects exported records in memory. Thread-safe.
 */
public class InMemorySpanExporter implements SpanExporter {

    private final List<SpanData> records = new ArrayList<>();

    @Override
    public synchronized CompletableResultCode export(Collection<SpanData> spans) {
        records.addAll(spans);
        return CompletableResultCode.ofSuccess();
    }

    @Override
    public CompletableResultCode flush() {
        return CompletableResultCode.ofSuccess();
    }

    @Override
    public CompletableResultCode shutdown() {
        return CompletableResultCode.ofSuccess();
    }

    public synchronized List<SpanData> getExportedSpans() {
        return List.copyOf(records);
    }

    public synchronized void clear() {
        records.clear();
    }

    /**
     * Exported records as plain maps, convenient for whole-record assertions:
     * {@code name}, {@code context} ({@code trace_id}, {@code span_id}), {@code parent}
     * (or null), {@code start_time}, {@code end_time}, {@code attributes} and, when
     * present, {@code events}.
     *
     * <p>Ids are numbers; an id that does not fit a {@code long} is a {@link BigInteger}.</p>
     */
    public List<Map<String, Object>> exportedSpansAsMaps() {
        List<Map<String, Object>> maps = new ArrayList<>();
        for (SpanData span : getExportedSpans()) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", span.getName());
            map.put("context", context(span.getSpanContext()));
            map.put("parent", span.getParentSpanContext().isValid() ? context(span.getParentSpanContext()) : null);
            map.put("start_time", span.getStartEpochNanos());
            map.put("end_time", span.getEndEpochNanos());
            map.put("attributes", plain(span.getAttributes()));
            if (!span.getEvents().isEmpty()) {
                List<Map<String, Object>> events = new ArrayList<>();
                for (EventData event : span.getEvents()) {
                    Map<String, Object> eventMap = new LinkedHashMap<>();
                    eventMap.put("name", event.getName());
                    eventMap.put("timestamp", event.getEpochNanos());
                    eventMap.put("attributes", plain(event.getAttributes()));
                    events.add(eventMap);
                }
                map.put("events", events);
            }
            maps.add(map);
        }
        return maps;
    }

    private static Map<String, Object> plain(io.opentelemetry.api.common.Attributes attributes) {
        Map<String, Object> plain = new LinkedHashMap<>();
        attributes.forEach((key, value) -> plain.put(key.getKey(), value));
        return plain;
    }

    private static Map<String, Object> context(SpanContext spanContext) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("trace_id", number(spanContext.getTraceId()));
        context.put("span_id", number(spanContext.getSpanId()));
        return context;
    }

    private static Object number(String hex) {
        BigInteger value = new BigInteger(hex, 16);
        return value.bitLength() < 64 ? (Object) value.longValue() : value;
    }
}
