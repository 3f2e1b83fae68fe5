package com.logfire.sdk.core.model;

/**
 * Kind of a finished record, written to the {@code logfire.span_type} attribute.
 *
 * <ul>
 *   <li>{@link #SPAN}: the real span, emitted once the scope is finalized</li>
 *   <li>{@link #START_SPAN}: the shadow emitted when a span starts, so in-progress work is visible</li>
 *   <li>{@link #LOG}: a one-shot log record</li>
 * </ul>
 */
public enum SpanKind {
    SPAN("span"),
    START_SPAN("start_span"),
    LOG("log");

    private final String wireName;

    SpanKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
