package com.logfire.sdk.api;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;

/**
 * The span currently active on this execution unit, kept in the OpenTelemetry
 * {@link Context}. Each thread has its own chain; other threads see it only through
 * {@link Context#wrap} and friends.
 */
public final class ActiveContext {

    private ActiveContext() {
    }

    /**
     * The active span's context, or {@code null} at the root.
     */
    public static SpanContext current() {
        SpanContext context = Span.current().getSpanContext();
        return context.isValid() ? context : null;
    }

    /**
     * Makes {@code span} active until the returned scope is closed, which restores the
     * previous value.
     */
    static Scope activate(Span span) {
        return Context.current().with(span).makeCurrent();
    }

    /**
     * The span id of {@code context} as an unsigned decimal string, or {@code "0"} for the root.
     */
    static String decimalSpanId(SpanContext context) {
        if (context == null) {
            return "0";
        }
        return Long.toUnsignedString(Long.parseUnsignedLong(context.getSpanId(), 16));
    }
}
