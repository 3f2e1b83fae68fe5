package com.logfire.sdk.api;

import io.opentelemetry.sdk.common.Clock;

/**
 * Source of record timestamps, in nanoseconds since the epoch. Every start, end and event
 * time is taken from here and passed to the span explicitly.
 */
@FunctionalInterface
public interface TimestampGenerator {

    long nowNanos();

    static TimestampGenerator wallClock() {
        return Clock.getDefault()::now;
    }
}
