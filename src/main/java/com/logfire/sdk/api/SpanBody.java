package com.logfire.sdk.api;

/**
 * Code run inside a span by {@link Logfire#instrument}.
 *
 * @param <T> result type
 * @param <E> checked exception the body may throw
 */
@FunctionalInterface
public interface SpanBody<T, E extends Exception> {

    T run(LogfireSpan span) throws E;
}
