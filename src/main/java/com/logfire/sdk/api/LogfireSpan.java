package com.logfire.sdk.api;

import com.logfire.sdk.core.model.AttributeKeys;
import com.logfire.sdk.core.model.AttributeValue;
import com.logfire.sdk.core.model.Attributes;
import com.logfire.sdk.core.model.CodeLocation;
import com.logfire.sdk.core.model.SpanKind;
import com.logfire.sdk.encoding.EncodedMessage;
import com.logfire.sdk.encoding.TemplateArgumentException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Handle of an open span, returned by {@link Logfire#span}.
 *
 * <p>Creating the handle emits the {@code start_span} record immediately and makes the span
 * active on the current thread. Closing it restores the previously active span and, unless
 * {@link #setEndOnExit(boolean) endOnExit} was turned off, ends the span and emits the
 * {@code span} record.</p>
 *
 * <pre>
 * try (LogfireSpan span = logfire.span("checkout {cart_id}", Args.of("cart_id", id))) {
 *     span.setAttribute("items", items.size());
 * }
 * </pre>
 *
 * <p>A span is owned by the thread that opened it; the scope returned by
 * {@link #activate(boolean)} must be closed on the thread that opened it.</p>
 */
public class LogfireSpan implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LogfireSpan.class);

    static final String START_SUFFIX = " (start)";

    enum State { CREATED, ACTIVE, ENDED }

    private final LogfirePipeline pipeline;
    private final String name;
    private final EncodedMessage encoded;
    private final CodeLocation location;

    private Span span;
    private long startTimeNanos;
    private Attributes.Builder attributes;
    private final List<String> nullArgs;
    private boolean endOnExit = true;
    private Scope scope;
    private volatile State state = State.CREATED;

    LogfireSpan(LogfirePipeline pipeline, String name, EncodedMessage encoded, CodeLocation location) {
        this.pipeline = pipeline;
        this.name = name;
        this.encoded = encoded;
        this.location = location;
        this.nullArgs = new ArrayList<>(encoded.nullArgs());
    }

    /**
     * Starts the span, emits the {@code start_span} record as its child and activates the
     * span. The span's own attributes are attached when it ends.
     */
    void start() {
        SpanContext previous = ActiveContext.current();
        startTimeNanos = pipeline.now();
        attributes = pipeline.encoder().spanAttributes(encoded, location, SpanKind.SPAN, null).toBuilder();
        span = pipeline.tracer().spanBuilder(name)
                .setStartTimestamp(startTimeNanos, TimeUnit.NANOSECONDS)
                .startSpan();

        Attributes shadowAttributes = pipeline.encoder().spanAttributes(encoded, location, SpanKind.START_SPAN,
                ActiveContext.decimalSpanId(previous));
        pipeline.tracer().spanBuilder(name + START_SUFFIX)
                .setParent(Context.current().with(span))
                .setStartTimestamp(startTimeNanos, TimeUnit.NANOSECONDS)
                .setAllAttributes(shadowAttributes.toOtel())
                .startSpan()
                .end(startTimeNanos, TimeUnit.NANOSECONDS);

        scope = ActiveContext.activate(span);
        state = State.ACTIVE;
    }

    public String getName() {
        return name;
    }

    public String getMessage() {
        return encoded.message();
    }

    public SpanContext getContext() {
        return span.getSpanContext();
    }

    public boolean isEnded() {
        return state == State.ENDED;
    }

    /**
     * Whether closing the handle (or an {@link #activate activation}) ends the span.
     * With {@code false}, only the {@code start_span} record has been emitted until
     * {@link #end()} is called.
     */
    public LogfireSpan setEndOnExit(boolean endOnExit) {
        this.endOnExit = endOnExit;
        return this;
    }

    /**
     * Sets an attribute using the same encoding as template arguments: primitives are
     * stored as-is, null is recorded in {@code logfire.null_args}, anything else is stored
     * as JSON under {@code <key>__JSON}.
     *
     * @throws TemplateArgumentException if {@code key} is in the reserved namespace
     */
    public synchronized LogfireSpan setAttribute(String key, Object value) {
        if (AttributeKeys.isReserved(key)) {
            throw new TemplateArgumentException("'" + key + "' is a reserved attribute name");
        }
        if (state == State.ENDED) {
            log.debug("span.attribute_after_end name={} key={}", name, key);
            return this;
        }
        attributes.remove(key).remove(key + AttributeKeys.JSON_SUFFIX);
        nullArgs.remove(key);
        pipeline.encoder().putValue(attributes, key, value, nullArgs);
        if (nullArgs.isEmpty()) {
            attributes.remove(AttributeKeys.NULL_ARGS);
        } else {
            attributes.put(AttributeKeys.NULL_ARGS, AttributeValue.ofStrings(nullArgs));
        }
        return this;
    }

    /**
     * Attaches an {@code exception} event for {@code throwable} and marks the span as failed.
     */
    public synchronized LogfireSpan recordException(Throwable throwable) {
        if (state == State.ENDED) {
            log.debug("span.exception_after_end name={} type={}", name, throwable.getClass().getName());
            return this;
        }
        span.addEvent(AttributeKeys.EXCEPTION_EVENT, pipeline.exceptionCapture().attributes(throwable).toOtel(),
                pipeline.now(), TimeUnit.NANOSECONDS);
        span.setStatus(StatusCode.ERROR, throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
        return this;
    }

    /**
     * Makes this span active on the current thread again, e.g. to continue a span opened
     * with {@code setEndOnExit(false)}. Closing the returned activation restores the
     * previous span and, if {@code endOnExit} is true, ends this span.
     */
    public Activation activate(boolean endOnExit) {
        return new Activation(ActiveContext.activate(span), endOnExit);
    }

    /**
     * Ends the span and emits its {@code span} record. Ending an ended span does nothing.
     */
    public synchronized void end() {
        if (state == State.ENDED) {
            log.debug("span.already_ended name={}", name);
            return;
        }
        long endTimeNanos = Math.max(pipeline.now(), startTimeNanos);
        state = State.ENDED;
        span.setAllAttributes(attributes.build().toOtel());
        span.end(endTimeNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void close() {
        Scope current = scope;
        scope = null;
        try {
            if (endOnExit) {
                end();
            }
        } finally {
            if (current != null) {
                current.close();
            }
        }
    }

    /**
     * A re-activation of a span, closed with try-with-resources.
     */
    public final class Activation implements AutoCloseable {
        private final Scope activationScope;
        private final boolean endOnExit;

        private Activation(Scope activationScope, boolean endOnExit) {
            this.activationScope = activationScope;
            this.endOnExit = endOnExit;
        }

        @Override
        public void close() {
            try {
                if (endOnExit) {
                    end();
                }
            } finally {
                activationScope.close();
            }
        }
    }
}
