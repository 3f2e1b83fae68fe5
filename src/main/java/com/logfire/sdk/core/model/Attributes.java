package com.logfire.sdk.core.model;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.AttributesBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, insertion-ordered attribute map with unique string keys.
 * Use {@link #builder()} to assemble one; re-putting an existing key replaces the
 * value and keeps the original position.
 */
public final class Attributes {

    private static final Attributes EMPTY = new Attributes(new LinkedHashMap<>());

    private final Map<String, AttributeValue> values;

    private Attributes(LinkedHashMap<String, AttributeValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Attributes empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public AttributeValue get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, AttributeValue> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns a builder seeded with this map's entries, in order.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    /**
     * Plain Java view, used by test helpers and the console-style processors.
     */
    public Map<String, Object> toPlainMap() {
        Map<String, Object> plain = new LinkedHashMap<>();
        values.forEach((k, v) -> plain.put(k, v.value()));
        return plain;
    }

    /**
     * Copy handed to the OpenTelemetry span. Its iteration order is by key, not insertion.
     */
    public io.opentelemetry.api.common.Attributes toOtel() {
        AttributesBuilder builder = io.opentelemetry.api.common.Attributes.builder();
        values.forEach((key, value) -> {
            switch (value.type()) {
                case STRING -> builder.put(key, value.asString());
                case LONG -> builder.put(key, value.asLong());
                case DOUBLE -> builder.put(key, value.asDouble());
                case BOOLEAN -> builder.put(key, value.asBoolean());
                case STRING_ARRAY -> builder.put(AttributeKey.stringArrayKey(key), value.asStrings());
            }
        });
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attributes other)) return false;
        // order is part of the value
        return List.copyOf(values.entrySet()).equals(List.copyOf(other.values.entrySet()));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static class Builder {
        private final LinkedHashMap<String, AttributeValue> values = new LinkedHashMap<>();

        public Builder put(String key, AttributeValue value) {
            Objects.requireNonNull(key, "key is required");
            Objects.requireNonNull(value, "value is required");
            values.put(key, value);
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, AttributeValue.of(value));
        }

        public Builder put(String key, long value) {
            return put(key, AttributeValue.of(value));
        }

        public Builder put(String key, double value) {
            return put(key, AttributeValue.of(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, AttributeValue.of(value));
        }

        public Builder putAll(Attributes other) {
            values.putAll(other.values);
            return this;
        }

        public Builder remove(String key) {
            values.remove(key);
            return this;
        }

        public boolean containsKey(String key) {
            return values.containsKey(key);
        }

        public Attributes build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new Attributes(new LinkedHashMap<>(values));
        }
    }
}
