package com.logfire.sdk.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Typed attribute value as it crosses the wire boundary.
 * Values are restricted to string, int64, float64 and bool; the string array
 * type only carries the SDK's own tuple-valued keys ({@code logfire.tags},
 * {@code logfire.null_args}).
 */
public final class AttributeValue {

    private final Type type;
    private final Object value;

    private AttributeValue(Type type, Object value) {
        this.type = type;
        this.value = Objects.requireNonNull(value, "value is required");
    }

    public static AttributeValue of(String value) {
        return new AttributeValue(Type.STRING, value);
    }

    public static AttributeValue of(long value) {
        return new AttributeValue(Type.LONG, value);
    }

    public static AttributeValue of(double value) {
        return new AttributeValue(Type.DOUBLE, value);
    }

    public static AttributeValue of(boolean value) {
        return new AttributeValue(Type.BOOLEAN, value);
    }

    public static AttributeValue ofStrings(List<String> values) {
        return new AttributeValue(Type.STRING_ARRAY, List.copyOf(values));
    }

    public Type type() {
        return type;
    }

    public String asString() {
        return (String) require(Type.STRING);
    }

    public long asLong() {
        return (Long) require(Type.LONG);
    }

    public double asDouble() {
        return (Double) require(Type.DOUBLE);
    }

    public boolean asBoolean() {
        return (Boolean) require(Type.BOOLEAN);
    }

    @SuppressWarnings("unchecked")
    public List<String> asStrings() {
        return (List<String>) require(Type.STRING_ARRAY);
    }

    /**
     * The plain Java value: {@code String}, {@code Long}, {@code Double}, {@code Boolean}
     * or an immutable {@code List<String>}.
     */
    public Object value() {
        return value;
    }

    private Object require(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Attribute value is " + type + ", not " + expected);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeValue other)) return false;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    public enum Type { STRING, LONG, DOUBLE, BOOLEAN, STRING_ARRAY }
}
