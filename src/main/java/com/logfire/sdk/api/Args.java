package com.logfire.sdk.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds named-argument maps that keep call order and allow null values,
 * which {@link Map#of} does not.
 *
 * <pre>
 * logfire.info("user {name} logged in", Args.of("name", name, "attempt", 3));
 * </pre>
 */
public final class Args {

    private Args() {
    }

    public static Map<String, Object> of() {
        return new LinkedHashMap<>();
    }

    /**
     * @param namesAndValues alternating names and values
     * @throws IllegalArgumentException if the count is odd or a name is not a string
     */
    public static Map<String, Object> of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " items");
        }
        Map<String, Object> args = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String name)) {
                throw new IllegalArgumentException("Argument name at position " + i + " is not a string");
            }
            args.put(name, namesAndValues[i + 1]);
        }
        return args;
    }
}
