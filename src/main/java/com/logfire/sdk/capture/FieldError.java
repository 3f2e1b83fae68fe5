package com.logfire.sdk.capture;

import java.util.List;
import java.util.Objects;

/**
 * One failed field of a structured validation error.
 *
 * @param type  machine-readable error type, e.g. {@code missing} or {@code int_parsing}
 * @param loc   path to the offending field; segments are field names or list indexes
 * @param msg   human readable message
 * @param input the rejected input value, or {@code null} when unknown
 */
public record FieldError(String type, List<Object> loc, String msg, Object input) {

    public FieldError {
        Objects.requireNonNull(type, "type is required");
        loc = loc != null ? List.copyOf(loc) : List.of();
        msg = msg != null ? msg : "";
    }
}
