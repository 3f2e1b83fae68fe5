package com.logfire.sdk.capture;

import java.util.List;

/**
 * Implemented by exceptions that describe structured field validation failures.
 * When such an exception is captured, its field errors are recorded in
 * {@code exception.logfire.data}.
 */
public interface ValidationFailure {

    List<FieldError> fieldErrors();
}
