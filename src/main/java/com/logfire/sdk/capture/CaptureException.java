package com.logfire.sdk.capture;

/**
 * Raised when an exception event cannot be assembled. Never leaves {@link ExceptionCapture}.
 */
public class CaptureException extends RuntimeException {

    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
