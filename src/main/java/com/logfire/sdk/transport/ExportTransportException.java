package com.logfire.sdk.transport;

/**
 * Raised when a batch cannot be delivered to the remote collector: connection failures,
 * timeouts and non-2xx responses.
 */
public class ExportTransportException extends RuntimeException {

    public ExportTransportException(String message) {
        super(message);
    }

    public ExportTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
