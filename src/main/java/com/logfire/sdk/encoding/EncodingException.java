package com.logfire.sdk.encoding;

/**
 * Raised when a value cannot be turned into its JSON or display form.
 * Always recovered inside the encoder: the value is replaced by a safe placeholder
 * and the record is still emitted.
 */
public class EncodingException extends RuntimeException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
