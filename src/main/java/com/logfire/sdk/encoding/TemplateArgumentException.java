package com.logfire.sdk.encoding;

/**
 * Thrown to the call site when a message template cannot be rendered with the
 * supplied arguments, for example a placeholder naming an unbound argument.
 * This is a usage bug and is never recovered by the SDK.
 */
public class TemplateArgumentException extends RuntimeException {

    public TemplateArgumentException(String message) {
        super(message);
    }

    public TemplateArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
