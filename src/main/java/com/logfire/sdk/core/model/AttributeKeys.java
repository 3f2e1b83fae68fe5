package com.logfire.sdk.core.model;

/**
 * Reserved attribute keys written by the SDK. User-supplied names may not use the
 * {@code code.} or {@code logfire.} prefixes.
 */
public final class AttributeKeys {

    public static final String CODE_FILEPATH = "code.filepath";
    public static final String CODE_LINENO = "code.lineno";
    public static final String CODE_FUNCTION = "code.function";

    public static final String MESSAGE_TEMPLATE = "logfire.msg_template";
    public static final String MESSAGE = "logfire.msg";
    public static final String SPAN_TYPE = "logfire.span_type";
    public static final String START_PARENT_ID = "logfire.start_parent_id";
    public static final String LEVEL = "logfire.level";
    public static final String TAGS = "logfire.tags";
    public static final String NULL_ARGS = "logfire.null_args";

    public static final String JSON_SUFFIX = "__JSON";

    public static final String EXCEPTION_EVENT = "exception";
    public static final String EXCEPTION_TYPE = "exception.type";
    public static final String EXCEPTION_MESSAGE = "exception.message";
    public static final String EXCEPTION_STACKTRACE = "exception.stacktrace";
    public static final String EXCEPTION_DATA = "exception.logfire.data";
    public static final String EXCEPTION_TRACE = "exception.logfire.trace";

    public static final String SERVICE_NAME = "service.name";

    private AttributeKeys() {
    }

    /**
     * Returns true if {@code key} is in the SDK's reserved namespace.
     */
    public static boolean isReserved(String key) {
        return key.startsWith("logfire.") || key.startsWith("code.");
    }
}
