package com.logfire.sdk.core.model;

/**
 * Severity of a log record, written to the {@code logfire.level} attribute.
 */
public enum LogLevel {
    DEBUG("debug", 5),
    INFO("info", 9),
    NOTICE("notice", 10),
    WARNING("warning", 13),
    ERROR("error", 17),
    CRITICAL("critical", 21);

    private final String wireName;
    private final int severityNumber;

    LogLevel(String wireName, int severityNumber) {
        this.wireName = wireName;
        this.severityNumber = severityNumber;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * OpenTelemetry severity number for this level.
     */
    public int severityNumber() {
        return severityNumber;
    }
}
