package com.logfire.sdk.core.model;

/**
 * Static source location of the instrumented call site.
 *
 * @param filepath source file name, or {@code null} when unknown
 * @param lineno   line number, or -1 when unknown
 * @param function method name
 */
public record CodeLocation(String filepath, int lineno, String function) {

    private static final CodeLocation UNKNOWN = new CodeLocation(null, -1, null);

    public static CodeLocation unknown() {
        return UNKNOWN;
    }

    public boolean isKnown() {
        return filepath != null || function != null;
    }
}
