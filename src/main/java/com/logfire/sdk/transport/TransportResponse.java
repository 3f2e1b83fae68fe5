package com.logfire.sdk.transport;

/**
 * Status and body of a completed HTTP exchange.
 */
public record TransportResponse(int statusCode, String body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
