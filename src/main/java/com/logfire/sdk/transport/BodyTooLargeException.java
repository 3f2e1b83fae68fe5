package com.logfire.sdk.transport;

/**
 * Raised by {@link SizeLimitedTransport} when a request body reaches the configured limit.
 * Nothing is sent when this is thrown.
 */
public class BodyTooLargeException extends ExportTransportException {

    private final long size;
    private final long maxSize;

    public BodyTooLargeException(long size, long maxSize) {
        super("Request body is too large (" + size + " bytes), must be less than " + maxSize + " bytes.");
        this.size = size;
        this.maxSize = maxSize;
    }

    /**
     * Bytes observed when the limit was hit. For streamed bodies this is the running
     * total at the chunk that crossed the limit.
     */
    public long getSize() {
        return size;
    }

    public long getMaxSize() {
        return maxSize;
    }
}
