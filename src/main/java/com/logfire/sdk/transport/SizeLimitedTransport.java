package com.logfire.sdk.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Rejects request bodies whose size reaches {@code maxBodySize} before they reach the
 * wrapped transport.
 *
 * <p>Buffered bodies are checked by length. Streamed bodies are counted chunk by chunk
 * as they are produced and rejected at the first chunk that brings the running total to
 * the limit; accepted streams are handed on buffered.</p>
 */
public class SizeLimitedTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(SizeLimitedTransport.class);

    public static final long DEFAULT_MAX_BODY_SIZE = 5L * 1024 * 1024;

    private final HttpTransport delegate;
    private final long maxBodySize;

    public SizeLimitedTransport(HttpTransport delegate) {
        this(delegate, DEFAULT_MAX_BODY_SIZE);
    }

    public SizeLimitedTransport(HttpTransport delegate, long maxBodySize) {
        if (maxBodySize <= 0) {
            throw new IllegalArgumentException("maxBodySize must be positive");
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.maxBodySize = maxBodySize;
    }

    @Override
    public TransportResponse post(URI uri, Map<String, String> headers, RequestBody body) {
        RequestBody checked = body.isBuffered() ? checkBuffered(body) : drainStream(body);
        return delegate.post(uri, headers, checked);
    }

    public long getMaxBodySize() {
        return maxBodySize;
    }

    private RequestBody checkBuffered(RequestBody body) {
        long size = body.knownLength();
        if (size >= maxBodySize) {
            throw tooLarge(size);
        }
        return body;
    }

    private RequestBody drainStream(RequestBody body) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        long size = 0;
        for (byte[] chunk : body.chunks()) {
            size += chunk.length;
            if (size >= maxBodySize) {
                throw tooLarge(size);
            }
            buffer.write(chunk, 0, chunk.length);
        }
        return RequestBody.ofBytes(buffer.toByteArray());
    }

    private BodyTooLargeException tooLarge(long size) {
        log.warn("transport.body_too_large size={} maxSize={}", size, maxBodySize);
        return new BodyTooLargeException(size, maxBodySize);
    }
}
