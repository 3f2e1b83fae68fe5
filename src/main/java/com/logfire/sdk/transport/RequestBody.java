package com.logfire.sdk.transport;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Request payload, either buffered with a known length or streamed as chunks whose
 * total is only known once they have all been produced.
 */
public final class RequestBody {

    private final byte[] bytes;
    private final Iterable<byte[]> chunks;

    private RequestBody(byte[] bytes, Iterable<byte[]> chunks) {
        this.bytes = bytes;
        this.chunks = chunks;
    }

    public static RequestBody ofBytes(byte[] bytes) {
        return new RequestBody(Objects.requireNonNull(bytes, "bytes are required"), null);
    }

    public static RequestBody ofString(String text) {
        return ofBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Streamed body. The iterable may be consumed only once.
     */
    public static RequestBody ofChunks(Iterable<byte[]> chunks) {
        return new RequestBody(null, Objects.requireNonNull(chunks, "chunks are required"));
    }

    public boolean isBuffered() {
        return bytes != null;
    }

    /**
     * Length of a buffered body, or -1 for a streamed one.
     */
    public long knownLength() {
        return bytes != null ? bytes.length : -1;
    }

    /**
     * The body as chunks; a buffered body is a single chunk.
     */
    public Iterable<byte[]> chunks() {
        return bytes != null ? List.of(bytes) : chunks;
    }

    /**
     * The buffered bytes.
     *
     * @throws IllegalStateException for a streamed body
     */
    public byte[] bytes() {
        if (bytes == null) {
            throw new IllegalStateException("Streamed body has no buffered bytes");
        }
        return bytes;
    }
}
