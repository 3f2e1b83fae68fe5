package com.logfire.sdk.export;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Collection;

/**
 * Append-only durable store for batches that could not be sent.
 *
 * <p>File layout: the header {@code "LOGFIRE BACKUP FILE\n"} followed by a 4-byte
 * big-endian format version, then one record per batch: a 4-byte big-endian length and
 * that many bytes of an OTLP protobuf {@code ExportTraceServiceRequest}. The header is
 * written only when the file is new or empty, so a restarted process keeps appending to
 * the same file. Each batch is forced to disk before {@link #export} returns.</p>
 *
 * <p>Before its first append the exporter scans the existing records and truncates a
 * partial trailing record left by a crash, so that the next record starts on a record
 * boundary.</p>
 */
public class FileSpanExporter implements SpanExporter {
    private static final Logger log = LoggerFactory.getLogger(FileSpanExporter.class);

    static final byte[] HEADER = "LOGFIRE BACKUP FILE\n".getBytes(StandardCharsets.UTF_8);
    static final int VERSION = 1;

    private static final int LENGTH_PREFIX = 4;
    private static final byte[] PREAMBLE = ByteBuffer.allocate(HEADER.length + 4).put(HEADER).putInt(VERSION).array();

    private final Path path;
    private boolean recovered;

    public FileSpanExporter(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized CompletableResultCode export(Collection<SpanData> spans) {
        try {
            write(OtlpTraceEncoder.encode(spans));
            return CompletableResultCode.ofSuccess();
        } catch (IOException e) {
            log.error("fallback.write_failed path={} batchSize={}", path, spans.size(), e);
            return CompletableResultCode.ofFailure();
        }
    }

    @Override
    public CompletableResultCode flush() {
        return CompletableResultCode.ofSuccess();
    }

    @Override
    public CompletableResultCode shutdown() {
        return CompletableResultCode.ofSuccess();
    }

    private void write(byte[] payload) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            if (!recovered) {
                truncateToLastRecord(channel);
                recovered = true;
            }
            long size = channel.size();
            boolean isNew = size == 0;
            ByteBuffer buffer = ByteBuffer.allocate((isNew ? PREAMBLE.length : 0) + LENGTH_PREFIX + payload.length);
            if (isNew) {
                buffer.put(PREAMBLE);
            }
            buffer.putInt(payload.length).put(payload);
            buffer.flip();
            long position = size;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
            channel.force(true);
        }
    }

    /**
     * Cuts the file back to the end of its last complete record.
     *
     * @throws IOException if the file exists but is not a backup file of this version
     */
    private void truncateToLastRecord(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0) {
            return;
        }
        if (size < PREAMBLE.length) {
            byte[] partial = read(channel, 0, (int) size);
            if (!Arrays.equals(partial, Arrays.copyOf(PREAMBLE, (int) size))) {
                throw new IOException("Not a Logfire backup file: " + path);
            }
            log.warn("fallback.truncated_header path={} bytes={}", path, size);
            channel.truncate(0);
            return;
        }
        if (!Arrays.equals(read(channel, 0, PREAMBLE.length), PREAMBLE)) {
            throw new IOException("Not a Logfire backup file of version " + VERSION + ": " + path);
        }

        long position = PREAMBLE.length;
        while (position + LENGTH_PREFIX <= size) {
            int length = ByteBuffer.wrap(read(channel, position, LENGTH_PREFIX)).getInt();
            if (length < 0 || position + LENGTH_PREFIX + length > size) {
                break;
            }
            position += LENGTH_PREFIX + length;
        }
        if (position < size) {
            log.warn("fallback.truncated_tail path={} keptBytes={} discardedBytes={}", path, position, size - position);
            channel.truncate(position);
        }
    }

    private static byte[] read(FileChannel channel, long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, position + buffer.position()) < 0) {
                throw new EOFException("Unexpected end of backup file");
            }
        }
        return buffer.array();
    }
}
