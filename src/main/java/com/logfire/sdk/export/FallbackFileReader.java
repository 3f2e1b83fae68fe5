package com.logfire.sdk.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Replays a file written by {@link FileSpanExporter}, batch by batch in write order.
 * Each batch is the protobuf {@code ExportTraceServiceRequest} that would have been posted
 * to the collector. A truncated trailing record, left by a crash mid-write, is skipped with
 * a warning.
 */
public class FallbackFileReader {
    private static final Logger log = LoggerFactory.getLogger(FallbackFileReader.class);

    private final Path path;

    public FallbackFileReader(Path path) {
        this.path = path;
    }

    /**
     * Raw OTLP protobuf payloads, one per batch.
     *
     * @throws IOException if the file cannot be read or does not start with the backup header
     */
    public List<byte[]> readBatches() throws IOException {
        List<byte[]> batches = new ArrayList<>();
        try (InputStream file = Files.newInputStream(path);
             DataInputStream in = new DataInputStream(new BufferedInputStream(file))) {
            readHeader(in);
            while (true) {
                int length;
                try {
                    length = in.readInt();
                } catch (EOFException e) {
                    break;
                }
                if (length < 0) {
                    throw new IOException("Corrupt record length " + length + " in " + path);
                }
                byte[] payload = in.readNBytes(length);
                if (payload.length < length) {
                    log.warn("fallback.truncated_record path={} expected={} actual={}", path, length, payload.length);
                    break;
                }
                batches.add(payload);
            }
        }
        return batches;
    }

    private void readHeader(DataInputStream in) throws IOException {
        byte[] header = in.readNBytes(FileSpanExporter.HEADER.length);
        if (!Arrays.equals(header, FileSpanExporter.HEADER)) {
            throw new IOException("Not a Logfire backup file: " + path);
        }
        int version;
        try {
            version = in.readInt();
        } catch (EOFException e) {
            throw new IOException("Missing format version in " + path, e);
        }
        if (version != FileSpanExporter.VERSION) {
            throw new IOException("Unsupported backup file version " + version + " in " + path);
        }
    }
}
