package com.logfire.sdk.export;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FileSpanExporter Tests")
class FileSpanExporterTest {

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("backup").resolve("logfire.bin");
    }

    private static void truncateBy(Path path, int bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            channel.truncate(channel.size() - bytes);
        }
    }

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        @DisplayName("Should create the file with the header, version and one record")
        void firstBatch() throws IOException {
            FileSpanExporter exporter = new FileSpanExporter(file);

            assertTrue(exporter.export(TestRecords.spans(2)).isSuccess());

            byte[] bytes = Files.readAllBytes(file);
            byte[] header = Arrays.copyOf(bytes, FileSpanExporter.HEADER.length);
            assertEquals("LOGFIRE BACKUP FILE\n", new String(header, StandardCharsets.UTF_8));
            ByteBuffer rest = ByteBuffer.wrap(bytes, header.length, bytes.length - header.length);
            assertEquals(1, rest.getInt());
            int length = rest.getInt();
            assertEquals(rest.remaining(), length);
        }

        @Test
        @DisplayName("Should append to an existing file without repeating the header")
        void restartAppends() throws IOException {
            new FileSpanExporter(file).export(TestRecords.spans(1));
            new FileSpanExporter(file).export(List.of(TestRecords.span("second", 9)));

            List<byte[]> batches = new FallbackFileReader(file).readBatches();
            assertEquals(2, batches.size());
            assertEquals(List.of("span-1", "second"), TestRecords.names(batches));
        }

        @Test
        @DisplayName("Should report failure when the path cannot be written")
        void unwritable() throws IOException {
            Path directory = Files.createDirectory(tempDir.resolve("taken"));

            assertFalse(new FileSpanExporter(directory).export(TestRecords.spans(1)).isSuccess());
        }

        @Test
        @DisplayName("Should refuse to append to a file that is not a backup file")
        void foreignFile() throws IOException {
            Files.createDirectories(file.getParent());
            byte[] foreign = "some other file that happens to be here".getBytes(StandardCharsets.UTF_8);
            Files.write(file, foreign);

            assertFalse(new FileSpanExporter(file).export(TestRecords.spans(1)).isSuccess());
            assertArrayEquals(foreign, Files.readAllBytes(file));
        }
    }

    @Nested
    @DisplayName("Crash recovery")
    class CrashRecovery {

        @Test
        @DisplayName("Should keep earlier batches replayable after a truncated tail and a restart append")
        void truncatedTailThenRestart() throws IOException {
            FileSpanExporter crashed = new FileSpanExporter(file);
            crashed.export(List.of(TestRecords.span("first", 1)));
            crashed.export(List.of(TestRecords.span("torn", 2)));
            truncateBy(file, 5);

            assertTrue(new FileSpanExporter(file).export(List.of(TestRecords.span("after-restart", 3))).isSuccess());

            assertEquals(List.of("first", "after-restart"), TestRecords.names(new FallbackFileReader(file).readBatches()));
        }

        @Test
        @DisplayName("Should drop a torn length prefix before appending")
        void tornLengthPrefix() throws IOException {
            new FileSpanExporter(file).export(List.of(TestRecords.span("first", 1)));
            Files.write(file, new byte[]{0, 0}, StandardOpenOption.APPEND);

            new FileSpanExporter(file).export(List.of(TestRecords.span("second", 2)));

            assertEquals(List.of("first", "second"), TestRecords.names(new FallbackFileReader(file).readBatches()));
        }

        @Test
        @DisplayName("Should rewrite a header cut short by a crash")
        void tornHeader() throws IOException {
            Files.createDirectories(file.getParent());
            Files.write(file, Arrays.copyOf(FileSpanExporter.HEADER, 7));

            new FileSpanExporter(file).export(List.of(TestRecords.span("only", 1)));

            assertEquals(List.of("only"), TestRecords.names(new FallbackFileReader(file).readBatches()));
        }
    }

    @Nested
    @DisplayName("Reading back")
    class ReadingBack {

        @Test
        @DisplayName("Should store the batch as an OTLP protobuf request")
        void protobufPayload() throws IOException {
            new FileSpanExporter(file).export(TestRecords.spans(3));

            List<byte[]> batches = new FallbackFileReader(file).readBatches();
            assertEquals(1, batches.size());
            assertEquals(List.of("span-1", "span-2", "span-3"), TestRecords.names(batches.get(0)));
            assertEquals("span", TestRecords.decode(batches.get(0)).get(0).getAttributesList().stream()
                    .filter(kv -> kv.getKey().equals("logfire.span_type"))
                    .findFirst().orElseThrow()
                    .getValue().getStringValue());
        }

        @Test
        @DisplayName("Should skip a truncated trailing record")
        void truncatedTail() throws IOException {
            new FileSpanExporter(file).export(TestRecords.spans(1));
            Files.write(file, new byte[]{0, 0, 0, 100, 10, 3}, StandardOpenOption.APPEND);

            assertEquals(1, new FallbackFileReader(file).readBatches().size());
        }

        @Test
        @DisplayName("Should reject a file without the backup header")
        void badHeader() throws IOException {
            Files.createDirectories(file.getParent());
            Files.write(file, "something else entirely".getBytes(StandardCharsets.UTF_8));

            assertThrows(IOException.class, () -> new FallbackFileReader(file).readBatches());
        }

        @Test
        @DisplayName("Should reject an unknown format version")
        void badVersion() throws IOException {
            Files.createDirectories(file.getParent());
            ByteBuffer buffer = ByteBuffer.allocate(FileSpanExporter.HEADER.length + 4);
            buffer.put(FileSpanExporter.HEADER).putInt(7);
            Files.write(file, buffer.array());

            IOException e = assertThrows(IOException.class, () -> new FallbackFileReader(file).readBatches());
            assertTrue(e.getMessage().contains("version 7"));
        }
    }
}
