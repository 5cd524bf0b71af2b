package io.github.metahealth.files;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import static io.github.metahealth.TestRecords.writeGzipLines;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GzipJsonLineReaderTest {

    @TempDir
    Path tempDir;

    private static List<JsonNode> readAll(GzipJsonLineReader reader) {
        List<JsonNode> values = new ArrayList<>();
        reader.forEachRemaining(values::add);
        return values;
    }

    @Test
    @DisplayName("Should decode one JSON value per line and skip blank lines")
    void testReadsLines() throws IOException {
        Path file = writeGzipLines(tempDir.resolve("a.jsonl.gz"),
                List.of("{\"id\":1}", "", "   ", "{\"id\":2}"));

        try (GzipJsonLineReader reader = GzipJsonLineReader.open(file)) {
            List<JsonNode> values = readAll(reader);

            assertThat(values).extracting(v -> v.get("id").asInt()).containsExactly(1, 2);
            assertThat(reader.getLineNumber()).isEqualTo(4);
            assertThat(reader.getMalformedLines()).isZero();
        }
    }

    @Test
    @DisplayName("Should skip undecodable lines and continue")
    void testSkipsMalformedLines() throws IOException {
        Path file = writeGzipLines(tempDir.resolve("bad.jsonl.gz"),
                List.of("{\"id\":1}", "{not json", "{\"id\":3}"));

        try (GzipJsonLineReader reader = GzipJsonLineReader.open(file)) {
            assertThat(readAll(reader)).hasSize(2);
            assertThat(reader.getMalformedLines()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should read a last line without trailing newline")
    void testNoTrailingNewline() throws IOException {
        Path plain = Files.writeString(tempDir.resolve("plain.jsonl"), "{\"id\":1}\n{\"id\":2}");

        try (GzipJsonLineReader reader = GzipJsonLineReader.open(plain)) {
            assertThat(readAll(reader)).hasSize(2);
        }
    }

    @Test
    @DisplayName("Should throw NoSuchElementException when exhausted")
    void testExhausted() throws IOException {
        Path file = writeGzipLines(tempDir.resolve("empty.jsonl.gz"), List.of());

        try (GzipJsonLineReader reader = GzipJsonLineReader.open(file)) {
            assertThat(reader.hasNext()).isFalse();
            assertThatThrownBy(reader::next).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Test
    @DisplayName("Should reject a file that is not gzip")
    void testNotGzip() throws IOException {
        Path file = Files.writeString(tempDir.resolve("fake.jsonl.gz"), "{\"id\":1}\n");

        assertThatThrownBy(() -> GzipJsonLineReader.open(file)).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should surface a truncated stream as UncheckedIOException")
    void testTruncatedStream() throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 5000; i++) {
            lines.add("{\"id\":" + i + ",\"padding\":\"" + i * 7919L + "\"}");
        }
        Path full = writeGzipLines(tempDir.resolve("full.jsonl.gz"), lines);
        byte[] bytes = Files.readAllBytes(full);
        Path truncated = Files.write(tempDir.resolve("truncated.jsonl.gz"), Arrays.copyOf(bytes, bytes.length / 2));

        try (GzipJsonLineReader reader = GzipJsonLineReader.open(truncated)) {
            assertThatThrownBy(() -> readAll(reader)).isInstanceOf(UncheckedIOException.class);
        }
    }
}
