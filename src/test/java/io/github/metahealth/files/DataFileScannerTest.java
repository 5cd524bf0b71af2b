package io.github.metahealth.files;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DataFileScannerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should find matching files recursively in sorted order")
    void testRecursiveDiscovery() throws IOException {
        Files.createDirectories(tempDir.resolve("2024/02"));
        Files.createDirectories(tempDir.resolve("2023"));
        Files.writeString(tempDir.resolve("2024/02/b.jsonl.gz"), "");
        Files.writeString(tempDir.resolve("2023/a.jsonl.gz"), "");
        Files.writeString(tempDir.resolve("2023/notes.txt"), "");
        Files.writeString(tempDir.resolve("2023/c.jsonl"), "");

        List<Path> files = new DataFileScanner().discover(tempDir);

        assertThat(files).containsExactly(
                tempDir.resolve("2023/a.jsonl.gz"),
                tempDir.resolve("2024/02/b.jsonl.gz"));
    }

    @Test
    @DisplayName("Should skip directories whose name matches the suffix")
    void testSkipsDirectories() throws IOException {
        Files.createDirectories(tempDir.resolve("odd.jsonl.gz"));

        assertThat(new DataFileScanner().discover(tempDir)).isEmpty();
    }

    @Test
    @DisplayName("Should honour a custom suffix")
    void testCustomSuffix() throws IOException {
        Files.writeString(tempDir.resolve("a.jsonl"), "");
        Files.writeString(tempDir.resolve("b.jsonl.gz"), "");

        assertThat(new DataFileScanner(".jsonl").discover(tempDir))
                .containsExactly(tempDir.resolve("a.jsonl"));
    }

    @Test
    @DisplayName("Should return an empty list for a missing or non-directory root")
    void testMissingRoot() throws IOException {
        Path file = Files.writeString(tempDir.resolve("file.jsonl.gz"), "");

        assertThat(new DataFileScanner().discover(tempDir.resolve("missing"))).isEmpty();
        assertThat(new DataFileScanner().discover(file)).isEmpty();
        assertThat(new DataFileScanner().discover(null)).isEmpty();
    }
}
