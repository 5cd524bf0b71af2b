package io.github.metahealth.files;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

/**
 * Reads a gzip-compressed file holding one JSON value per line.
 *
 * <p>Iteration is lazy and single-pass. Blank lines are skipped, and a line that does not decode
 * is logged and skipped. I/O failures while reading surface as {@link UncheckedIOException}.</p>
 */
public class GzipJsonLineReader implements Iterator<JsonNode>, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(GzipJsonLineReader.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path path;
    private final BufferedReader reader;
    private JsonNode next;
    private long lineNumber;
    private long malformedLines;
    private boolean exhausted;

    private GzipJsonLineReader(Path path, BufferedReader reader) {
        this.path = path;
        this.reader = reader;
    }

    /**
     * Opens a reader over the given file. Files whose name does not end in {@code .gz} are read
     * uncompressed.
     */
    public static GzipJsonLineReader open(Path path) throws IOException {
        InputStream is = new BufferedInputStream(Files.newInputStream(path), BUFFER_SIZE);
        try {
            if (path.getFileName().toString().endsWith(".gz")) {
                is = new GZIPInputStream(is, BUFFER_SIZE);
            }
        } catch (IOException e) {
            is.close();
            throw e;
        }
        return new GzipJsonLineReader(path,
                new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8)));
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        next = readNext();
        return next != null;
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more records in " + path);
        }
        JsonNode value = next;
        next = null;
        return value;
    }

    private JsonNode readNext() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    return OBJECT_MAPPER.readTree(line);
                } catch (JsonProcessingException e) {
                    malformedLines++;
                    LOG.warn("Error decoding JSON in {} at line {}: {}", path, lineNumber, e.getOriginalMessage());
                }
            }
            exhausted = true;
            return null;
        } catch (IOException e) {
            exhausted = true;
            throw new UncheckedIOException("Failed reading " + path + " at line " + lineNumber, e);
        }
    }

    /**
     * Number of physical lines consumed so far.
     */
    public long getLineNumber() {
        return lineNumber;
    }

    public long getMalformedLines() {
        return malformedLines;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
