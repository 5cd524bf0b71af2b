package io.github.metahealth.pipeline;

import com.google.common.collect.ImmutableMap;
import io.github.metahealth.stats.EntityStats;

import java.nio.file.Path;
import java.util.Map;

/**
 * Partial statistics of one input file, keyed by client and provider id.
 *
 * <p>A result is handed from the worker that built it to the reducing thread and is not
 * modified afterwards.</p>
 */
public final class FileResult {

    private final Path path;
    private final ImmutableMap<String, EntityStats> clientStats;
    private final ImmutableMap<String, EntityStats> providerStats;
    private final long findableRecords;
    private final long skippedRecords;
    private final long malformedLines;
    private final boolean failed;

    FileResult(Path path, Map<String, EntityStats> clientStats, Map<String, EntityStats> providerStats,
               long findableRecords, long skippedRecords, long malformedLines, boolean failed) {
        this.path = path;
        this.clientStats = ImmutableMap.copyOf(clientStats);
        this.providerStats = ImmutableMap.copyOf(providerStats);
        this.findableRecords = findableRecords;
        this.skippedRecords = skippedRecords;
        this.malformedLines = malformedLines;
        this.failed = failed;
    }

    /**
     * Result of a file that could not be read; it contributes no records.
     */
    static FileResult failed(Path path) {
        return new FileResult(path, ImmutableMap.of(), ImmutableMap.of(), 0, 0, 0, true);
    }

    public Path getPath() {
        return path;
    }

    public Map<String, EntityStats> getClientStats() {
        return clientStats;
    }

    public Map<String, EntityStats> getProviderStats() {
        return providerStats;
    }

    public long getFindableRecords() {
        return findableRecords;
    }

    public long getSkippedRecords() {
        return skippedRecords;
    }

    public long getMalformedLines() {
        return malformedLines;
    }

    public boolean isFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return "FileResult[" + path.getFileName() + ", findable=" + findableRecords
                + ", skipped=" + skippedRecords + ", malformed=" + malformedLines
                + ", clients=" + clientStats.size() + ", providers=" + providerStats.size() + "]";
    }
}
