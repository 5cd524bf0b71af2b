package io.github.metahealth.pipeline;

import java.time.Duration;

/**
 * Counters of one aggregation run. Observational only; nothing reads them to make decisions.
 */
public final class AggregationMetrics {

    private final int totalFiles;
    private int completedFiles;
    private int failedFiles;
    private long findableRecords;
    private long skippedRecords;
    private long malformedLines;
    private long unknownIds;
    private Duration elapsed = Duration.ZERO;

    AggregationMetrics(int totalFiles) {
        this.totalFiles = totalFiles;
    }

    void record(FileResult result) {
        completedFiles++;
        if (result.isFailed()) {
            failedFiles++;
        }
        findableRecords += result.getFindableRecords();
        skippedRecords += result.getSkippedRecords();
        malformedLines += result.getMalformedLines();
    }

    void recordFailure() {
        completedFiles++;
        failedFiles++;
    }

    void recordUnknownId() {
        unknownIds++;
    }

    void setElapsed(Duration elapsed) {
        this.elapsed = elapsed;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public int getCompletedFiles() {
        return completedFiles;
    }

    public int getFailedFiles() {
        return failedFiles;
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

    public long getUnknownIds() {
        return unknownIds;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return String.format("AggregationMetrics{files=%d/%d, failed=%d, findable=%d, skipped=%d, " +
                        "malformed=%d, unknownIds=%d, elapsed=%dms}",
                completedFiles, totalFiles, failedFiles, findableRecords, skippedRecords,
                malformedLines, unknownIds, elapsed.toMillis());
    }
}
