package io.github.metahealth.pipeline;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.metahealth.stats.EntityStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Processes input files in parallel and reduces their partial statistics into an
 * {@link EntityCatalog}.
 *
 * <p>Workers never touch the catalog. Each file result is merged on the calling thread as soon
 * as it completes, so all shared state has exactly one writer.</p>
 */
public class AggregationDriver {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationDriver.class);

    private final FileProcessor fileProcessor;
    private final int workers;

    public AggregationDriver(FileProcessor fileProcessor, int workers) {
        Preconditions.checkArgument(workers > 0, "workers must be positive: %s", workers);
        this.fileProcessor = fileProcessor;
        this.workers = workers;
    }

    /**
     * Aggregates the given files into the catalog, then finalizes it: inactive entries are
     * dropped, the aggregate entries are added and every tree is pruned and rounded.
     *
     * @throws AggregationException if the calling thread is interrupted; the catalog is then
     *                              left incomplete
     */
    public AggregationMetrics run(List<Path> files, EntityCatalog catalog, int scale) {
        AggregationMetrics metrics = aggregate(files, catalog);
        finalizeCatalog(catalog, scale);
        return metrics;
    }

    public AggregationMetrics aggregate(List<Path> files, EntityCatalog catalog) {
        AggregationMetrics metrics = new AggregationMetrics(files.size());
        if (files.isEmpty()) {
            return metrics;
        }

        Stopwatch stopwatch = Stopwatch.createStarted();
        int poolSize = Math.min(workers, files.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new ThreadFactoryBuilder()
                .setNameFormat("file-worker-%d")
                .setDaemon(true)
                .build());
        LOG.info("Processing {} files with {} workers", files.size(), poolSize);

        try {
            CompletionService<FileResult> completionService = new ExecutorCompletionService<>(executor);
            Map<Future<FileResult>, Path> pending = new HashMap<>();
            for (Path file : files) {
                pending.put(completionService.submit(() -> fileProcessor.processFile(file)), file);
            }

            for (int i = 0; i < files.size(); i++) {
                Future<FileResult> future = completionService.take();
                Path file = pending.remove(future);
                try {
                    FileResult result = future.get();
                    reduce(result, catalog, metrics);
                    metrics.record(result);
                    LOG.info("Completed {}/{} files ({}): {} findable records, {} skipped",
                            metrics.getCompletedFiles(), files.size(), file.getFileName(),
                            result.getFindableRecords(), result.getSkippedRecords());
                } catch (ExecutionException e) {
                    metrics.recordFailure();
                    LOG.error("Error processing file {}: {}", file, e.getCause().getMessage(), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new AggregationException("Interrupted while aggregating files", e);
        } finally {
            shutdown(executor);
        }

        metrics.setElapsed(stopwatch.elapsed());
        LOG.info("Aggregation finished: {}", metrics);
        return metrics;
    }

    private static void reduce(FileResult result, EntityCatalog catalog, AggregationMetrics metrics) {
        for (Map.Entry<String, EntityStats> entry : result.getClientStats().entrySet()) {
            if (!catalog.mergeClientStats(entry.getKey(), entry.getValue())) {
                metrics.recordUnknownId();
            }
        }
        for (Map.Entry<String, EntityStats> entry : result.getProviderStats().entrySet()) {
            if (!catalog.mergeProviderStats(entry.getKey(), entry.getValue())) {
                metrics.recordUnknownId();
            }
        }
    }

    /**
     * Drops inactive entries, adds the aggregate entries and finalizes every tree, in that order.
     */
    public static void finalizeCatalog(EntityCatalog catalog, int scale) {
        catalog.filterActiveOnly();
        catalog.createAggregateEntries();
        catalog.finalizeAll(scale);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
