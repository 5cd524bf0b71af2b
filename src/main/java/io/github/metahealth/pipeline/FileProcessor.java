package io.github.metahealth.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.metahealth.files.GzipJsonLineReader;
import io.github.metahealth.stats.EntityStats;
import io.github.metahealth.stats.NormalizedRecord;
import io.github.metahealth.stats.RecordUpdater;
import io.github.metahealth.stats.StatsFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Folds the findable records of one input file into per-client and per-provider partial
 * statistics.
 *
 * <p>Each call works on its own maps, so one processor can serve all worker threads.</p>
 */
public class FileProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(FileProcessor.class);

    static final String FINDABLE = "findable";

    private final RecordUpdater updater;

    public FileProcessor(RecordUpdater updater) {
        this.updater = updater;
    }

    /**
     * Processes one file. Read failures are logged and produce a result without records.
     */
    public FileResult processFile(Path path) {
        Map<String, EntityStats> clients = new HashMap<>();
        Map<String, EntityStats> providers = new HashMap<>();
        long findable = 0;
        long skipped = 0;

        try (GzipJsonLineReader reader = GzipJsonLineReader.open(path)) {
            while (reader.hasNext()) {
                JsonNode item = reader.next();
                if (processRecord(item, clients, providers, reader.getLineNumber(), path)) {
                    findable++;
                } else {
                    skipped++;
                }
            }
            return new FileResult(path, clients, providers, findable, skipped, reader.getMalformedLines(), false);
        } catch (IOException | UncheckedIOException e) {
            LOG.error("Error processing file {}: {}", path, e.getMessage());
            return FileResult.failed(path);
        }
    }

    private boolean processRecord(JsonNode item, Map<String, EntityStats> clients,
                                  Map<String, EntityStats> providers, long lineNumber, Path path) {
        if (!FINDABLE.equals(item.path("attributes").path("state").asText(null))) {
            return false;
        }

        String clientId = relationshipId(item, "client");
        String providerId = relationshipId(item, "provider");
        if (clientId == null && providerId == null) {
            LOG.warn("Record at {}:{} has neither client nor provider, skipping", path.getFileName(), lineNumber);
            return false;
        }

        NormalizedRecord record;
        try {
            record = RecordNormalizer.normalize(item);
        } catch (RuntimeException e) {
            LOG.warn("Skipping malformed record at {}:{}: {}", path.getFileName(), lineNumber, e.getMessage());
            return false;
        }

        if (clientId != null) {
            updater.updateEntity(clients.computeIfAbsent(clientId, this::newPartial), record);
        }
        if (providerId != null) {
            updater.updateEntity(providers.computeIfAbsent(providerId, this::newPartial), record);
        }
        return true;
    }

    private EntityStats newPartial(String id) {
        return StatsFactory.createPartialEntityStats(updater.getSchema());
    }

    static String relationshipId(JsonNode item, String relationship) {
        JsonNode id = item.path("relationships").path(relationship).path("data").path("id");
        if (!id.isTextual() || id.asText().isEmpty()) {
            return null;
        }
        return id.asText();
    }
}
