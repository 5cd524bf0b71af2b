package io.github.metahealth.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
import io.github.metahealth.pipeline.EntityEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Writes the four output documents of a run.
 *
 * <p>Each document has the form {@code {"data": [...], "meta": {"total": n, "timestamp": t}}}.
 * All items are validated before the first file is written, so a validation failure leaves the
 * output directory untouched.</p>
 */
public class StatsOutputWriter {

    private static final Logger LOG = LoggerFactory.getLogger(StatsOutputWriter.class);

    public static final String PROVIDERS_ATTRIBUTES = "providers_attributes.json";
    public static final String PROVIDERS_STATS = "providers_stats.json";
    public static final String CLIENTS_ATTRIBUTES = "clients_attributes.json";
    public static final String CLIENTS_STATS = "clients_stats.json";

    static final Set<String> ATTRIBUTE_KEYS = ImmutableSet.of("id", "type", "attributes", "relationships");
    static final Set<String> STATS_KEYS = ImmutableSet.of("id", "stats");

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Clock clock;

    public StatsOutputWriter() {
        this(Clock.systemDefaultZone());
    }

    public StatsOutputWriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Writes the documents for the given entries into {@code outputDir}, creating it if needed.
     *
     * @return the written files
     * @throws OutputWriteException if an item lacks a required key or a file cannot be written
     */
    public List<Path> write(Collection<EntityEntry> providers, Collection<EntityEntry> clients, Path outputDir) {
        Map<String, List<ObjectNode>> documents = new LinkedHashMap<>();
        documents.put(PROVIDERS_ATTRIBUTES, map(providers, StatsJsonMapper::toAttributesDocument));
        documents.put(PROVIDERS_STATS, map(providers, StatsJsonMapper::toStatsDocument));
        documents.put(CLIENTS_ATTRIBUTES, map(clients, StatsJsonMapper::toAttributesDocument));
        documents.put(CLIENTS_STATS, map(clients, StatsJsonMapper::toStatsDocument));
        return writeDocuments(documents, outputDir);
    }

    List<Path> writeDocuments(Map<String, List<ObjectNode>> documents, Path outputDir) {
        for (Map.Entry<String, List<ObjectNode>> document : documents.entrySet()) {
            validate(document.getKey(), document.getValue(), requiredKeys(document.getKey()));
        }

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new OutputWriteException(outputDir.toString(), "Cannot create output directory", e);
        }

        String timestamp = LocalDateTime.now(clock).toString();
        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, List<ObjectNode>> document : documents.entrySet()) {
            Path file = outputDir.resolve(document.getKey());
            ObjectNode root = envelope(document.getValue(), timestamp);
            try {
                OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
            } catch (IOException e) {
                throw new OutputWriteException(file.toString(), "Cannot write output document", e);
            }
            LOG.info("Wrote {} items to {}", document.getValue().size(), file);
            written.add(file);
        }
        return written;
    }

    private static ObjectNode envelope(List<ObjectNode> items, String timestamp) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        ArrayNode data = root.putArray("data");
        items.forEach(data::add);
        ObjectNode meta = root.putObject("meta");
        meta.put("total", items.size());
        meta.put("timestamp", timestamp);
        return root;
    }

    /**
     * Checks that every item carries the required keys.
     *
     * @throws OutputWriteException naming the document and the first missing key
     */
    static void validate(String document, List<? extends JsonNode> items, Set<String> requiredKeys) {
        for (JsonNode item : items) {
            for (String key : requiredKeys) {
                if (!item.has(key)) {
                    throw new OutputWriteException(document, "Missing required field '" + key + "' in item "
                            + item.path("id").asText("<no id>"), null);
                }
            }
        }
    }

    private static Set<String> requiredKeys(String document) {
        return document.endsWith("_stats.json") ? STATS_KEYS : ATTRIBUTE_KEYS;
    }

    private static List<ObjectNode> map(Collection<EntityEntry> entries, Function<EntityEntry, ObjectNode> mapper) {
        List<ObjectNode> items = new ArrayList<>(entries.size());
        for (EntityEntry entry : entries) {
            items.add(mapper.apply(entry));
        }
        return items;
    }
}
