package io.github.metahealth.stats;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.metahealth.schema.FieldSpec;
import io.github.metahealth.schema.MetadataSchema;
import io.github.metahealth.schema.SubfieldExtractor.Observation;
import io.github.metahealth.schema.SubfieldSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds normalized records into statistics trees, one record at a time.
 *
 * <p>Instances are stateless apart from the schema and may be shared between threads as long
 * as each tree is only updated by one thread.</p>
 */
public class RecordUpdater {

    private static final Logger LOG = LoggerFactory.getLogger(RecordUpdater.class);

    private final MetadataSchema schema;

    public RecordUpdater(MetadataSchema schema) {
        this.schema = schema;
    }

    public MetadataSchema getSchema() {
        return schema;
    }

    /**
     * Updates the summary of an entity and, when the record's general resource type is one of
     * the schema's resource types, the tree of that resource type.
     */
    public void updateEntity(EntityStats stats, NormalizedRecord record) {
        update(stats.getSummary(), record);

        String resourceType = record.resourceTypeGeneral();
        if (schema.isKnownResourceType(resourceType)) {
            StatsTree typeTree = stats.resourceTypes()
                    .computeIfAbsent(resourceType, t -> StatsFactory.createEmptyTree(schema));
            update(typeTree, record);
        }
    }

    /**
     * Adds one record to a tree and recomputes its derived values.
     */
    public void update(StatsTree tree, NormalizedRecord record) {
        tree.incrementRecordCount();

        for (FieldSpec spec : schema.getFields()) {
            FieldStats fieldStats = tree.getField(spec.getName());
            if (fieldStats == null) {
                fieldStats = StatsFactory.createEmptyField(spec);
                tree.putField(spec.getName(), fieldStats);
            }
            updateField(spec, fieldStats, record.get(spec.getName()));
        }

        tree.recomputeDerived();
    }

    private void updateField(FieldSpec spec, FieldStats fieldStats, JsonNode value) {
        if (!isPresent(value)) {
            return;
        }

        List<JsonNode> occurrences = occurrencesOf(spec, value);
        if (occurrences == null) {
            LOG.warn("Skipping field '{}': expected {} but found {}",
                    spec.getName(), expectedShape(spec), value.getNodeType());
            return;
        }

        fieldStats.incrementCount();
        fieldStats.addInstances(value.isArray() ? value.size() : 1);

        if (spec.hasSubfields()) {
            updateSubfields(spec, fieldStats, occurrences);
        }
    }

    /**
     * Returns the occurrences of a present value, or null when the value has the wrong shape
     * for the field.
     */
    private static List<JsonNode> occurrencesOf(FieldSpec spec, JsonNode value) {
        switch (spec.getShape()) {
            case SIMPLE:
                return Collections.singletonList(value);
            case SINGULAR_COMPOSITE:
                return value.isObject() ? Collections.singletonList(value) : null;
            case REPEATABLE_COMPOSITE:
                if (!value.isArray()) {
                    return null;
                }
                List<JsonNode> elements = new ArrayList<>(value.size());
                value.forEach(elements::add);
                return elements;
            default:
                throw new IllegalStateException("Unknown shape: " + spec.getShape());
        }
    }

    private static void updateSubfields(FieldSpec spec, FieldStats fieldStats, List<JsonNode> occurrences) {
        Set<String> seen = new HashSet<>();

        for (JsonNode occurrence : occurrences) {
            if (!occurrence.isObject()) {
                continue;
            }
            for (SubfieldSpec subfield : spec.getSubfields()) {
                List<Observation> observations = subfield.getExtractor().extract(occurrence);
                if (observations.isEmpty()) {
                    continue;
                }

                SubfieldStats stats = fieldStats.getSubfield(subfield.getName());
                if (seen.add(subfield.getName())) {
                    stats.incrementCount();
                }
                stats.addInstances(observations.size());

                if (subfield.isEnumerated()) {
                    for (Observation observation : observations) {
                        String bucket = subfield.classify(observation.value());
                        if (bucket != null) {
                            stats.incrementValue(bucket);
                        }
                    }
                }
            }
        }
    }

    /**
     * A value is present when it is a non-empty scalar, a non-empty object or a non-empty array.
     */
    static boolean isPresent(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        if (value.isContainerNode()) {
            return value.size() > 0;
        }
        return true;
    }

    private static String expectedShape(FieldSpec spec) {
        return spec.getShape() == FieldSpec.Shape.REPEATABLE_COMPOSITE ? "ARRAY" : "OBJECT";
    }
}
