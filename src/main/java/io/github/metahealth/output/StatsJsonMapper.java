package io.github.metahealth.output;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.metahealth.pipeline.EntityEntry;
import io.github.metahealth.pipeline.EntityType;
import io.github.metahealth.schema.FieldStatus;
import io.github.metahealth.stats.CategoryMetrics;
import io.github.metahealth.stats.EntityStats;
import io.github.metahealth.stats.FieldStats;
import io.github.metahealth.stats.StatsTree;
import io.github.metahealth.stats.SubfieldStats;

import java.util.Map;

/**
 * Converts entity entries and their statistics to the JSON layout of the output documents.
 */
public final class StatsJsonMapper {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private StatsJsonMapper() {
    }

    /**
     * {@code {id, type, attributes, relationships}} of an entry.
     */
    public static ObjectNode toAttributesDocument(EntityEntry entry) {
        ObjectNode node = NODES.objectNode();
        node.put("id", entry.getId());
        node.put("type", entry.getType().getWireName());
        node.set("attributes", entry.getAttributes().deepCopy());
        node.set("relationships", relationships(entry));
        return node;
    }

    /**
     * {@code {id, stats}} of an entry.
     */
    public static ObjectNode toStatsDocument(EntityEntry entry) {
        ObjectNode node = NODES.objectNode();
        node.put("id", entry.getId());
        node.set("stats", toJson(entry.getStats()));
        return node;
    }

    private static ObjectNode relationships(EntityEntry entry) {
        ObjectNode relationships = NODES.objectNode();
        if (entry.getType() == EntityType.PROVIDER) {
            ArrayNode clients = relationships.putArray("clients");
            entry.getClientIds().forEach(clients::add);
        } else {
            relationships.put("provider", entry.getProviderId());
        }
        return relationships;
    }

    public static ObjectNode toJson(EntityStats stats) {
        ObjectNode node = NODES.objectNode();
        node.set("summary", toJson(stats.getSummary()));

        ObjectNode resourceTypes = NODES.objectNode();
        for (Map.Entry<String, StatsTree> entry : stats.getByResourceType().entrySet()) {
            resourceTypes.set(entry.getKey(), toJson(entry.getValue()));
        }
        node.putObject("byResourceType").set("resourceTypes", resourceTypes);
        return node;
    }

    public static ObjectNode toJson(StatsTree tree) {
        ObjectNode node = NODES.objectNode();
        node.put("count", tree.getRecordCount());

        ObjectNode fields = node.putObject("fields");
        for (Map.Entry<String, FieldStats> entry : tree.getFields().entrySet()) {
            fields.set(entry.getKey(), toJson(entry.getValue()));
        }

        node.set("categories", toJson(tree.getCategories()));
        return node;
    }

    static ObjectNode toJson(FieldStats field) {
        ObjectNode node = NODES.objectNode();
        node.put("count", field.getCount());
        node.put("instances", field.getInstances());
        node.put("fieldStatus", field.getFieldStatus().getLabel());
        node.put("completeness", field.getCompleteness());
        node.put("missing", field.getMissing());

        if (field.hasSubfields()) {
            ObjectNode subfields = node.putObject("subfields");
            for (Map.Entry<String, SubfieldStats> entry : field.getSubfields().entrySet()) {
                subfields.set(entry.getKey(), toJson(entry.getValue()));
            }
        }
        return node;
    }

    static ObjectNode toJson(SubfieldStats subfield) {
        ObjectNode node = NODES.objectNode();
        node.put("count", subfield.getCount());
        node.put("instances", subfield.getInstances());
        node.put("missing", subfield.getMissing());
        node.put("completeness", subfield.getCompleteness());

        if (subfield.hasValues()) {
            ObjectNode values = node.putObject("values");
            for (Map.Entry<String, Long> entry : subfield.getValues().entrySet()) {
                values.put(entry.getKey(), entry.getValue());
            }
        }
        return node;
    }

    static ObjectNode toJson(CategoryMetrics categories) {
        ObjectNode node = NODES.objectNode();
        for (FieldStatus status : FieldStatus.values()) {
            node.putObject(status.getLabel()).put("completeness", categories.get(status));
        }
        return node;
    }
}
