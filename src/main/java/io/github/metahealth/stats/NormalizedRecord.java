package io.github.metahealth.stats;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A metadata record reduced to the tracked field names. Absent fields read as
 * {@link MissingNode}.
 */
public final class NormalizedRecord {

    private final Map<String, JsonNode> values;

    private NormalizedRecord(Map<String, JsonNode> values) {
        this.values = values;
    }

    public static NormalizedRecord of(Map<String, JsonNode> values) {
        return new NormalizedRecord(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public JsonNode get(String fieldName) {
        JsonNode value = values.get(fieldName);
        return value == null ? MissingNode.getInstance() : value;
    }

    /**
     * The general resource type of the record, read from the {@code resourceType} field which
     * is either a composite carrying {@code resourceTypeGeneral} or a bare string.
     */
    public String resourceTypeGeneral() {
        JsonNode resourceType = get("resourceType");
        if (resourceType.isObject()) {
            JsonNode general = resourceType.get("resourceTypeGeneral");
            return general != null && general.isTextual() ? general.asText() : null;
        }
        if (resourceType.isTextual()) {
            return resourceType.asText();
        }
        return null;
    }

    @Override
    public String toString() {
        return "NormalizedRecord" + values;
    }
}
