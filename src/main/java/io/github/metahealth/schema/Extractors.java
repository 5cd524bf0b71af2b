package io.github.metahealth.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.metahealth.schema.SubfieldExtractor.Observation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Factory methods for the extractors used by the subfield table.
 */
public final class Extractors {

    private Extractors() {
    }

    /**
     * A non-blank text property of the occurrence, observed with its value.
     * The first key that yields text wins.
     */
    public static SubfieldExtractor text(String... keys) {
        return occurrence -> {
            for (String key : keys) {
                String value = textOf(occurrence, key);
                if (value != null) {
                    return List.of(Observation.of(value));
                }
            }
            return Collections.emptyList();
        };
    }

    /**
     * One presence observation per non-empty entry of a nested list. A single
     * non-list value is treated as a one-element list.
     */
    public static SubfieldExtractor entries(String listKey) {
        return occurrence -> {
            List<Observation> observations = new ArrayList<>();
            for (JsonNode entry : entriesOf(occurrence, listKey)) {
                if (!isEmpty(entry)) {
                    observations.add(Observation.present());
                }
            }
            return observations;
        };
    }

    /**
     * One presence observation per nested entry that carries a non-blank identifier.
     */
    public static SubfieldExtractor identifiedEntries(String listKey, String identifierKey) {
        return occurrence -> {
            List<Observation> observations = new ArrayList<>();
            for (JsonNode entry : entriesOf(occurrence, listKey)) {
                if (textOf(entry, identifierKey) != null) {
                    observations.add(Observation.present());
                }
            }
            return observations;
        };
    }

    /**
     * The scheme of each nested entry that carries a non-blank identifier. Entries without
     * an identifier never contribute a scheme.
     */
    public static SubfieldExtractor identifierSchemes(String listKey, String identifierKey, String schemeKey) {
        return occurrence -> {
            List<Observation> observations = new ArrayList<>();
            for (JsonNode entry : entriesOf(occurrence, listKey)) {
                if (textOf(entry, identifierKey) == null) {
                    continue;
                }
                String scheme = textOf(entry, schemeKey);
                if (scheme != null) {
                    observations.add(Observation.of(scheme));
                }
            }
            return observations;
        };
    }

    static List<JsonNode> entriesOf(JsonNode occurrence, String listKey) {
        if (occurrence == null || !occurrence.isObject()) {
            return Collections.emptyList();
        }
        JsonNode node = occurrence.get(listKey);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            return List.of(node);
        }
        List<JsonNode> entries = new ArrayList<>(node.size());
        node.forEach(entries::add);
        return entries;
    }

    static String textOf(JsonNode node, String key) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(key);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static boolean isEmpty(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return true;
        }
        if (node.isTextual()) {
            return node.asText().isEmpty();
        }
        return node.isContainerNode() && node.size() == 0;
    }
}
