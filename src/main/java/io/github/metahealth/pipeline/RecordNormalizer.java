package io.github.metahealth.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import io.github.metahealth.stats.NormalizedRecord;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a raw API record onto the tracked field names.
 *
 * <p>Field values are read from the record's {@code attributes} object, or from the record
 * itself when it has none. A tracked field whose source attribute is missing stays absent.</p>
 */
public final class RecordNormalizer {

    /**
     * Tracked field name to source attribute name.
     */
    static final ImmutableMap<String, String> FIELD_SOURCES = ImmutableMap.<String, String>builder()
            .put("identifier", "doi")
            .put("creators", "creators")
            .put("titles", "titles")
            .put("publisher", "publisher")
            .put("publicationYear", "publicationYear")
            .put("resourceType", "types")
            .put("subjects", "subjects")
            .put("contributors", "contributors")
            .put("date", "dates")
            .put("relatedIdentifiers", "relatedIdentifiers")
            .put("description", "descriptions")
            .put("geoLocations", "geoLocations")
            .put("language", "language")
            .put("alternateIdentifiers", "alternateIdentifiers")
            .put("sizes", "sizes")
            .put("formats", "formats")
            .put("version", "version")
            .put("rights", "rightsList")
            .put("fundingReferences", "fundingReferences")
            .put("relatedItems", "relatedItems")
            .build();

    private RecordNormalizer() {
    }

    public static NormalizedRecord normalize(JsonNode item) {
        JsonNode attributes = item.has("attributes") ? item.get("attributes") : item;

        Map<String, JsonNode> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> source : FIELD_SOURCES.entrySet()) {
            JsonNode value = attributes.get(source.getValue());
            if (value != null) {
                values.put(source.getKey(), value);
            }
        }
        return NormalizedRecord.of(values);
    }
}
