package io.github.metahealth.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Pulls the observations of one subfield out of a single field occurrence.
 *
 * <p>An occurrence is one element of a repeatable composite field, or the value of a
 * singular composite field. Implementations must tolerate any JSON shape and return an
 * empty list when the subfield is not exposed.</p>
 */
@FunctionalInterface
public interface SubfieldExtractor {

    List<Observation> extract(JsonNode occurrence);

    /**
     * One exposure of a subfield inside an occurrence. The value is null for
     * presence-only observations.
     */
    record Observation(String value) {

        private static final Observation PRESENT = new Observation(null);

        public static Observation present() {
            return PRESENT;
        }

        public static Observation of(String value) {
            return new Observation(value);
        }

        public boolean hasValue() {
            return value != null;
        }
    }
}
