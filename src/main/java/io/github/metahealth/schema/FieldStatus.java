package io.github.metahealth.schema;

/**
 * Classification of a tracked field, used for the category rollups.
 */
public enum FieldStatus {
    MANDATORY("mandatory"),
    RECOMMENDED("recommended"),
    OPTIONAL("optional");

    private final String label;

    FieldStatus(String label) {
        this.label = label;
    }

    /**
     * Returns the lower-case name used in serialized statistics.
     */
    public String getLabel() {
        return label;
    }

    public static FieldStatus fromLabel(String label) {
        for (FieldStatus status : values()) {
            if (status.label.equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown field status: " + label);
    }
}
