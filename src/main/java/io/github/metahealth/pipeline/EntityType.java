package io.github.metahealth.pipeline;

/**
 * Kind of entity statistics are reported for, with its name in the output documents.
 */
public enum EntityType {
    PROVIDER("providers"),
    CLIENT("clients");

    private final String wireName;

    EntityType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
