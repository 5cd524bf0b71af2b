package io.github.metahealth.stats;

import io.github.metahealth.schema.FieldSpec;
import io.github.metahealth.schema.MetadataSchema;
import io.github.metahealth.schema.SubfieldSpec;

/**
 * Builds zeroed statistics structures for a schema.
 *
 * <p>Enumerated subfields start with every permitted value at zero so that updates and merges
 * never have to create value keys.</p>
 */
public final class StatsFactory {

    private StatsFactory() {
    }

    public static StatsTree createEmptyTree(MetadataSchema schema) {
        StatsTree tree = new StatsTree();
        for (FieldSpec spec : schema.getFields()) {
            tree.putField(spec.getName(), createEmptyField(spec));
        }
        tree.recomputeDerived();
        return tree;
    }

    public static EntityStats createEmptyEntityStats(MetadataSchema schema) {
        EntityStats stats = new EntityStats(createEmptyTree(schema));
        for (String resourceType : schema.getResourceTypes()) {
            stats.putResourceType(resourceType, createEmptyTree(schema));
        }
        return stats;
    }

    /**
     * Entity statistics holding only a summary; resource type trees are added as records of
     * that type arrive. Used for per-file partial results.
     */
    public static EntityStats createPartialEntityStats(MetadataSchema schema) {
        return new EntityStats(createEmptyTree(schema));
    }

    static FieldStats createEmptyField(FieldSpec spec) {
        FieldStats field = new FieldStats(spec.getStatus(), spec.hasSubfields());
        for (SubfieldSpec subfield : spec.getSubfields()) {
            field.putSubfield(subfield.getName(), subfield.isEnumerated()
                    ? SubfieldStats.enumerated(subfield.getPermittedValues())
                    : SubfieldStats.presenceOnly());
        }
        return field;
    }
}
