package io.github.metahealth.stats;

import io.github.metahealth.schema.FieldStatus;
import io.github.metahealth.schema.MetadataSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatsFactoryTest {

    private final MetadataSchema schema = MetadataSchema.datacite();

    @Test
    @DisplayName("Should create a zeroed tree with every field in schema order")
    void testEmptyTree() {
        StatsTree tree = StatsFactory.createEmptyTree(schema);

        assertThat(tree.getRecordCount()).isZero();
        assertThat(tree.getFields()).hasSize(20);
        assertThat(tree.getFields().keySet()).startsWith("identifier", "creators", "titles");
        assertThat(tree.getCategories()).isEqualTo(CategoryMetrics.empty());

        FieldStats titles = tree.getField("titles");
        assertThat(titles.getFieldStatus()).isEqualTo(FieldStatus.MANDATORY);
        assertThat(titles.getCount()).isZero();
        assertThat(titles.getMissing()).isZero();
        assertThat(titles.getCompleteness()).isZero();
        assertThat(titles.hasSubfields()).isFalse();
    }

    @Test
    @DisplayName("Should pre-populate enumerated subfields with every permitted value at zero")
    void testEnumeratedValuesPrePopulated() {
        StatsTree tree = StatsFactory.createEmptyTree(schema);

        SubfieldStats nameType = tree.getField("creators").getSubfield("nameType");
        assertThat(nameType.getValues()).containsOnlyKeys("Personal", "Organizational");
        assertThat(nameType.getValues().values()).containsOnly(0L);

        SubfieldStats resourceTypeGeneral = tree.getField("resourceType").getSubfield("resourceTypeGeneral");
        assertThat(resourceTypeGeneral.getValues()).hasSize(28);

        SubfieldStats affiliation = tree.getField("creators").getSubfield("affiliation");
        assertThat(affiliation.hasValues()).isFalse();
        assertThat(affiliation.getValues()).isNull();
    }

    @Test
    @DisplayName("Should create one empty tree per known resource type")
    void testEmptyEntityStats() {
        EntityStats stats = StatsFactory.createEmptyEntityStats(schema);

        assertThat(stats.getSummary()).isEqualTo(StatsFactory.createEmptyTree(schema));
        assertThat(stats.getByResourceType()).hasSize(28).containsKey("Dataset");
        assertThat(stats.getResourceType("Software").getRecordCount()).isZero();
    }

    @Test
    @DisplayName("Should create partials without resource type trees")
    void testPartialEntityStats() {
        EntityStats partial = StatsFactory.createPartialEntityStats(schema);

        assertThat(partial.getByResourceType()).isEmpty();
        assertThat(partial.getSummary().getFields()).hasSize(20);
    }

    @Test
    @DisplayName("Should be deterministic")
    void testDeterministic() {
        assertThat(StatsFactory.createEmptyEntityStats(schema))
                .isEqualTo(StatsFactory.createEmptyEntityStats(schema));
    }
}
