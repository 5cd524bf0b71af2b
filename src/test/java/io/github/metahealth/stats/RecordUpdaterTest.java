package io.github.metahealth.stats;

import io.github.metahealth.schema.FieldSpec;
import io.github.metahealth.schema.FieldStatus;
import io.github.metahealth.schema.MetadataSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static io.github.metahealth.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RecordUpdaterTest {

    private final MetadataSchema schema = MetadataSchema.datacite();
    private final RecordUpdater updater = new RecordUpdater(schema);
    private StatsTree tree;

    @BeforeEach
    void setUp() {
        tree = StatsFactory.createEmptyTree(schema);
    }

    @Nested
    @DisplayName("Field presence")
    class Presence {

        @Test
        @DisplayName("Should count a present field once and its array elements as instances")
        void testPresentArray() {
            updater.update(tree, record("{\"titles\":[{\"title\":\"A\"},{\"title\":\"B\"}]}"));

            FieldStats titles = tree.getField("titles");
            assertThat(tree.getRecordCount()).isEqualTo(1);
            assertThat(titles.getCount()).isEqualTo(1);
            assertThat(titles.getInstances()).isEqualTo(2);
            assertThat(titles.getMissing()).isZero();
            assertThat(titles.getCompleteness()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should count a scalar as one instance")
        void testPresentScalar() {
            updater.update(tree, record("{\"publisher\":\"Zenodo\",\"publicationYear\":2021}"));

            assertThat(tree.getField("publisher").getInstances()).isEqualTo(1);
            assertThat(tree.getField("publicationYear").getCount()).isEqualTo(1);
        }

        @ParameterizedTest
        @ValueSource(strings = {"null", "\"\"", "[]", "{}"})
        @DisplayName("Should treat null, empty strings and empty containers as absent")
        void testAbsentValues(String value) {
            updater.update(tree, record("{\"publisher\":" + value + "}"));

            FieldStats publisher = tree.getField("publisher");
            assertThat(publisher.getCount()).isZero();
            assertThat(publisher.getMissing()).isEqualTo(1);
            assertThat(publisher.getCompleteness()).isZero();
        }

        @Test
        @DisplayName("Should keep count + missing equal to the record count")
        void testDenominatorConsistency() {
            updater.update(tree, record("{\"titles\":[{\"title\":\"A\"}]}"));
            updater.update(tree, record("{\"publisher\":\"X\"}"));
            updater.update(tree, record("{\"titles\":[{\"title\":\"C\"}]}"));

            for (FieldStats field : tree.getFields().values()) {
                assertThat(field.getCount() + field.getMissing()).isEqualTo(tree.getRecordCount());
                assertThat(field.getCompleteness())
                        .isCloseTo((double) field.getCount() / tree.getRecordCount(), within(1e-12));
            }
            assertThat(tree.getField("titles").getCompleteness()).isCloseTo(2.0 / 3.0, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Subfields")
    class Subfields {

        @Test
        @DisplayName("Should raise a subfield count by one per record however many occurrences expose it")
        void testCountingBound() {
            updater.update(tree, record("{\"creators\":["
                    + "{\"name\":\"A\",\"nameType\":\"Personal\"},"
                    + "{\"name\":\"B\",\"nameType\":\"Personal\"},"
                    + "{\"name\":\"C\",\"nameType\":\"Organizational\"}]}"));

            FieldStats creators = tree.getField("creators");
            SubfieldStats nameType = creators.getSubfield("nameType");
            assertThat(creators.getInstances()).isEqualTo(3);
            assertThat(nameType.getCount()).isEqualTo(1);
            assertThat(nameType.getInstances()).isEqualTo(3);
            assertThat(nameType.getValueCount("Personal")).isEqualTo(2);
            assertThat(nameType.getValueCount("Organizational")).isEqualTo(1);
            assertThat(creators.getSubfield("affiliation").getCount()).isZero();
            assertThat(creators.getSubfield("affiliation").getMissing()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should count a scheme only for identifiers that are present")
        void testIdentifierDecomposition() {
            updater.update(tree, record("{\"creators\":[{\"name\":\"A\",\"nameIdentifiers\":["
                    + "{\"nameIdentifier\":\"0000-0002-1825-0097\",\"nameIdentifierScheme\":\"ORCID\"},"
                    + "{\"nameIdentifier\":\"\",\"nameIdentifierScheme\":\"ISNI\"}],"
                    + "\"affiliation\":[{\"name\":\"Uni\"},"
                    + "{\"name\":\"Lab\",\"affiliationIdentifier\":\"https://ror.org/1\","
                    + "\"affiliationIdentifierScheme\":\"ROR\"}]}]}"));

            FieldStats creators = tree.getField("creators");
            assertThat(creators.getSubfield("nameIdentifier").getInstances()).isEqualTo(2);

            SubfieldStats scheme = creators.getSubfield("nameIdentifierScheme");
            assertThat(scheme.getCount()).isEqualTo(1);
            assertThat(scheme.getInstances()).isEqualTo(1);
            assertThat(scheme.getValueCount("ORCID")).isEqualTo(1);
            assertThat(scheme.getValueCount("ISNI")).isZero();

            assertThat(creators.getSubfield("affiliation").getInstances()).isEqualTo(2);
            assertThat(creators.getSubfield("affiliationIdentifier").getInstances()).isEqualTo(1);
            assertThat(creators.getSubfield("affiliationIdentifierScheme").getValueCount("ROR")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should collapse unknown values into Other when the enumeration has it")
        void testOtherSentinel() {
            updater.update(tree, record("{\"contributors\":[{\"name\":\"X\",\"contributorType\":\"Wizard\"}]}"));

            SubfieldStats contributorType = tree.getField("contributors").getSubfield("contributorType");
            assertThat(contributorType.getCount()).isEqualTo(1);
            assertThat(contributorType.getValueCount("Other")).isEqualTo(1);
            assertThat(contributorType.getValues()).doesNotContainKey("Wizard");
        }

        @Test
        @DisplayName("Should count unknown values as present but under no value without an Other entry")
        void testUnknownWithoutOther() {
            updater.update(tree, record("{\"creators\":[{\"name\":\"R2\",\"nameType\":\"Robot\"}]}"));

            SubfieldStats nameType = tree.getField("creators").getSubfield("nameType");
            assertThat(nameType.getCount()).isEqualTo(1);
            assertThat(nameType.getInstances()).isEqualTo(1);
            assertThat(nameType.getValues().values()).containsOnly(0L);
        }

        @Test
        @DisplayName("Should read awardURI from either spelling")
        void testAwardUriSpellings() {
            updater.update(tree, record("{\"fundingReferences\":[{\"funderName\":\"F\",\"awardUri\":\"u1\"},"
                    + "{\"funderName\":\"G\",\"awardURI\":\"u2\"}]}"));

            SubfieldStats awardUri = tree.getField("fundingReferences").getSubfield("awardURI");
            assertThat(awardUri.getCount()).isEqualTo(1);
            assertThat(awardUri.getInstances()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Unexpected shapes")
    class Shapes {

        @Test
        @DisplayName("Should skip a repeatable field that is not an array")
        void testRepeatableNotArray() {
            updater.update(tree, record("{\"creators\":\"Alice\",\"titles\":[{\"title\":\"T\"}]}"));

            assertThat(tree.getRecordCount()).isEqualTo(1);
            assertThat(tree.getField("creators").getCount()).isZero();
            assertThat(tree.getField("creators").getMissing()).isEqualTo(1);
            assertThat(tree.getField("titles").getCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should skip a singular composite that is not an object")
        void testSingularNotObject() {
            updater.update(tree, record("{\"resourceType\":[\"Dataset\"]}"));

            assertThat(tree.getField("resourceType").getCount()).isZero();
        }

        @Test
        @DisplayName("Should ignore array elements that are not objects for subfields")
        void testNonObjectElements() {
            updater.update(tree, record("{\"creators\":[\"Alice\",{\"name\":\"Bob\",\"nameType\":\"Personal\"}]}"));

            FieldStats creators = tree.getField("creators");
            assertThat(creators.getCount()).isEqualTo(1);
            assertThat(creators.getInstances()).isEqualTo(2);
            assertThat(creators.getSubfield("nameType").getInstances()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Should roll up categories as the average fill rate of the class")
    void testCategoryRollup() {
        MetadataSchema small = MetadataSchema.of(List.of(
                FieldSpec.simple("a", FieldStatus.MANDATORY),
                FieldSpec.simple("b", FieldStatus.MANDATORY)), Set.of("Dataset"));
        RecordUpdater smallUpdater = new RecordUpdater(small);
        StatsTree smallTree = StatsFactory.createEmptyTree(small);

        smallUpdater.update(smallTree, record("{\"a\":1,\"b\":1}"));
        smallUpdater.update(smallTree, record("{\"a\":1}"));
        smallUpdater.update(smallTree, record("{\"a\":1,\"b\":1}"));
        smallUpdater.update(smallTree, record("{\"a\":1}"));

        assertThat(smallTree.getCategories().getMandatory()).isEqualTo(0.75);
        assertThat(smallTree.getCategories().getRecommended()).isZero();
        assertThat(smallTree.getCategories().getOptional()).isZero();
    }

    @Nested
    @DisplayName("Entity updates")
    class EntityUpdates {

        @Test
        @DisplayName("Should update the summary and the tree of a known resource type")
        void testKnownResourceType() {
            EntityStats stats = StatsFactory.createEmptyEntityStats(schema);

            updater.updateEntity(stats, record("{\"resourceType\":{\"resourceTypeGeneral\":\"Dataset\"},"
                    + "\"titles\":[{\"title\":\"T\"}]}"));

            assertThat(stats.getSummary().getRecordCount()).isEqualTo(1);
            assertThat(stats.getResourceType("Dataset").getRecordCount()).isEqualTo(1);
            assertThat(stats.getResourceType("Dataset").getField("titles").getCount()).isEqualTo(1);
            assertThat(stats.getResourceType("Software").getRecordCount()).isZero();
            assertThat(stats.getSummary().getField("resourceType").getSubfield("resourceTypeGeneral")
                    .getValueCount("Dataset")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should only update the summary for an unknown resource type")
        void testUnknownResourceType() {
            EntityStats stats = StatsFactory.createPartialEntityStats(schema);

            updater.updateEntity(stats, record("{\"resourceType\":{\"resourceTypeGeneral\":\"Spaceship\"}}"));

            assertThat(stats.getSummary().getRecordCount()).isEqualTo(1);
            assertThat(stats.getByResourceType()).isEmpty();
        }

        @Test
        @DisplayName("Should create the resource type tree of a partial on first use")
        void testPartialCreatesTree() {
            EntityStats stats = StatsFactory.createPartialEntityStats(schema);

            updater.updateEntity(stats, record("{\"resourceType\":{\"resourceTypeGeneral\":\"Software\"}}"));

            assertThat(stats.getByResourceType()).containsOnlyKeys("Software");
        }
    }
}
