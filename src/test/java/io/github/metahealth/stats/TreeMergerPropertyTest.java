package io.github.metahealth.stats;

import io.github.metahealth.schema.MetadataSchema;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.ArrayList;
import java.util.List;

import static io.github.metahealth.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for merging statistics trees.
 *
 * Records are drawn from a pool covering simple, repeatable and singular fields, enumerated
 * values, unknown values and badly shaped input.
 */
class TreeMergerPropertyTest {

    private static final MetadataSchema SCHEMA = MetadataSchema.datacite();
    private static final RecordUpdater UPDATER = new RecordUpdater(SCHEMA);

    private static final List<String> POOL = List.of(
            "{}",
            "{\"identifier\":\"10.1/a\",\"titles\":[{\"title\":\"A\"}],\"publisher\":\"P\"}",
            "{\"identifier\":\"10.1/b\",\"publicationYear\":2020,\"subjects\":[{\"subject\":\"s\"}]}",
            "{\"creators\":[{\"name\":\"A\",\"nameType\":\"Personal\",\"nameIdentifiers\":["
                    + "{\"nameIdentifier\":\"0000\",\"nameIdentifierScheme\":\"ORCID\"}]},"
                    + "{\"name\":\"B\",\"nameType\":\"Organizational\"}]}",
            "{\"creators\":[{\"name\":\"C\",\"nameType\":\"Robot\",\"affiliation\":[{\"name\":\"U\","
                    + "\"affiliationIdentifier\":\"g\",\"affiliationIdentifierScheme\":\"GRID\"}]}]}",
            "{\"contributors\":[{\"contributorType\":\"Editor\"},{\"contributorType\":\"Wizard\"}]}",
            "{\"resourceType\":{\"resourceTypeGeneral\":\"Dataset\"},\"version\":\"1\"}",
            "{\"resourceType\":{\"resourceTypeGeneral\":\"Software\"},\"rights\":[{\"rights\":\"CC0\"}]}",
            "{\"resourceType\":{\"resourceTypeGeneral\":\"Starship\"}}",
            "{\"relatedIdentifiers\":[{\"relationType\":\"IsCitedBy\",\"relatedIdentifierType\":\"DOI\","
                    + "\"resourceTypeGeneral\":\"Text\"}]}",
            "{\"fundingReferences\":[{\"funderName\":\"F\",\"funderIdentifierType\":\"ROR\",\"awardUri\":\"u\"}]}",
            "{\"creators\":\"not a list\",\"resourceType\":\"Dataset\",\"language\":\"en\"}"
    );

    @Provide
    Arbitrary<List<String>> records() {
        return Arbitraries.of(POOL).list().ofMaxSize(12);
    }

    private static StatsTree treeOf(List<String> records) {
        StatsTree tree = StatsFactory.createEmptyTree(SCHEMA);
        for (String json : records) {
            UPDATER.update(tree, record(json));
        }
        return tree;
    }

    private static EntityStats partialOf(List<String> records) {
        EntityStats stats = StatsFactory.createPartialEntityStats(SCHEMA);
        for (String json : records) {
            UPDATER.updateEntity(stats, record(json));
        }
        return stats;
    }

    @Property
    @Label("mergeTrees is commutative")
    void commutative(@ForAll("records") List<String> a, @ForAll("records") List<String> b) {
        StatsTree left = treeOf(a);
        StatsTree right = treeOf(b);

        assertThat(TreeMerger.mergeTrees(left, right)).isEqualTo(TreeMerger.mergeTrees(right, left));
    }

    @Property
    @Label("mergeTrees is associative")
    void associative(@ForAll("records") List<String> a, @ForAll("records") List<String> b,
                     @ForAll("records") List<String> c) {
        StatsTree ta = treeOf(a);
        StatsTree tb = treeOf(b);
        StatsTree tc = treeOf(c);

        assertThat(TreeMerger.mergeTrees(TreeMerger.mergeTrees(ta, tb), tc))
                .isEqualTo(TreeMerger.mergeTrees(ta, TreeMerger.mergeTrees(tb, tc)));
    }

    @Property
    @Label("merging partial trees equals updating one tree with all records")
    void mergeEqualsSequentialUpdate(@ForAll("records") List<String> a, @ForAll("records") List<String> b) {
        List<String> all = new ArrayList<>(a);
        all.addAll(b);

        assertThat(TreeMerger.mergeTrees(treeOf(a), treeOf(b))).isEqualTo(treeOf(all));
    }

    @Property
    @Label("merging entity partials equals updating one entity with all records")
    void entityMergeEqualsSequentialUpdate(@ForAll("records") List<String> a, @ForAll("records") List<String> b) {
        EntityStats direct = StatsFactory.createEmptyEntityStats(SCHEMA);
        for (String json : a) {
            UPDATER.updateEntity(direct, record(json));
        }
        for (String json : b) {
            UPDATER.updateEntity(direct, record(json));
        }

        EntityStats merged = TreeMerger.mergeEntityStats(
                TreeMerger.mergeEntityStats(StatsFactory.createEmptyEntityStats(SCHEMA), partialOf(b)),
                partialOf(a));

        assertThat(merged).isEqualTo(direct);
    }

    @Property
    @Label("count + missing equals the record count after merging")
    void denominatorConsistency(@ForAll("records") List<String> a, @ForAll("records") List<String> b) {
        StatsTree merged = TreeMerger.mergeTrees(treeOf(a), treeOf(b));

        for (FieldStats field : merged.getFields().values()) {
            assertThat(field.getCount()).isLessThanOrEqualTo(merged.getRecordCount());
            assertThat(field.getCount() + field.getMissing()).isEqualTo(merged.getRecordCount());
            assertThat(field.getCompleteness()).isBetween(0.0, 1.0);
            if (field.hasSubfields()) {
                for (SubfieldStats subfield : field.getSubfields().values()) {
                    assertThat(subfield.getCount() + subfield.getMissing()).isEqualTo(merged.getRecordCount());
                    assertThat(subfield.getCount()).isLessThanOrEqualTo(field.getCount());
                }
            }
        }
    }
}
