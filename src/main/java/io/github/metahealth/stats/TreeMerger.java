package io.github.metahealth.stats;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Combines statistics computed independently over disjoint record sets.
 *
 * <p>Merging never mutates its inputs: the result is a fresh structure. Counters are summed and
 * every derived value is recomputed against the merged record count, which makes the merge
 * associative and commutative.</p>
 */
public final class TreeMerger {

    private TreeMerger() {
    }

    public static StatsTree mergeTrees(StatsTree a, StatsTree b) {
        StatsTree merged = new StatsTree();
        merged.setRecordCount(a.getRecordCount() + b.getRecordCount());

        Set<String> fieldNames = new LinkedHashSet<>(a.getFields().keySet());
        fieldNames.addAll(b.getFields().keySet());

        for (String name : fieldNames) {
            FieldStats left = a.getField(name);
            FieldStats right = b.getField(name);
            if (left == null) {
                merged.putField(name, right.copy());
            } else if (right == null) {
                merged.putField(name, left.copy());
            } else {
                merged.putField(name, mergeFields(left, right));
            }
        }

        merged.recomputeDerived();
        return merged;
    }

    /**
     * Merges summaries and the per-resource-type trees key by key. A resource type present on
     * one side only is merged against an empty tree.
     */
    public static EntityStats mergeEntityStats(EntityStats a, EntityStats b) {
        EntityStats merged = new EntityStats(mergeTrees(a.getSummary(), b.getSummary()));

        Set<String> resourceTypes = new TreeSet<>(a.getByResourceType().keySet());
        resourceTypes.addAll(b.getByResourceType().keySet());

        for (String resourceType : resourceTypes) {
            StatsTree left = a.getResourceType(resourceType);
            StatsTree right = b.getResourceType(resourceType);
            merged.putResourceType(resourceType, mergeTrees(
                    left != null ? left : new StatsTree(),
                    right != null ? right : new StatsTree()));
        }
        return merged;
    }

    private static FieldStats mergeFields(FieldStats a, FieldStats b) {
        FieldStats merged = new FieldStats(
                a.getFieldStatus() != null ? a.getFieldStatus() : b.getFieldStatus(),
                a.hasSubfields() || b.hasSubfields());
        merged.setCounts(a.getCount() + b.getCount(), a.getInstances() + b.getInstances());

        if (merged.hasSubfields()) {
            Set<String> subfieldNames = new LinkedHashSet<>();
            if (a.hasSubfields()) {
                subfieldNames.addAll(a.getSubfields().keySet());
            }
            if (b.hasSubfields()) {
                subfieldNames.addAll(b.getSubfields().keySet());
            }
            for (String name : subfieldNames) {
                merged.putSubfield(name, mergeSubfields(a.getSubfield(name), b.getSubfield(name)));
            }
        }
        return merged;
    }

    private static SubfieldStats mergeSubfields(SubfieldStats a, SubfieldStats b) {
        if (a == null) {
            return b.copy();
        }
        if (b == null) {
            return a.copy();
        }

        SubfieldStats merged = SubfieldStats.withValues(a.hasValues() || b.hasValues());
        merged.setCounts(a.getCount() + b.getCount(), a.getInstances() + b.getInstances());
        addValues(merged, a.getValues());
        addValues(merged, b.getValues());
        return merged;
    }

    private static void addValues(SubfieldStats target, Map<String, Long> values) {
        if (values == null) {
            return;
        }
        values.forEach(target::addValue);
    }
}
