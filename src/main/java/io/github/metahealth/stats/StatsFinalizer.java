package io.github.metahealth.stats;

import java.util.Iterator;
import java.util.Map;

/**
 * Prepares merged statistics for output: drops resource types without records and value
 * counters at zero, then rounds every completeness ratio.
 */
public final class StatsFinalizer {

    public static final int DEFAULT_SCALE = 4;

    private StatsFinalizer() {
    }

    public static void finalizeStats(EntityStats stats) {
        finalizeStats(stats, DEFAULT_SCALE);
    }

    public static void finalizeStats(EntityStats stats, int scale) {
        pruneEmptyResourceTypes(stats);

        finalizeTree(stats.getSummary(), scale);
        for (StatsTree tree : stats.resourceTypes().values()) {
            finalizeTree(tree, scale);
        }
    }

    static void pruneEmptyResourceTypes(EntityStats stats) {
        Iterator<Map.Entry<String, StatsTree>> it = stats.resourceTypes().entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().getRecordCount() == 0) {
                it.remove();
            }
        }
    }

    private static void finalizeTree(StatsTree tree, int scale) {
        tree.dropZeroValues();
        tree.roundCompleteness(scale);
    }
}
