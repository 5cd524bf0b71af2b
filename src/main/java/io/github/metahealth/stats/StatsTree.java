package io.github.metahealth.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Completeness statistics of one record population: all records of an entity, or the records
 * of one resource type.
 */
public final class StatsTree {

    private long recordCount;
    private final Map<String, FieldStats> fields;
    private CategoryMetrics categories;

    StatsTree() {
        this.fields = new LinkedHashMap<>();
        this.categories = CategoryMetrics.empty();
    }

    public long getRecordCount() {
        return recordCount;
    }

    public Map<String, FieldStats> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public FieldStats getField(String name) {
        return fields.get(name);
    }

    public CategoryMetrics getCategories() {
        return categories;
    }

    void putField(String name, FieldStats stats) {
        fields.put(name, stats);
    }

    void incrementRecordCount() {
        recordCount++;
    }

    void setRecordCount(long recordCount) {
        this.recordCount = recordCount;
    }

    /**
     * Rewrites every derived value (missing, completeness, categories) from the counters and the
     * current record count.
     */
    void recomputeDerived() {
        for (FieldStats field : fields.values()) {
            field.recompute(recordCount);
        }
        categories = CategoryMetrics.compute(fields, recordCount);
    }

    void dropZeroValues() {
        fields.values().forEach(FieldStats::dropZeroValues);
    }

    void roundCompleteness(int scale) {
        for (FieldStats field : fields.values()) {
            field.roundCompleteness(scale);
        }
        categories = categories.rounded(scale);
    }

    StatsTree copy() {
        StatsTree copy = new StatsTree();
        copy.recordCount = recordCount;
        fields.forEach((name, stats) -> copy.fields.put(name, stats.copy()));
        copy.categories = categories;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatsTree)) return false;
        StatsTree that = (StatsTree) o;
        return recordCount == that.recordCount
                && fields.equals(that.fields)
                && categories.equals(that.categories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordCount, fields, categories);
    }

    @Override
    public String toString() {
        return "StatsTree[records=" + recordCount + ", fields=" + fields.size() + ", " + categories + "]";
    }
}
