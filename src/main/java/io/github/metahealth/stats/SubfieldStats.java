package io.github.metahealth.stats;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Completeness counters for one subfield of one field within a {@link StatsTree}.
 *
 * <p>{@code values} is present only for enumerated subfields and maps each categorical value
 * to the number of observations classified under it.</p>
 */
public final class SubfieldStats {

    private long count;
    private long instances;
    private long missing;
    private double completeness;
    private final Map<String, Long> values;

    private SubfieldStats(Map<String, Long> values) {
        this.values = values;
    }

    public static SubfieldStats presenceOnly() {
        return new SubfieldStats(null);
    }

    public static SubfieldStats enumerated(Collection<String> permittedValues) {
        Map<String, Long> values = new TreeMap<>();
        for (String value : permittedValues) {
            values.put(value, 0L);
        }
        return new SubfieldStats(values);
    }

    static SubfieldStats withValues(boolean enumerated) {
        return new SubfieldStats(enumerated ? new TreeMap<>() : null);
    }

    public long getCount() {
        return count;
    }

    public long getInstances() {
        return instances;
    }

    public long getMissing() {
        return missing;
    }

    public double getCompleteness() {
        return completeness;
    }

    public boolean hasValues() {
        return values != null;
    }

    /**
     * Returns a read-only view of the value counters, or null for presence-only subfields.
     */
    public Map<String, Long> getValues() {
        return values == null ? null : Collections.unmodifiableMap(values);
    }

    public long getValueCount(String value) {
        if (values == null) {
            return 0L;
        }
        return values.getOrDefault(value, 0L);
    }

    void incrementCount() {
        count++;
    }

    void addInstances(long n) {
        instances += n;
    }

    void incrementValue(String value) {
        values.merge(value, 1L, Long::sum);
    }

    void addValue(String value, long n) {
        values.merge(value, n, Long::sum);
    }

    void setCounts(long count, long instances) {
        this.count = count;
        this.instances = instances;
    }

    void recompute(long totalRecords) {
        missing = totalRecords - count;
        completeness = Ratios.completeness(count, totalRecords);
    }

    void dropZeroValues() {
        if (values != null) {
            values.values().removeIf(v -> v == 0L);
        }
    }

    void roundCompleteness(int scale) {
        completeness = Ratios.round(completeness, scale);
    }

    SubfieldStats copy() {
        SubfieldStats copy = new SubfieldStats(values == null ? null : new TreeMap<>(values));
        copy.count = count;
        copy.instances = instances;
        copy.missing = missing;
        copy.completeness = completeness;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubfieldStats)) return false;
        SubfieldStats that = (SubfieldStats) o;
        return count == that.count
                && instances == that.instances
                && missing == that.missing
                && Double.compare(completeness, that.completeness) == 0
                && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, instances, missing, completeness, values);
    }

    @Override
    public String toString() {
        return "SubfieldStats[count=" + count + ", instances=" + instances + ", missing=" + missing
                + ", completeness=" + completeness + (values != null ? ", values=" + values : "") + "]";
    }
}
