package io.github.metahealth.stats;

import io.github.metahealth.schema.FieldStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Completeness counters for one field within a {@link StatsTree}.
 *
 * <p>{@code count} is the number of records in which the field is present and
 * {@code instances} the number of occurrences across those records. {@code missing} and
 * {@code completeness} are derived from {@code count} and the owning tree's record count
 * and are only ever written by {@link #recompute(long)}.</p>
 */
public final class FieldStats {

    private final FieldStatus fieldStatus;
    private long count;
    private long instances;
    private long missing;
    private double completeness;
    private final Map<String, SubfieldStats> subfields;

    FieldStats(FieldStatus fieldStatus, boolean trackSubfields) {
        this.fieldStatus = fieldStatus;
        this.subfields = trackSubfields ? new LinkedHashMap<>() : null;
    }

    public FieldStatus getFieldStatus() {
        return fieldStatus;
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

    public boolean hasSubfields() {
        return subfields != null;
    }

    /**
     * Returns a read-only view of the subfield statistics, or null when the field has no
     * subfield tracking.
     */
    public Map<String, SubfieldStats> getSubfields() {
        return subfields == null ? null : Collections.unmodifiableMap(subfields);
    }

    public SubfieldStats getSubfield(String name) {
        return subfields == null ? null : subfields.get(name);
    }

    void putSubfield(String name, SubfieldStats stats) {
        subfields.put(name, stats);
    }

    void incrementCount() {
        count++;
    }

    void addInstances(long n) {
        instances += n;
    }

    void setCounts(long count, long instances) {
        this.count = count;
        this.instances = instances;
    }

    void recompute(long totalRecords) {
        missing = totalRecords - count;
        completeness = Ratios.completeness(count, totalRecords);
        if (subfields != null) {
            for (SubfieldStats subfield : subfields.values()) {
                subfield.recompute(totalRecords);
            }
        }
    }

    void dropZeroValues() {
        if (subfields != null) {
            subfields.values().forEach(SubfieldStats::dropZeroValues);
        }
    }

    void roundCompleteness(int scale) {
        completeness = Ratios.round(completeness, scale);
        if (subfields != null) {
            for (SubfieldStats subfield : subfields.values()) {
                subfield.roundCompleteness(scale);
            }
        }
    }

    FieldStats copy() {
        FieldStats copy = new FieldStats(fieldStatus, subfields != null);
        copy.count = count;
        copy.instances = instances;
        copy.missing = missing;
        copy.completeness = completeness;
        if (subfields != null) {
            subfields.forEach((name, stats) -> copy.subfields.put(name, stats.copy()));
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldStats)) return false;
        FieldStats that = (FieldStats) o;
        return count == that.count
                && instances == that.instances
                && missing == that.missing
                && Double.compare(completeness, that.completeness) == 0
                && fieldStatus == that.fieldStatus
                && Objects.equals(subfields, that.subfields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldStatus, count, instances, missing, completeness, subfields);
    }

    @Override
    public String toString() {
        return "FieldStats[" + fieldStatus.getLabel() + ", count=" + count + ", instances=" + instances
                + ", missing=" + missing + ", completeness=" + completeness
                + (subfields != null ? ", subfields=" + subfields.keySet() : "") + "]";
    }
}
