package io.github.metahealth.stats;

import io.github.metahealth.schema.FieldStatus;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Category rollup of a {@link StatsTree}.
 *
 * <p>For each status class the completeness is {@code sum(field.count) / (totalRecords * fieldsInClass)},
 * the average per-field fill rate of the class. It is not the share of records that have every
 * field of the class.</p>
 */
public final class CategoryMetrics {

    private static final CategoryMetrics EMPTY = new CategoryMetrics(0.0, 0.0, 0.0);

    private final double mandatory;
    private final double recommended;
    private final double optional;

    public CategoryMetrics(double mandatory, double recommended, double optional) {
        this.mandatory = mandatory;
        this.recommended = recommended;
        this.optional = optional;
    }

    public static CategoryMetrics empty() {
        return EMPTY;
    }

    /**
     * Computes the rollup over every field of a tree. The number of fields per class is taken
     * from the field map itself.
     */
    public static CategoryMetrics compute(Map<String, FieldStats> fields, long totalRecords) {
        Map<FieldStatus, long[]> sums = new EnumMap<>(FieldStatus.class);
        for (FieldStatus status : FieldStatus.values()) {
            sums.put(status, new long[2]);
        }
        for (FieldStats field : fields.values()) {
            long[] sum = sums.get(field.getFieldStatus());
            sum[0] += field.getCount();
            sum[1]++;
        }
        return new CategoryMetrics(
                ratio(sums.get(FieldStatus.MANDATORY), totalRecords),
                ratio(sums.get(FieldStatus.RECOMMENDED), totalRecords),
                ratio(sums.get(FieldStatus.OPTIONAL), totalRecords));
    }

    private static double ratio(long[] sum, long totalRecords) {
        return Ratios.completeness(sum[0], totalRecords * sum[1]);
    }

    public double getMandatory() {
        return mandatory;
    }

    public double getRecommended() {
        return recommended;
    }

    public double getOptional() {
        return optional;
    }

    public double get(FieldStatus status) {
        switch (status) {
            case MANDATORY:
                return mandatory;
            case RECOMMENDED:
                return recommended;
            case OPTIONAL:
                return optional;
            default:
                throw new IllegalArgumentException("Unknown status: " + status);
        }
    }

    CategoryMetrics rounded(int scale) {
        return new CategoryMetrics(
                Ratios.round(mandatory, scale),
                Ratios.round(recommended, scale),
                Ratios.round(optional, scale));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoryMetrics)) return false;
        CategoryMetrics that = (CategoryMetrics) o;
        return Double.compare(mandatory, that.mandatory) == 0
                && Double.compare(recommended, that.recommended) == 0
                && Double.compare(optional, that.optional) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mandatory, recommended, optional);
    }

    @Override
    public String toString() {
        return String.format("CategoryMetrics[mandatory=%.4f, recommended=%.4f, optional=%.4f]",
                mandatory, recommended, optional);
    }
}
