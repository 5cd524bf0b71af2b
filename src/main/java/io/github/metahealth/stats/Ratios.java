package io.github.metahealth.stats;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Ratios {

    private Ratios() {
    }

    static double completeness(long count, long total) {
        return total > 0 ? (double) count / total : 0.0;
    }

    static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
