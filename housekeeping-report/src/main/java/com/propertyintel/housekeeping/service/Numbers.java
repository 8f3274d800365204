package com.propertyintel.housekeeping.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and locale-independent formatting shared by aggregates and report tables.
 */
public final class Numbers {

    private Numbers() {
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    /** numerator / denominator, or 0 when the denominator is 0. */
    public static double ratio(double numerator, double denominator, int scale) {
        if (denominator == 0) return 0.0;
        return round(numerator / denominator, scale);
    }

    /** Plain decimal notation without trailing zeros: 5.0 → "5", 0.50 → "0.5". */
    public static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
