package uk.gegc.qbank.shared.util;

import java.math.BigDecimal;

/**
 * Plain decimal rendering for scores and answer keys: {@code 2.0} becomes "2", {@code 0.25} stays "0.25".
 */
public final class NumberText {

    private NumberText() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String plain(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Value must be finite: " + value);
        }
        return plain(BigDecimal.valueOf(value));
    }

    public static String plain(BigDecimal value) {
        BigDecimal decimal = value.stripTrailingZeros();
        if (decimal.scale() < 0) {
            decimal = decimal.setScale(0);
        }
        return decimal.toPlainString();
    }
}
