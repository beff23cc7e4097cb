package io.thinmesh.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between decimal cost amounts ("25.00") and integer micros.
 */
public final class CostUnits {
    public static final long MICROS_PER_UNIT = 1_000_000L;

    private CostUnits() {
    }

    public static long parseMicros(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new IllegalArgumentException("cost amount must not be blank");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(amount.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid cost amount: " + amount, e);
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("cost amount must not be negative: " + amount);
        }
        return value.movePointRight(6).setScale(0, RoundingMode.UP).longValueExact();
    }

    public static String format(long micros) {
        return BigDecimal.valueOf(micros).movePointLeft(6).setScale(6, RoundingMode.UNNECESSARY).toPlainString();
    }
}
