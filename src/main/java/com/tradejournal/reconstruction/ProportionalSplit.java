package com.tradejournal.reconstruction;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Splits a leg amount across a partial quantity. Callers subtract each share from the
 * remaining amount, so the last share takes the rounding remainder and the parts always sum
 * back to the original amount.
 */
final class ProportionalSplit {

    static final int SCALE = 2;

    private ProportionalSplit() {}

    static BigDecimal share(BigDecimal amount, int part, int whole) {
        if (part == whole) {
            return amount;
        }
        return amount.multiply(BigDecimal.valueOf(part)).divide(BigDecimal.valueOf(whole), SCALE, RoundingMode.HALF_UP);
    }
}
