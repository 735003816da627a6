package io.spotbot.helpers;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

@UtilityClass
public class MathHelper {
    public static final MathContext MC = MathContext.DECIMAL64;
    public static final int PRICE_SCALE = 8;
    // smallest price increment quoted by the exchange (one satoshi)
    public static final BigDecimal PRICE_EPSILON = new BigDecimal("0.00000001");

    /**
     * Truncates (floors) the value to the given number of decimals.
     */
    public static BigDecimal trunc(BigDecimal value, int scale) {
        return value.setScale(scale, RoundingMode.FLOOR);
    }

    public static BigDecimal nvl(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static BigDecimal divide(BigDecimal a, BigDecimal b) {
        return a.divide(b, MC);
    }

    /**
     * Rounds down to a multiple of {@code step}; returns the value unchanged when no step is known.
     */
    public static BigDecimal floorToStep(BigDecimal value, BigDecimal step) {
        if (step == null || step.signum() <= 0) {
            return value;
        }
        return value.divide(step, 0, RoundingMode.FLOOR).multiply(step).stripTrailingZeros();
    }
}
