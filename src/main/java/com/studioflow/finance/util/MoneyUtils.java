package com.studioflow.finance.util;

import com.studioflow.finance.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.stream.Stream;

/**
 * Fixed-point helpers for ledger amounts. Every amount the finance core derives is
 * rounded to two decimal places with {@link RoundingMode#HALF_UP}.
 */
public final class MoneyUtils {

    public static final int SCALE = 2;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MoneyUtils() {
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }

    /**
     * Null-safe rounding to two decimal places.
     */
    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return zero();
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code base * percent / 100}, rounded.
     */
    public static BigDecimal percentOf(BigDecimal base, BigDecimal percent) {
        if (base == null || percent == null) {
            return zero();
        }
        return scale(base.multiply(percent).divide(HUNDRED, SCALE + 4, RoundingMode.HALF_UP));
    }

    public static BigDecimal sum(Stream<BigDecimal> values) {
        return scale(values.filter(v -> v != null).reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /**
     * Rounds an entered amount and rejects it unless it is still above zero.
     *
     * @throws ValidationException on the {@code amount} field otherwise
     */
    public static BigDecimal requirePositive(BigDecimal amount) {
        BigDecimal scaled = amount != null ? scale(amount) : null;
        if (!isPositive(scaled)) {
            throw new ValidationException("amount", "Amount must be greater than zero.");
        }
        return scaled;
    }
}
