package com.example.taxcalc.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.function.Function;

/**
 * Decimal helpers shared by the calculation stages.
 * Amounts are rounded half-up to cents only when a stage publishes its result.
 */
public final class Money {

    public static final int CENTS = 2;
    public static final int RATE_SCALE = 6;

    private Money() {
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(CENTS, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal amount) {
        return amount != null ? amount : BigDecimal.ZERO;
    }

    public static BigDecimal atLeastZero(BigDecimal amount) {
        return amount.signum() < 0 ? BigDecimal.ZERO : amount;
    }

    public static BigDecimal min(BigDecimal left, BigDecimal right) {
        return left.compareTo(right) <= 0 ? left : right;
    }

    public static BigDecimal max(BigDecimal left, BigDecimal right) {
        return left.compareTo(right) >= 0 ? left : right;
    }

    public static <T> BigDecimal sum(Collection<T> items, Function<T, BigDecimal> amount) {
        return items.stream().map(amount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Divides two amounts into a ratio rounded half-up to {@link #RATE_SCALE} places.
     * A non-positive denominator yields zero.
     */
    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() <= 0) {
            return BigDecimal.ZERO.setScale(RATE_SCALE);
        }
        return numerator.divide(denominator, RATE_SCALE, RoundingMode.HALF_UP);
    }
}
