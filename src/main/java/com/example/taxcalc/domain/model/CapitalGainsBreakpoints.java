package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Taxable-income limits for the preferential rates: income below {@code zeroRateLimit} is taxed at the low rate,
 * income up to {@code fifteenRateLimit} at the middle rate and the rest at the high rate.
 */
public record CapitalGainsBreakpoints(BigDecimal zeroRateLimit, BigDecimal fifteenRateLimit) {
}
