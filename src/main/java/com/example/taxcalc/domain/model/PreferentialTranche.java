package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Part of the preferential pool that lands in one rate band once stacked on ordinary income.
 * {@code upperBound} is {@code null} for the top band.
 */
public record PreferentialTranche(
        BigDecimal rate,
        BigDecimal lowerBound,
        BigDecimal upperBound,
        BigDecimal amount,
        BigDecimal tax
) {
}
