package com.example.taxcalc.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ordinary-bracket tax with its per-bracket breakdown.
 */
public record BracketTaxResult(
        BigDecimal taxableIncome,
        BigDecimal tax,
        BigDecimal marginalRate,
        List<BracketSlice> breakdown
) {
    public BracketTaxResult {
        breakdown = List.copyOf(breakdown);
    }
}
