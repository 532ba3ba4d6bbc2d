package com.example.taxcalc.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Quick estimate from gross income and filing status: standard deduction and ordinary brackets only.
 */
public record TaxEstimate(
        int taxYear,
        FilingStatus filingStatus,
        BigDecimal grossIncome,
        BigDecimal standardDeduction,
        BigDecimal taxableIncome,
        BigDecimal estimatedTax,
        BigDecimal effectiveRate,
        BigDecimal marginalRate,
        List<BracketSlice> breakdown
) {
}
