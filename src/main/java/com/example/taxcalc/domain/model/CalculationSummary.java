package com.example.taxcalc.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * History listing row for a stored calculation.
 */
public record CalculationSummary(
        long id,
        Instant createdAt,
        int taxYear,
        FilingStatus filingStatus,
        BigDecimal totalIncome,
        BigDecimal agi,
        BigDecimal taxableIncome,
        BigDecimal federalTax,
        BigDecimal totalCredits,
        BigDecimal totalTax,
        BigDecimal effectiveRate,
        BigDecimal marginalRate,
        BigDecimal refundOrOwed
) {
}
