package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Headline figures of a calculation. {@code refundOrOwed} is positive for a refund and negative for a balance due.
 */
public record TaxSummary(
        FilingStatus filingStatus,
        int taxYear,
        BigDecimal totalIncome,
        BigDecimal agi,
        BigDecimal deductionAmount,
        BigDecimal taxableIncome,
        BigDecimal ordinaryTax,
        BigDecimal qualifiedDividendTax,
        BigDecimal capitalGainsTax,
        BigDecimal niit,
        BigDecimal totalIncomeTaxBeforeCredits,
        BigDecimal totalCredits,
        BigDecimal incomeTaxAfterCredits,
        BigDecimal totalFica,
        BigDecimal totalTax,
        BigDecimal effectiveRate,
        BigDecimal marginalRate,
        BigDecimal totalWithholding,
        BigDecimal estimatedPayments,
        BigDecimal refundableCredits,
        BigDecimal totalPayments,
        BigDecimal refundOrOwed
) {
}
