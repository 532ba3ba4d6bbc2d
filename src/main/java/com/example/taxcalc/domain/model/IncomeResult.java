package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Category totals produced by income aggregation (Form 1040 lines 1 to 9).
 * Net investment income is not floored; a net capital loss reduces it.
 */
public record IncomeResult(
        BigDecimal wages,
        BigDecimal socialSecurityWages,
        BigDecimal medicareWages,
        BigDecimal selfEmploymentIncome,
        BigDecimal interestIncome,
        BigDecimal ordinaryDividends,
        BigDecimal qualifiedDividends,
        BigDecimal shortTermGains,
        BigDecimal longTermGains,
        BigDecimal totalGrossIncome,
        BigDecimal netInvestmentIncome
) {
}
