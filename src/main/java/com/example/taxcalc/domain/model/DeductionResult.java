package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Chosen deduction and the split of taxable income into the ordinary part and the preferential part
 * (qualified dividends plus net capital gain).
 */
public record DeductionResult(
        BigDecimal standardDeduction,
        BigDecimal itemizedTotal,
        boolean usedStandard,
        BigDecimal deductionAmount,
        BigDecimal taxableIncome,
        BigDecimal ordinaryTaxableIncome,
        BigDecimal preferentialIncome,
        BigDecimal preferentialQualifiedDividends,
        BigDecimal preferentialLongTermGains
) {
}
