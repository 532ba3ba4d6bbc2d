package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Adjusted gross income (Form 1040 line 11).
 */
public record AgiResult(
        BigDecimal totalGrossIncome,
        BigDecimal totalAboveTheLineDeductions,
        BigDecimal agi
) {
}
