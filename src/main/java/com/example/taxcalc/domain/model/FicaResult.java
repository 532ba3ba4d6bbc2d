package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Payroll and self-employment taxes. The Social-Security and Medicare figures include the
 * self-employment components, so {@code totalFica} is their sum plus the additional Medicare tax.
 */
public record FicaResult(
        BigDecimal socialSecurityTax,
        BigDecimal medicareTax,
        BigDecimal additionalMedicareTax,
        BigDecimal selfEmploymentTaxableBase,
        BigDecimal selfEmploymentTax,
        BigDecimal selfEmploymentTaxDeduction,
        BigDecimal totalFica
) {
}
