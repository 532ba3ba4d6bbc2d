package com.example.taxcalc.domain.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Social-Security, Medicare and self-employment parameters for one year.
 */
public record PayrollTaxRates(
        BigDecimal socialSecurityWageBase,
        BigDecimal socialSecurityRate,
        BigDecimal medicareRate,
        BigDecimal selfEmploymentEarningsFactor,
        BigDecimal selfEmploymentSocialSecurityRate,
        BigDecimal selfEmploymentMedicareRate,
        BigDecimal selfEmploymentMinimumEarnings,
        BigDecimal selfEmploymentDeductibleFraction,
        BigDecimal additionalMedicareRate,
        Map<FilingStatus, BigDecimal> additionalMedicareThresholds
) {
}
