package com.example.taxcalc.domain.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Child Tax Credit amounts. The credit shrinks by {@code phaseOutReductionPerStep} for every
 * {@code phaseOutStep} of AGI (or part of one) above the status threshold.
 */
public record ChildTaxCreditRules(
        BigDecimal amountPerChild,
        BigDecimal refundablePerChild,
        BigDecimal phaseOutStep,
        BigDecimal phaseOutReductionPerStep,
        Map<FilingStatus, BigDecimal> phaseOutThresholds
) {
}
