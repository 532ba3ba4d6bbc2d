package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Child Tax Credit split into the nonrefundable part absorbed by liability and the refundable remainder.
 */
public record CreditsResult(
        BigDecimal childTaxCredit,
        BigDecimal nonrefundableApplied,
        BigDecimal refundableApplied,
        BigDecimal totalCreditsApplied,
        BigDecimal taxAfterCredits
) {
}
