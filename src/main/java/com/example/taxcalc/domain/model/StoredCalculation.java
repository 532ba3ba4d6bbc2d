package com.example.taxcalc.domain.model;

import java.time.Instant;

/**
 * A stored calculation with the return that produced it.
 */
public record StoredCalculation(
        long id,
        Instant createdAt,
        TaxReturnInput input,
        FullTaxCalculationResult result
) {
}
