package com.example.taxcalc.application.service;

import com.example.taxcalc.domain.model.FullTaxCalculationResult;

import java.util.List;

/**
 * Result of the calculate use case. {@code calculationId} is {@code null} when the result was not stored,
 * in which case {@code warnings} says why.
 */
public record CalculationOutcome(Long calculationId, FullTaxCalculationResult result, List<String> warnings) {

    public CalculationOutcome {
        warnings = List.copyOf(warnings);
    }
}
