package com.example.taxcalc.domain.model;

/**
 * Every stage result of one pipeline run plus the summary, ready for direct serialization.
 */
public record FullTaxCalculationResult(
        IncomeResult income,
        FicaResult fica,
        AgiResult agi,
        DeductionResult deductions,
        TaxComputationResult taxComputation,
        CreditsResult credits,
        TaxSummary summary
) {
}
