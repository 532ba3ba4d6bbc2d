package com.example.taxcalc.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Income tax before credits (Form 1040 line 16 plus the net investment income tax).
 */
public record TaxComputationResult(
        BigDecimal ordinaryTax,
        BigDecimal qualifiedDividendTax,
        BigDecimal capitalGainsTax,
        BigDecimal niit,
        BigDecimal totalIncomeTax,
        List<PreferentialTranche> preferentialTranches
) {
    public TaxComputationResult {
        preferentialTranches = preferentialTranches != null ? List.copyOf(preferentialTranches) : List.of();
    }
}
