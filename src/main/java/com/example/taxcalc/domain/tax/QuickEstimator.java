package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.BracketTaxResult;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.domain.model.TaxEstimate;

import java.math.BigDecimal;

/**
 * Rough liability from gross income alone: base standard deduction, then ordinary brackets.
 * No payroll tax, preferential rates or credits.
 */
public class QuickEstimator {

    private final RateTable rateTable;
    private final BracketTaxCalculator bracketTaxCalculator;

    public QuickEstimator(RateTable rateTable, BracketTaxCalculator bracketTaxCalculator) {
        this.rateTable = rateTable;
        this.bracketTaxCalculator = bracketTaxCalculator;
    }

    public TaxEstimate estimate(BigDecimal grossIncome, FilingStatus status) {
        if (grossIncome == null || grossIncome.signum() < 0) {
            throw new IllegalArgumentException("Gross income must be non-negative: " + grossIncome);
        }
        BigDecimal standard = rateTable.standardDeductionFor(status);
        BigDecimal taxable = Money.atLeastZero(grossIncome.subtract(standard));
        BracketTaxResult brackets = bracketTaxCalculator.calculate(taxable, status);
        return new TaxEstimate(
                rateTable.taxYear(),
                status,
                Money.round(grossIncome),
                Money.round(standard),
                brackets.taxableIncome(),
                brackets.tax(),
                Money.ratio(brackets.tax(), grossIncome),
                bracketTaxCalculator.marginalRateAt(taxable.add(BigDecimal.ONE), status),
                brackets.breakdown());
    }
}
