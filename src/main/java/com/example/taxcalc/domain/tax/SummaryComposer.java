package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.AgiResult;
import com.example.taxcalc.domain.model.CreditsResult;
import com.example.taxcalc.domain.model.DeductionResult;
import com.example.taxcalc.domain.model.FicaResult;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.TaxComputationResult;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.TaxSummary;
import com.example.taxcalc.domain.model.W2Form;

import java.math.BigDecimal;

/**
 * Builds the headline figures: total tax, effective and marginal rates, payments and the refund or balance due.
 */
public class SummaryComposer {

    private final BracketTaxCalculator bracketTaxCalculator;

    public SummaryComposer(BracketTaxCalculator bracketTaxCalculator) {
        this.bracketTaxCalculator = bracketTaxCalculator;
    }

	/**
	 * Composes the summary from the stage results.
	 * Refundable credits count as a payment, and a positive {@code refundOrOwed} means a refund.
	 *
	 * @return summary rounded to cents, rates to six places
	 */
    public TaxSummary compose(TaxReturnInput input,
                              IncomeResult income,
                              FicaResult fica,
                              AgiResult agi,
                              DeductionResult deductions,
                              TaxComputationResult tax,
                              CreditsResult credits) {
        BigDecimal totalTax = credits.taxAfterCredits().add(fica.totalFica());
        BigDecimal effectiveRate = Money.ratio(totalTax, income.totalGrossIncome());
        BigDecimal marginalRate = bracketTaxCalculator.marginalRateAt(
                deductions.ordinaryTaxableIncome().add(BigDecimal.ONE), input.filingStatus());

        BigDecimal withholding = Money.round(Money.sum(input.w2Forms(), W2Form::totalWithheld));
        BigDecimal estimated = Money.round(input.estimatedPayments());
        BigDecimal totalPayments = withholding.add(estimated).add(credits.refundableApplied());

        return new TaxSummary(
                input.filingStatus(),
                input.taxYear(),
                income.totalGrossIncome(),
                agi.agi(),
                deductions.deductionAmount(),
                deductions.taxableIncome(),
                tax.ordinaryTax(),
                tax.qualifiedDividendTax(),
                tax.capitalGainsTax(),
                tax.niit(),
                tax.totalIncomeTax(),
                credits.totalCreditsApplied(),
                credits.taxAfterCredits(),
                fica.totalFica(),
                totalTax,
                effectiveRate,
                marginalRate,
                withholding,
                estimated,
                credits.refundableApplied(),
                totalPayments,
                totalPayments.subtract(totalTax));
    }
}
