package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.AgiResult;
import com.example.taxcalc.domain.model.CreditsResult;
import com.example.taxcalc.domain.model.DeductionResult;
import com.example.taxcalc.domain.model.FicaResult;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.FullTaxCalculationResult;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.domain.model.TaxComputationResult;
import com.example.taxcalc.domain.model.TaxEstimate;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.TaxSummary;

import java.math.BigDecimal;

/**
 * Runs the calculation stages in their fixed order for one tax year:
 * income, payroll tax, AGI, deduction, income tax, credits, summary.
 * <p>
 * Instances hold only the immutable rate table and stateless stages, so one pipeline can serve
 * concurrent calculations. Inputs are expected to have passed validation already.
 */
public class TaxCalculationPipeline {

    private final RateTable rateTable;
    private final IncomeAggregator incomeAggregator;
    private final FicaCalculator ficaCalculator;
    private final AgiCalculator agiCalculator;
    private final DeductionSelector deductionSelector;
    private final PreferentialStacker preferentialStacker;
    private final CreditsApplier creditsApplier;
    private final SummaryComposer summaryComposer;
    private final QuickEstimator quickEstimator;

    public TaxCalculationPipeline(RateTable rateTable) {
        BracketTaxCalculator bracketTaxCalculator = new BracketTaxCalculator(rateTable);
        this.rateTable = rateTable;
        this.incomeAggregator = new IncomeAggregator();
        this.ficaCalculator = new FicaCalculator(rateTable);
        this.agiCalculator = new AgiCalculator(rateTable);
        this.deductionSelector = new DeductionSelector(rateTable);
        this.preferentialStacker = new PreferentialStacker(rateTable, bracketTaxCalculator);
        this.creditsApplier = new CreditsApplier(rateTable);
        this.summaryComposer = new SummaryComposer(bracketTaxCalculator);
        this.quickEstimator = new QuickEstimator(rateTable, bracketTaxCalculator);
    }

	/**
	 * Calculates the full liability breakdown of a validated return.
	 *
	 * @param input validated return for this pipeline's tax year
	 * @return every stage result plus the summary
	 * @throws IllegalArgumentException when the return is for another tax year
	 */
    public FullTaxCalculationResult calculate(TaxReturnInput input) {
        if (input.taxYear() != rateTable.taxYear()) {
            throw new IllegalArgumentException("Return for " + input.taxYear()
                    + " cannot be calculated with the " + rateTable.taxYear() + " rate table");
        }
        FilingStatus status = input.filingStatus();

        IncomeResult income = incomeAggregator.aggregate(input);
        FicaResult fica = ficaCalculator.calculate(income, status);
        AgiResult agi = agiCalculator.calculate(income, input.adjustments(), fica);
        DeductionResult deductions = deductionSelector.select(input, income, agi);
        TaxComputationResult tax = preferentialStacker.compute(status, income, agi, deductions);
        CreditsResult credits = creditsApplier.apply(input.qualifyingChildren(), status, agi, tax);
        TaxSummary summary = summaryComposer.compose(input, income, fica, agi, deductions, tax, credits);

        return new FullTaxCalculationResult(income, fica, agi, deductions, tax, credits, summary);
    }

    public TaxEstimate estimate(BigDecimal grossIncome, FilingStatus status) {
        return quickEstimator.estimate(grossIncome, status);
    }

    public RateTable rateTable() {
        return rateTable;
    }
}
