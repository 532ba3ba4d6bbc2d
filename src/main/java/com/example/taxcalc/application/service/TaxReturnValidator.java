package com.example.taxcalc.application.service;

import com.example.taxcalc.domain.exception.IncompleteInputException;
import com.example.taxcalc.domain.exception.TaxValidationException;
import com.example.taxcalc.domain.exception.UnsupportedScenarioException;
import com.example.taxcalc.domain.model.AboveTheLineDeductions;
import com.example.taxcalc.domain.model.AgiResult;
import com.example.taxcalc.domain.model.FicaResult;
import com.example.taxcalc.domain.model.Form1099Div;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.ItemizedDeductions;
import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.W2Form;
import com.example.taxcalc.domain.tax.AgiCalculator;
import com.example.taxcalc.domain.tax.FicaCalculator;
import com.example.taxcalc.domain.tax.IncomeAggregator;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Boundary checks run before a return enters the calculation pipeline.
 * Sign and consistency failures name the form and 1-based record index; returns the pipeline does
 * not model (negative total income, adjustments larger than income) are rejected as unsupported.
 */
@Component
public class TaxReturnValidator {

    private final IncomeAggregator incomeAggregator = new IncomeAggregator();

	/**
	 * Validates a return against the rate table of its year.
	 *
	 * @param input     return to check
	 * @param rateTable table for {@code input.taxYear()}
	 * @throws IncompleteInputException     when a required part of the return is missing
	 * @throws TaxValidationException       when an amount breaks its sign or consistency rule
	 * @throws UnsupportedScenarioException when the return falls outside what the calculation models
	 */
    public void validate(TaxReturnInput input, RateTable rateTable) {
        if (input == null) {
            throw new IncompleteInputException("Tax return is required.");
        }
        validateW2s(input.w2Forms());
        validateEach(input.necForms(), (index, form) ->
                requireNonNegative("1099-NEC", index, "compensation", form.compensation()));
        validateEach(input.interestForms(), (index, form) ->
                requireNonNegative("1099-INT", index, "interest", form.interest()));
        validateDividends(input.dividendForms());
        validateItemized(input.itemizedDeductions());
        validateAdjustments(input.adjustments());
        if (input.qualifyingChildren() < 0) {
            throw new TaxValidationException("qualifyingChildren", "Qualifying children must be non-negative.");
        }
        if (input.estimatedPayments().signum() < 0) {
            throw new TaxValidationException("estimatedPayments", "Estimated payments must be non-negative.");
        }
        validateScenario(input, rateTable);
    }

    private void validateW2s(List<W2Form> forms) {
        validateEach(forms, (index, form) -> {
            requireNonNegative("W-2", index, "wages", form.wages());
            requireNonNegative("W-2", index, "federalWithholding", form.federalWithholding());
            requireNonNegative("W-2", index, "socialSecurityWages", form.socialSecurityWages());
            requireNonNegative("W-2", index, "medicareWages", form.medicareWages());
            requireNonNegative("W-2", index, "socialSecurityTaxWithheld", form.socialSecurityTaxWithheld());
            requireNonNegative("W-2", index, "medicareTaxWithheld", form.medicareTaxWithheld());
        });
    }

    private void validateDividends(List<Form1099Div> forms) {
        validateEach(forms, (index, form) -> {
            requireNonNegative("1099-DIV", index, "ordinaryDividends", form.ordinaryDividends());
            requireNonNegative("1099-DIV", index, "qualifiedDividends", form.qualifiedDividends());
            if (form.qualifiedDividends().compareTo(form.ordinaryDividends()) > 0) {
                throw new TaxValidationException("1099-DIV", index, "qualifiedDividends",
                        "qualified dividends cannot exceed ordinary dividends");
            }
        });
    }

    private void validateItemized(ItemizedDeductions itemized) {
        if (itemized == null) {
            return;
        }
        requireNonNegative("itemizedDeductions.medical", itemized.medical());
        requireNonNegative("itemizedDeductions.stateAndLocalTaxes", itemized.stateAndLocalTaxes());
        requireNonNegative("itemizedDeductions.mortgageInterest", itemized.mortgageInterest());
        requireNonNegative("itemizedDeductions.charitable", itemized.charitable());
        requireNonNegative("itemizedDeductions.casualty", itemized.casualty());
        requireNonNegative("itemizedDeductions.other", itemized.other());
    }

    private void validateAdjustments(AboveTheLineDeductions adjustments) {
        requireNonNegative("adjustments.hsa", adjustments.hsa());
        requireNonNegative("adjustments.studentLoanInterest", adjustments.studentLoanInterest());
        requireNonNegative("adjustments.educatorExpenses", adjustments.educatorExpenses());
        requireNonNegative("adjustments.ira", adjustments.ira());
        requireNonNegative("adjustments.selfEmployedHealthInsurance", adjustments.selfEmployedHealthInsurance());
    }

    private void validateScenario(TaxReturnInput input, RateTable rateTable) {
        IncomeResult income = incomeAggregator.aggregate(input);
        if (income.totalGrossIncome().signum() < 0) {
            throw new UnsupportedScenarioException(
                    "Total income is negative; capital loss limitation and carryforward are not supported.");
        }
        FicaResult fica = new FicaCalculator(rateTable).calculate(income, input.filingStatus());
        AgiResult agi = new AgiCalculator(rateTable).calculate(income, input.adjustments(), fica);
        if (agi.agi().signum() < 0) {
            throw new UnsupportedScenarioException(
                    "Above-the-line deductions exceed total income; a negative AGI is not supported.");
        }
    }

    private static void requireNonNegative(String form, int index, String field, BigDecimal value) {
        if (value.signum() < 0) {
            throw new TaxValidationException(form, index, field, field + " must be non-negative");
        }
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value.signum() < 0) {
            throw new TaxValidationException(field, field + " must be non-negative.");
        }
    }

    private static <T> void validateEach(List<T> records, RecordCheck<T> check) {
        for (int i = 0; i < records.size(); i++) {
            check.apply(i + 1, records.get(i));
        }
    }

    @FunctionalInterface
    private interface RecordCheck<T> {
        void apply(int index, T record);
    }
}
