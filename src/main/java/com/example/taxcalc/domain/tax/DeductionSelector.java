package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.AgiResult;
import com.example.taxcalc.domain.model.DeductionResult;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.domain.model.TaxReturnInput;

import java.math.BigDecimal;

/**
 * Chooses between the standard and itemized deduction and splits taxable income into ordinary
 * and preferentially taxed parts.
 */
public class DeductionSelector {

    private final RateTable rateTable;

    public DeductionSelector(RateTable rateTable) {
        this.rateTable = rateTable;
    }

	/**
	 * Selects the deduction and partitions taxable income.
	 * Itemizing wins only when it is strictly larger and not overridden; ties go to the standard deduction.
	 * Preferential income is qualified dividends plus net capital gain, capped at taxable income with
	 * qualified dividends trimmed first.
	 *
	 * @param input  return carrying deduction choices and age/blindness flags
	 * @param income aggregated income totals
	 * @param agi    adjusted gross income
	 * @return deduction figures and the ordinary/preferential split
	 */
    public DeductionResult select(TaxReturnInput input, IncomeResult income, AgiResult agi) {
        BigDecimal standard = standardDeduction(input);
        boolean hasItemized = input.itemizedDeductions() != null;
        BigDecimal itemized = hasItemized ? input.itemizedDeductions().total() : BigDecimal.ZERO;
        boolean useStandard = input.forceStandardDeduction() || !hasItemized || itemized.compareTo(standard) <= 0;
        BigDecimal deduction = useStandard ? standard : itemized;

        BigDecimal taxable = Money.atLeastZero(agi.agi().subtract(deduction));

        BigDecimal longTerm = netCapitalGain(income);
        BigDecimal qualified = income.qualifiedDividends();
        if (longTerm.add(qualified).compareTo(taxable) > 0) {
            longTerm = Money.min(longTerm, taxable);
            qualified = taxable.subtract(longTerm);
        }
        BigDecimal preferential = longTerm.add(qualified);

        return new DeductionResult(
                Money.round(standard),
                Money.round(itemized),
                useStandard,
                Money.round(deduction),
                Money.round(taxable),
                Money.round(taxable.subtract(preferential)),
                Money.round(preferential),
                Money.round(qualified),
                Money.round(longTerm));
    }

    /**
     * @return base standard deduction plus one add-on per age or blindness flag; spouse flags count only on a joint return
     */
    public BigDecimal standardDeduction(TaxReturnInput input) {
        FilingStatus status = input.filingStatus();
        int flags = count(input.taxpayerOver65()) + count(input.taxpayerBlind());
        if (status == FilingStatus.MARRIED_FILING_JOINTLY) {
            flags += count(input.spouseOver65()) + count(input.spouseBlind());
        }
        return rateTable.standardDeductionFor(status)
                .add(rateTable.additionalStandardDeductionFor(status).multiply(BigDecimal.valueOf(flags)));
    }

    /**
     * Net long-term gain reduced by any net short-term loss, never below zero.
     */
    static BigDecimal netCapitalGain(IncomeResult income) {
        BigDecimal longTerm = income.longTermGains();
        BigDecimal combined = longTerm.add(income.shortTermGains());
        return Money.atLeastZero(Money.min(longTerm, combined));
    }

    private static int count(boolean flag) {
        return flag ? 1 : 0;
    }
}
