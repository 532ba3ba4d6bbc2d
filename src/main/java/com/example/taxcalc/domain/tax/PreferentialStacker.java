package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.AgiResult;
import com.example.taxcalc.domain.model.CapitalGainsBreakpoints;
import com.example.taxcalc.domain.model.DeductionResult;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.NetInvestmentIncomeTaxRules;
import com.example.taxcalc.domain.model.PreferentialRates;
import com.example.taxcalc.domain.model.PreferentialTranche;
import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.domain.model.TaxComputationResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Taxes qualified dividends and net capital gain by stacking them on top of ordinary taxable income
 * and splitting the stack across the 0%, 15% and 20% bands (Qualified Dividends and Capital Gain Tax
 * Worksheet). Long-term gain sits directly above ordinary income and qualified dividends above that.
 * Also computes the net investment income tax.
 */
public class PreferentialStacker {

    private final RateTable rateTable;
    private final BracketTaxCalculator bracketTaxCalculator;

    public PreferentialStacker(RateTable rateTable, BracketTaxCalculator bracketTaxCalculator) {
        this.rateTable = rateTable;
        this.bracketTaxCalculator = bracketTaxCalculator;
    }

	/**
	 * Computes income tax before credits.
	 * The qualified-dividend share is the tranche tax of {@code [O+L, O+L+Q)} and the capital-gains share
	 * is the rounded combined tax minus the rounded qualified-dividend tax, so the two always add up.
	 *
	 * @param status     filing status selecting brackets, breakpoints and the NIIT threshold
	 * @param income     aggregated income, for net investment income
	 * @param agi        adjusted gross income, used as MAGI
	 * @param deductions ordinary and preferential split of taxable income
	 * @return tax components before credits
	 */
    public TaxComputationResult compute(FilingStatus status, IncomeResult income, AgiResult agi, DeductionResult deductions) {
        BigDecimal ordinary = deductions.ordinaryTaxableIncome();
        BigDecimal longTerm = deductions.preferentialLongTermGains();
        BigDecimal qualified = deductions.preferentialQualifiedDividends();

        BigDecimal ordinaryTax = bracketTaxCalculator.tax(ordinary, status);

        List<PreferentialTranche> tranches = tranches(ordinary, longTerm.add(qualified), status);
        BigDecimal combinedTax = Money.round(exactStackTax(ordinary, longTerm.add(qualified), status));
        BigDecimal qualifiedDividendTax = Money.round(exactStackTax(ordinary.add(longTerm), qualified, status));
        BigDecimal capitalGainsTax = combinedTax.subtract(qualifiedDividendTax);

        BigDecimal niit = netInvestmentIncomeTax(income.netInvestmentIncome(), agi.agi(), status);

        return new TaxComputationResult(
                ordinaryTax,
                qualifiedDividendTax,
                capitalGainsTax,
                niit,
                ordinaryTax.add(capitalGainsTax).add(qualifiedDividendTax).add(niit),
                tranches);
    }

	/**
	 * Splits {@code [start, start + amount)} across the preferential rate bands.
	 *
	 * @param start  income already stacked below the preferential amount
	 * @param amount preferential income to place
	 * @param status filing status selecting the breakpoints
	 * @return one tranche per band the amount reaches
	 */
    public List<PreferentialTranche> tranches(BigDecimal start, BigDecimal amount, FilingStatus status) {
        List<PreferentialTranche> tranches = new ArrayList<>();
        if (amount.signum() <= 0) {
            return tranches;
        }
        for (Band band : bands(status)) {
            BigDecimal inBand = band.overlap(start, amount);
            if (inBand.signum() > 0) {
                tranches.add(new PreferentialTranche(band.rate(), band.lower(), band.upper(),
                        Money.round(inBand), Money.round(inBand.multiply(band.rate()))));
            }
        }
        return tranches;
    }

	/**
	 * Net investment income tax: the rate applied to the smaller of positive net investment income
	 * and the excess of MAGI over the status threshold.
	 *
	 * @param netInvestmentIncome net investment income, possibly negative
	 * @param magi                modified AGI
	 * @param status              filing status selecting the threshold
	 * @return tax rounded to cents
	 */
    public BigDecimal netInvestmentIncomeTax(BigDecimal netInvestmentIncome, BigDecimal magi, FilingStatus status) {
        NetInvestmentIncomeTaxRules rules = rateTable.netInvestmentIncomeTax();
        BigDecimal excess = Money.atLeastZero(magi.subtract(rules.thresholds().get(status)));
        BigDecimal base = Money.min(Money.atLeastZero(netInvestmentIncome), excess);
        return Money.round(base.multiply(rules.rate()));
    }

    BigDecimal exactStackTax(BigDecimal start, BigDecimal amount, FilingStatus status) {
        BigDecimal total = BigDecimal.ZERO;
        if (amount.signum() <= 0) {
            return total;
        }
        for (Band band : bands(status)) {
            total = total.add(band.overlap(start, amount).multiply(band.rate()));
        }
        return total;
    }

    private List<Band> bands(FilingStatus status) {
        CapitalGainsBreakpoints breakpoints = rateTable.breakpointsFor(status);
        PreferentialRates rates = rateTable.preferentialRates();
        return List.of(
                new Band(BigDecimal.ZERO, breakpoints.zeroRateLimit(), rates.lowRate()),
                new Band(breakpoints.zeroRateLimit(), breakpoints.fifteenRateLimit(), rates.middleRate()),
                new Band(breakpoints.fifteenRateLimit(), null, rates.highRate()));
    }

    private record Band(BigDecimal lower, BigDecimal upper, BigDecimal rate) {

        BigDecimal overlap(BigDecimal start, BigDecimal amount) {
            BigDecimal end = start.add(amount);
            BigDecimal from = Money.max(start, lower);
            BigDecimal to = upper == null ? end : Money.min(end, upper);
            return Money.atLeastZero(to.subtract(from));
        }
    }
}
