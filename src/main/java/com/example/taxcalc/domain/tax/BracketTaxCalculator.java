package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.BracketSlice;
import com.example.taxcalc.domain.model.BracketTaxResult;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.domain.model.TaxBracket;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Progressive tax on ordinary income using the brackets of one {@link RateTable}.
 * Each tier taxes the part of income inside {@code [lower, upper)}; the top tier is unbounded.
 */
public class BracketTaxCalculator {

    private final RateTable rateTable;

    public BracketTaxCalculator(RateTable rateTable) {
        this.rateTable = rateTable;
    }

	/**
	 * Computes the tax on ordinary income together with the per-bracket breakdown.
	 * Slice taxes are rounded individually for display; the total is rounded once from the exact sum.
	 *
	 * @param income non-negative ordinary taxable income
	 * @param status filing status selecting the bracket set
	 * @return tax, marginal rate and the brackets touched by the income
	 * @throws IllegalArgumentException when income is negative
	 */
    public BracketTaxResult calculate(BigDecimal income, FilingStatus status) {
        requireNonNegative(income);
        List<BracketSlice> slices = new ArrayList<>();
        BigDecimal exact = BigDecimal.ZERO;
        for (TaxBracket bracket : rateTable.bracketsFor(status)) {
            BigDecimal portion = bracket.portionOf(income);
            if (portion.signum() == 0) {
                break;
            }
            BigDecimal sliceTax = portion.multiply(bracket.rate());
            exact = exact.add(sliceTax);
            slices.add(new BracketSlice(bracket.rate(), bracket.lowerBound(), bracket.upperBound(),
                    Money.round(portion), Money.round(sliceTax)));
        }
        return new BracketTaxResult(Money.round(income), Money.round(exact), marginalRateAt(income, status), slices);
    }

    /**
     * @return tax on {@code income}, rounded to cents
     */
    public BigDecimal tax(BigDecimal income, FilingStatus status) {
        return Money.round(exactTax(income, status));
    }

	/**
	 * Returns the rate of the tier that contains {@code income}. Income sitting exactly on a boundary
	 * belongs to the lower tier it completes, so zero maps to the first tier.
	 *
	 * @param income non-negative ordinary income
	 * @param status filing status selecting the bracket set
	 * @return rate of the containing tier
	 */
    public BigDecimal marginalRateAt(BigDecimal income, FilingStatus status) {
        requireNonNegative(income);
        for (TaxBracket bracket : rateTable.bracketsFor(status)) {
            if (bracket.isUnbounded() || income.compareTo(bracket.upperBound()) <= 0) {
                return bracket.rate();
            }
        }
        throw new IllegalStateException("Bracket table for " + status + " has no unbounded tier");
    }

    BigDecimal exactTax(BigDecimal income, FilingStatus status) {
        requireNonNegative(income);
        BigDecimal total = BigDecimal.ZERO;
        for (TaxBracket bracket : rateTable.bracketsFor(status)) {
            total = total.add(bracket.portionOf(income).multiply(bracket.rate()));
        }
        return total;
    }

    private static void requireNonNegative(BigDecimal income) {
        if (income == null || income.signum() < 0) {
            throw new IllegalArgumentException("Ordinary income must be non-negative: " + income);
        }
    }
}
