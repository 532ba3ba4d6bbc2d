package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * One ordinary-income tier covering {@code [lowerBound, upperBound)}. A {@code null} upper bound marks the top tier.
 */
public record TaxBracket(BigDecimal lowerBound, BigDecimal upperBound, BigDecimal rate) {

    public boolean isUnbounded() {
        return upperBound == null;
    }

    /**
     * @return portion of {@code income} that falls inside this tier
     */
    public BigDecimal portionOf(BigDecimal income) {
        if (income.compareTo(lowerBound) <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal top = isUnbounded() ? income : Money.min(income, upperBound);
        return top.subtract(lowerBound);
    }
}
