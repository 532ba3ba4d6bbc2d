package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Schedule A categories. The total is a plain sum; no AGI floors or caps are applied.
 */
public record ItemizedDeductions(
        BigDecimal medical,
        BigDecimal stateAndLocalTaxes,
        BigDecimal mortgageInterest,
        BigDecimal charitable,
        BigDecimal casualty,
        BigDecimal other
) {
    public ItemizedDeductions {
        medical = Money.orZero(medical);
        stateAndLocalTaxes = Money.orZero(stateAndLocalTaxes);
        mortgageInterest = Money.orZero(mortgageInterest);
        charitable = Money.orZero(charitable);
        casualty = Money.orZero(casualty);
        other = Money.orZero(other);
    }

    public BigDecimal total() {
        return medical.add(stateAndLocalTaxes).add(mortgageInterest).add(charitable).add(casualty).add(other);
    }
}
