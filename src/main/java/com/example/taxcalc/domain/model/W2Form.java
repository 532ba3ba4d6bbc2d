package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Wage statement (Form W-2). Social-Security and Medicare wages default to box 1 wages when absent.
 */
public record W2Form(
        BigDecimal wages,
        BigDecimal federalWithholding,
        BigDecimal socialSecurityWages,
        BigDecimal medicareWages,
        BigDecimal socialSecurityTaxWithheld,
        BigDecimal medicareTaxWithheld
) {
    public W2Form {
        wages = Money.orZero(wages);
        federalWithholding = Money.orZero(federalWithholding);
        socialSecurityWages = socialSecurityWages != null ? socialSecurityWages : wages;
        medicareWages = medicareWages != null ? medicareWages : wages;
        socialSecurityTaxWithheld = Money.orZero(socialSecurityTaxWithheld);
        medicareTaxWithheld = Money.orZero(medicareTaxWithheld);
    }

    public static W2Form ofWages(BigDecimal wages, BigDecimal federalWithholding) {
        return new W2Form(wages, federalWithholding, null, null, null, null);
    }

    /**
     * @return every amount withheld on this statement (income tax plus payroll tax)
     */
    public BigDecimal totalWithheld() {
        return federalWithholding.add(socialSecurityTaxWithheld).add(medicareTaxWithheld);
    }
}
