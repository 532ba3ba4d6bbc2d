package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.FicaResult;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.PayrollTaxRates;
import com.example.taxcalc.domain.model.RateTable;

import java.math.BigDecimal;

/**
 * Employee payroll tax on wages plus self-employment tax (Schedule SE) and the additional Medicare tax.
 * Runs before AGI because half of the self-employment tax is an above-the-line deduction.
 */
public class FicaCalculator {

    private final PayrollTaxRates rates;

    public FicaCalculator(RateTable rateTable) {
        this.rates = rateTable.payroll();
    }

	/**
	 * Computes payroll and self-employment taxes for the aggregated income.
	 * Social-Security wages already on W-2s consume the wage base before self-employment earnings do,
	 * and the additional Medicare tax is evaluated once on Medicare wages plus the self-employment base.
	 *
	 * @param income aggregated income totals
	 * @param status filing status selecting the additional Medicare threshold
	 * @return payroll tax figures, rounded to cents
	 */
    public FicaResult calculate(IncomeResult income, FilingStatus status) {
        BigDecimal wageBase = rates.socialSecurityWageBase();
        BigDecimal socialSecurityWages = income.socialSecurityWages();
        BigDecimal medicareWages = income.medicareWages();

        BigDecimal employeeSocialSecurity = Money.min(socialSecurityWages, wageBase).multiply(rates.socialSecurityRate());
        BigDecimal employeeMedicare = medicareWages.multiply(rates.medicareRate());

        BigDecimal seBase = selfEmploymentBase(income.selfEmploymentIncome());
        BigDecimal remainingWageBase = Money.atLeastZero(wageBase.subtract(socialSecurityWages));
        BigDecimal seSocialSecurity = Money.min(seBase, remainingWageBase).multiply(rates.selfEmploymentSocialSecurityRate());
        BigDecimal seMedicare = seBase.multiply(rates.selfEmploymentMedicareRate());
        BigDecimal seTax = Money.round(seSocialSecurity.add(seMedicare));

        BigDecimal threshold = rates.additionalMedicareThresholds().get(status);
        BigDecimal additionalMedicare = Money.round(
                Money.atLeastZero(medicareWages.add(seBase).subtract(threshold)).multiply(rates.additionalMedicareRate()));

        BigDecimal socialSecurityTax = Money.round(employeeSocialSecurity.add(seSocialSecurity));
        BigDecimal medicareTax = Money.round(employeeMedicare.add(seMedicare));

        return new FicaResult(
                socialSecurityTax,
                medicareTax,
                additionalMedicare,
                Money.round(seBase),
                seTax,
                Money.round(seTax.multiply(rates.selfEmploymentDeductibleFraction())),
                socialSecurityTax.add(medicareTax).add(additionalMedicare));
    }

    /**
     * Net earnings from self-employment; below the statutory minimum no self-employment tax is due.
     */
    private BigDecimal selfEmploymentBase(BigDecimal selfEmploymentIncome) {
        BigDecimal base = Money.atLeastZero(selfEmploymentIncome).multiply(rates.selfEmploymentEarningsFactor());
        return base.compareTo(rates.selfEmploymentMinimumEarnings()) < 0 ? BigDecimal.ZERO : base;
    }
}
