package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.AboveTheLineDeductions;
import com.example.taxcalc.domain.model.AboveTheLineLimits;
import com.example.taxcalc.domain.model.AgiResult;
import com.example.taxcalc.domain.model.FicaResult;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.RateTable;

import java.math.BigDecimal;

/**
 * Gross income minus the Schedule 1 adjustments, including the deductible half of self-employment tax.
 * Student-loan interest and educator expenses are capped at their statutory limits. The result is not floored.
 */
public class AgiCalculator {

    private final AboveTheLineLimits limits;

    public AgiCalculator(RateTable rateTable) {
        this.limits = rateTable.aboveTheLineLimits();
    }

    public AgiResult calculate(IncomeResult income, AboveTheLineDeductions adjustments, FicaResult fica) {
        BigDecimal totalAdjustments = adjustments.hsa()
                .add(Money.min(adjustments.studentLoanInterest(), limits.studentLoanInterestCap()))
                .add(Money.min(adjustments.educatorExpenses(), limits.educatorExpensesCap()))
                .add(adjustments.ira())
                .add(adjustments.selfEmployedHealthInsurance())
                .add(fica.selfEmploymentTaxDeduction());
        BigDecimal gross = income.totalGrossIncome();
        return new AgiResult(gross, Money.round(totalAdjustments), Money.round(gross.subtract(totalAdjustments)));
    }
}
