package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.Form1099B;
import com.example.taxcalc.domain.model.Form1099Div;
import com.example.taxcalc.domain.model.Form1099Int;
import com.example.taxcalc.domain.model.Form1099Nec;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.W2Form;

import java.math.BigDecimal;

/**
 * Sums the income statements of a return into category totals.
 * Qualified dividends are a subset of ordinary dividends and are not added to gross income a second time.
 */
public class IncomeAggregator {

    public IncomeResult aggregate(TaxReturnInput input) {
        BigDecimal wages = Money.sum(input.w2Forms(), W2Form::wages);
        BigDecimal socialSecurityWages = Money.sum(input.w2Forms(), W2Form::socialSecurityWages);
        BigDecimal medicareWages = Money.sum(input.w2Forms(), W2Form::medicareWages);
        BigDecimal selfEmployment = Money.sum(input.necForms(), Form1099Nec::compensation);
        BigDecimal interest = Money.sum(input.interestForms(), Form1099Int::interest);
        BigDecimal ordinaryDividends = Money.sum(input.dividendForms(), Form1099Div::ordinaryDividends);
        BigDecimal qualifiedDividends = Money.sum(input.dividendForms(), Form1099Div::qualifiedDividends);
        BigDecimal shortTerm = Money.sum(input.brokerForms(), Form1099B::shortTermGain);
        BigDecimal longTerm = Money.sum(input.brokerForms(), Form1099B::longTermGain);

        BigDecimal investmentIncome = interest.add(ordinaryDividends).add(shortTerm).add(longTerm);
        BigDecimal gross = wages.add(selfEmployment).add(investmentIncome);

        return new IncomeResult(
                Money.round(wages),
                Money.round(socialSecurityWages),
                Money.round(medicareWages),
                Money.round(selfEmployment),
                Money.round(interest),
                Money.round(ordinaryDividends),
                Money.round(qualifiedDividends),
                Money.round(shortTerm),
                Money.round(longTerm),
                Money.round(gross),
                Money.round(investmentIncome));
    }
}
