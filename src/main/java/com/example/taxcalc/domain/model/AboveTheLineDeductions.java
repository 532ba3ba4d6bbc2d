package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Schedule 1 adjustments entered by the taxpayer. The self-employment tax deduction is not part of this
 * record because it is derived from the payroll stage.
 */
public record AboveTheLineDeductions(
        BigDecimal hsa,
        BigDecimal studentLoanInterest,
        BigDecimal educatorExpenses,
        BigDecimal ira,
        BigDecimal selfEmployedHealthInsurance
) {
    public static final AboveTheLineDeductions NONE = new AboveTheLineDeductions(null, null, null, null, null);

    public AboveTheLineDeductions {
        hsa = Money.orZero(hsa);
        studentLoanInterest = Money.orZero(studentLoanInterest);
        educatorExpenses = Money.orZero(educatorExpenses);
        ira = Money.orZero(ira);
        selfEmployedHealthInsurance = Money.orZero(selfEmployedHealthInsurance);
    }
}
