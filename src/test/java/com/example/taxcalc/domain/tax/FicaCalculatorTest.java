package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.FicaResult;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.Form1099Nec;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.W2Form;
import com.example.taxcalc.support.TestRateTables;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for payroll and self-employment tax.
 */
class FicaCalculatorTest {

    private final FicaCalculator calculator = new FicaCalculator(TestRateTables.year2024());
    private final IncomeAggregator aggregator = new IncomeAggregator();

    @Test
    void employeeTaxOnWages() {
        FicaResult fica = calculate(TaxReturnInput.builder(2024, FilingStatus.SINGLE)
                .w2(W2Form.ofWages(new BigDecimal("50000"), null)).build());

        assertThat(fica.socialSecurityTax()).isEqualByComparingTo("3100.00");
        assertThat(fica.medicareTax()).isEqualByComparingTo("725.00");
        assertThat(fica.additionalMedicareTax()).isEqualByComparingTo("0");
        assertThat(fica.selfEmploymentTax()).isEqualByComparingTo("0");
        assertThat(fica.totalFica()).isEqualByComparingTo("3825.00");
    }

    /**
     * $40,000 of self-employment income: 92.35% base, 15.3% tax, half deductible.
     */
    @Test
    void selfEmploymentTaxAndDeduction() {
        FicaResult fica = calculate(TaxReturnInput.builder(2024, FilingStatus.SINGLE)
                .nec(new Form1099Nec(new BigDecimal("40000"))).build());

        assertThat(fica.selfEmploymentTaxableBase()).isEqualByComparingTo("36940.00");
        assertThat(fica.selfEmploymentTax()).isEqualByComparingTo("5651.82");
        assertThat(fica.selfEmploymentTaxDeduction()).isEqualByComparingTo("2825.91");
        assertThat(fica.socialSecurityTax()).isEqualByComparingTo("4580.56");
        assertThat(fica.medicareTax()).isEqualByComparingTo("1071.26");
        assertThat(fica.totalFica()).isEqualByComparingTo("5651.82");
    }

    /**
     * Wages above the wage base leave no room for Social-Security tax on self-employment earnings,
     * and the additional Medicare tax applies to the combined Medicare base.
     */
    @Test
    void wagesConsumeWageBaseBeforeSelfEmployment() {
        FicaResult fica = calculate(TaxReturnInput.builder(2024, FilingStatus.SINGLE)
                .w2(W2Form.ofWages(new BigDecimal("200000"), null))
                .nec(new Form1099Nec(new BigDecimal("50000"))).build());

        assertThat(fica.selfEmploymentTaxableBase()).isEqualByComparingTo("46175.00");
        assertThat(fica.socialSecurityTax()).isEqualByComparingTo("10453.20");
        assertThat(fica.selfEmploymentTax()).isEqualByComparingTo("1339.08");
        assertThat(fica.medicareTax()).isEqualByComparingTo("4239.08");
        assertThat(fica.additionalMedicareTax()).isEqualByComparingTo("415.58");
        assertThat(fica.selfEmploymentTaxDeduction()).isEqualByComparingTo("669.54");
        assertThat(fica.totalFica()).isEqualByComparingTo("15107.86");
    }

    @Test
    void noSelfEmploymentTaxBelowMinimumEarnings() {
        FicaResult fica = calculate(TaxReturnInput.builder(2024, FilingStatus.SINGLE)
                .nec(new Form1099Nec(new BigDecimal("400"))).build());

        assertThat(fica.selfEmploymentTaxableBase()).isEqualByComparingTo("0");
        assertThat(fica.selfEmploymentTax()).isEqualByComparingTo("0");
        assertThat(fica.selfEmploymentTaxDeduction()).isEqualByComparingTo("0");
    }

    @Test
    void additionalMedicareUsesJointThreshold() {
        FicaResult fica = calculate(TaxReturnInput.builder(2024, FilingStatus.MARRIED_FILING_JOINTLY)
                .w2(W2Form.ofWages(new BigDecimal("150000"), null))
                .w2(W2Form.ofWages(new BigDecimal("150000"), null)).build());

        assertThat(fica.additionalMedicareTax()).isEqualByComparingTo("450.00");
    }

    private FicaResult calculate(TaxReturnInput input) {
        IncomeResult income = aggregator.aggregate(input);
        return calculator.calculate(income, input.filingStatus());
    }
}
