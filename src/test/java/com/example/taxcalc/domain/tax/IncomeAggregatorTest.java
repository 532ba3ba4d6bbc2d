package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.Form1099B;
import com.example.taxcalc.domain.model.Form1099Div;
import com.example.taxcalc.domain.model.Form1099Int;
import com.example.taxcalc.domain.model.Form1099Nec;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.W2Form;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class IncomeAggregatorTest {

    private final IncomeAggregator aggregator = new IncomeAggregator();

    @Test
    void sumsEveryIncomeCategory() {
        TaxReturnInput input = TaxReturnInput.builder(2024, FilingStatus.SINGLE)
                .w2(new W2Form(new BigDecimal("40000"), null, new BigDecimal("39000"), null, null, null))
                .w2(W2Form.ofWages(new BigDecimal("10000.50"), BigDecimal.ZERO))
                .nec(new Form1099Nec(new BigDecimal("5000")))
                .interest(new Form1099Int(new BigDecimal("250.25")))
                .dividends(new Form1099Div(new BigDecimal("1200"), new BigDecimal("800")))
                .broker(new Form1099B(new BigDecimal("-300"), new BigDecimal("2000")))
                .broker(new Form1099B(new BigDecimal("100"), new BigDecimal("-500")))
                .build();

        IncomeResult income = aggregator.aggregate(input);

        assertThat(income.wages()).isEqualByComparingTo("50000.50");
        assertThat(income.socialSecurityWages()).isEqualByComparingTo("49000.50");
        assertThat(income.medicareWages()).isEqualByComparingTo("50000.50");
        assertThat(income.selfEmploymentIncome()).isEqualByComparingTo("5000");
        assertThat(income.qualifiedDividends()).isEqualByComparingTo("800");
        assertThat(income.shortTermGains()).isEqualByComparingTo("-200");
        assertThat(income.longTermGains()).isEqualByComparingTo("1500");
        assertThat(income.netInvestmentIncome()).isEqualByComparingTo("2750.25");
        assertThat(income.totalGrossIncome()).isEqualByComparingTo("57750.75");
    }

    /**
     * Losses flow through net investment income without a floor.
     */
    @Test
    void netInvestmentIncomeMayBeNegative() {
        TaxReturnInput input = TaxReturnInput.builder(2024, FilingStatus.SINGLE)
                .w2(W2Form.ofWages(new BigDecimal("60000"), null))
                .interest(new Form1099Int(new BigDecimal("100")))
                .broker(new Form1099B(null, new BigDecimal("-2000")))
                .build();

        IncomeResult income = aggregator.aggregate(input);

        assertThat(income.netInvestmentIncome()).isEqualByComparingTo("-1900");
        assertThat(income.totalGrossIncome()).isEqualByComparingTo("58100");
    }

    @Test
    void emptyReturnHasZeroIncome() {
        IncomeResult income = aggregator.aggregate(TaxReturnInput.builder(2024, FilingStatus.SINGLE).build());

        assertThat(income.totalGrossIncome()).isEqualByComparingTo("0");
        assertThat(income.totalGrossIncome().scale()).isEqualTo(2);
    }
}
