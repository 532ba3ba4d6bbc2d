package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.AgiResult;
import com.example.taxcalc.domain.model.CapitalGainsBreakpoints;
import com.example.taxcalc.domain.model.DeductionResult;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.IncomeResult;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.PreferentialTranche;
import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.domain.model.TaxComputationResult;
import com.example.taxcalc.support.TestRateTables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for stacking preferential income on ordinary income and for the net investment income tax.
 */
class PreferentialStackerTest {

    private final RateTable table = TestRateTables.year2024();
    private final PreferentialStacker stacker = new PreferentialStacker(table, new BracketTaxCalculator(table));

    /**
     * Joint filers with $80,000 ordinary and $20,000 long-term gain: $14,050 fits under the 0% breakpoint,
     * the remaining $5,950 is taxed at 15%.
     */
    @Test
    void longTermGainStraddlesZeroRateBreakpoint() {
        TaxComputationResult result = compute(FilingStatus.MARRIED_FILING_JOINTLY, "80000", "20000", "0", "100000", "0");

        assertThat(result.ordinaryTax()).isEqualByComparingTo("9136.00");
        assertThat(result.capitalGainsTax()).isEqualByComparingTo("892.50");
        assertThat(result.qualifiedDividendTax()).isEqualByComparingTo("0");
        assertThat(result.totalIncomeTax()).isEqualByComparingTo("10028.50");
        assertThat(result.preferentialTranches()).extracting(PreferentialTranche::amount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("14050"), new BigDecimal("5950"));
    }

    /**
     * Qualified dividends sit above long-term gain, so they take the higher band first.
     */
    @Test
    void qualifiedDividendsStackAboveLongTermGain() {
        TaxComputationResult result = compute(FilingStatus.SINGLE, "40000", "20000", "10000", "70000", "0");

        assertThat(result.qualifiedDividendTax()).isEqualByComparingTo("1500.00");
        assertThat(result.capitalGainsTax()).isEqualByComparingTo("1946.25");
    }

    @Test
    void ordinaryIncomeAboveTopBreakpointTaxesEverythingAtTwentyPercent() {
        TaxComputationResult result = compute(FilingStatus.SINGLE, "600000", "10000", "0", "610000", "0");

        assertThat(result.capitalGainsTax()).isEqualByComparingTo("2000.00");
        assertThat(result.preferentialTranches()).singleElement()
                .satisfies(tranche -> assertThat(tranche.rate()).isEqualByComparingTo("0.20"));
    }

    @Test
    void noPreferentialIncomeMeansPlainBracketTax() {
        TaxComputationResult result = compute(FilingStatus.SINGLE, "35400", "0", "0", "50000", "0");

        assertThat(result.ordinaryTax()).isEqualByComparingTo("4016.00");
        assertThat(result.capitalGainsTax()).isEqualByComparingTo("0");
        assertThat(result.preferentialTranches()).isEmpty();
        assertThat(result.totalIncomeTax()).isEqualByComparingTo("4016.00");
    }

    /**
     * Tranche taxes agree with a breakpoint-by-breakpoint computation, and the qualified-dividend and
     * capital-gains shares add up to the combined tax.
     */
    @ParameterizedTest
    @CsvSource({
            "SINGLE, 0, 30000, 25000",
            "SINGLE, 45000, 5000, 1000",
            "SINGLE, 500000, 30000, 20000",
            "MARRIED_FILING_JOINTLY, 90000, 400000, 150000",
            "MARRIED_FILING_SEPARATELY, 280000, 7000, 9000",
            "HEAD_OF_HOUSEHOLD, 62999.99, 0.02, 0",
            "QUALIFYING_SURVIVING_SPOUSE, 1000, 0, 700000"
    })
    void trancheTaxMatchesExplicitComputation(FilingStatus status, BigDecimal ordinary, BigDecimal longTerm, BigDecimal qualified) {
        TaxComputationResult result = compute(status, ordinary.toPlainString(), longTerm.toPlainString(),
                qualified.toPlainString(), "0", "0");

        BigDecimal expectedCombined = Money.round(explicitStackTax(status, ordinary, longTerm.add(qualified)));
        BigDecimal expectedQualified = Money.round(explicitStackTax(status, ordinary.add(longTerm), qualified));

        assertThat(result.capitalGainsTax().add(result.qualifiedDividendTax())).isEqualByComparingTo(expectedCombined);
        assertThat(result.qualifiedDividendTax()).isEqualByComparingTo(expectedQualified);
        BigDecimal trancheTotal = result.preferentialTranches().stream()
                .map(PreferentialTranche::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(trancheTotal).isEqualByComparingTo(longTerm.add(qualified));
    }

    @Test
    void netInvestmentIncomeTaxUsesSmallerOfIncomeAndExcess() {
        assertThat(stacker.netInvestmentIncomeTax(new BigDecimal("30000"), new BigDecimal("250000"), FilingStatus.SINGLE))
                .isEqualByComparingTo("1140.00");
        assertThat(stacker.netInvestmentIncomeTax(new BigDecimal("80000"), new BigDecimal("250000"), FilingStatus.SINGLE))
                .isEqualByComparingTo("1900.00");
        assertThat(stacker.netInvestmentIncomeTax(new BigDecimal("30000"), new BigDecimal("240000"), FilingStatus.MARRIED_FILING_JOINTLY))
                .isEqualByComparingTo("0");
        assertThat(stacker.netInvestmentIncomeTax(new BigDecimal("-5000"), new BigDecimal("400000"), FilingStatus.SINGLE))
                .isEqualByComparingTo("0");
    }

    @Test
    void netInvestmentIncomeTaxIsPartOfTotal() {
        TaxComputationResult result = compute(FilingStatus.SINGLE, "235400", "0", "0", "250000", "30000");

        assertThat(result.niit()).isEqualByComparingTo("1140.00");
        assertThat(result.totalIncomeTax()).isEqualByComparingTo(result.ordinaryTax().add(new BigDecimal("1140.00")));
    }

    /**
     * Independent rendition of the worksheet: walk the two breakpoints explicitly.
     */
    private BigDecimal explicitStackTax(FilingStatus status, BigDecimal start, BigDecimal amount) {
        CapitalGainsBreakpoints breakpoints = table.breakpointsFor(status);
        BigDecimal end = start.add(amount);
        BigDecimal zeroBand = clamp(breakpoints.zeroRateLimit().min(end).subtract(start));
        BigDecimal fifteenBand = clamp(breakpoints.fifteenRateLimit().min(end).subtract(start.max(breakpoints.zeroRateLimit())));
        BigDecimal twentyBand = clamp(end.subtract(start.max(breakpoints.fifteenRateLimit())));
        return zeroBand.multiply(table.preferentialRates().lowRate())
                .add(fifteenBand.multiply(table.preferentialRates().middleRate()))
                .add(twentyBand.multiply(table.preferentialRates().highRate()));
    }

    private static BigDecimal clamp(BigDecimal value) {
        return value.max(BigDecimal.ZERO);
    }

    private TaxComputationResult compute(FilingStatus status, String ordinary, String longTerm, String qualified,
                                         String agi, String netInvestmentIncome) {
        BigDecimal o = new BigDecimal(ordinary);
        BigDecimal l = new BigDecimal(longTerm);
        BigDecimal q = new BigDecimal(qualified);
        BigDecimal taxable = o.add(l).add(q);
        DeductionResult deductions = new DeductionResult(BigDecimal.ZERO, BigDecimal.ZERO, true, BigDecimal.ZERO,
                taxable, o, l.add(q), q, l);
        BigDecimal zero = BigDecimal.ZERO;
        IncomeResult income = new IncomeResult(zero, zero, zero, zero, zero, zero, zero, zero, zero,
                new BigDecimal(agi), new BigDecimal(netInvestmentIncome));
        AgiResult agiResult = new AgiResult(new BigDecimal(agi), zero, new BigDecimal(agi));
        return stacker.compute(status, income, agiResult, deductions);
    }
}
