package com.example.taxcalc.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every statutory constant needed to compute one tax year, keyed by {@link FilingStatus} where the law
 * distinguishes statuses. Instances are immutable and are handed to each calculation stage explicitly,
 * so several years can be loaded side by side.
 * <p>
 * The constructor rejects incomplete or inconsistent tables with {@link IllegalArgumentException}:
 * every status must be present, brackets must start at zero, be contiguous and end with exactly one
 * unbounded tier, and the preferential breakpoints must be increasing.
 */
public record RateTable(
        int taxYear,
        Map<FilingStatus, List<TaxBracket>> ordinaryBrackets,
        Map<FilingStatus, BigDecimal> standardDeductions,
        Map<FilingStatus, BigDecimal> additionalStandardDeductions,
        Map<FilingStatus, CapitalGainsBreakpoints> capitalGainsBreakpoints,
        PreferentialRates preferentialRates,
        NetInvestmentIncomeTaxRules netInvestmentIncomeTax,
        PayrollTaxRates payroll,
        ChildTaxCreditRules childTaxCredit,
        AboveTheLineLimits aboveTheLineLimits
) {
    public RateTable {
        Objects.requireNonNull(preferentialRates, "preferentialRates");
        Objects.requireNonNull(netInvestmentIncomeTax, "netInvestmentIncomeTax");
        Objects.requireNonNull(payroll, "payroll");
        Objects.requireNonNull(childTaxCredit, "childTaxCredit");
        Objects.requireNonNull(aboveTheLineLimits, "aboveTheLineLimits");

        ordinaryBrackets = perStatus("ordinaryBrackets", ordinaryBrackets);
        ordinaryBrackets.forEach(RateTable::checkBrackets);
        ordinaryBrackets = Collections.unmodifiableMap(copyBrackets(ordinaryBrackets));
        standardDeductions = perStatus("standardDeductions", standardDeductions);
        additionalStandardDeductions = perStatus("additionalStandardDeductions", additionalStandardDeductions);
        capitalGainsBreakpoints = perStatus("capitalGainsBreakpoints", capitalGainsBreakpoints);
        capitalGainsBreakpoints.forEach((status, breakpoints) -> {
            if (breakpoints.zeroRateLimit().compareTo(breakpoints.fifteenRateLimit()) >= 0) {
                throw new IllegalArgumentException("Capital gains breakpoints must increase for " + status);
            }
        });
        netInvestmentIncomeTax = new NetInvestmentIncomeTaxRules(netInvestmentIncomeTax.rate(),
                perStatus("netInvestmentIncomeTax.thresholds", netInvestmentIncomeTax.thresholds()));
        payroll = new PayrollTaxRates(payroll.socialSecurityWageBase(), payroll.socialSecurityRate(),
                payroll.medicareRate(), payroll.selfEmploymentEarningsFactor(),
                payroll.selfEmploymentSocialSecurityRate(), payroll.selfEmploymentMedicareRate(),
                payroll.selfEmploymentMinimumEarnings(), payroll.selfEmploymentDeductibleFraction(),
                payroll.additionalMedicareRate(),
                perStatus("payroll.additionalMedicareThresholds", payroll.additionalMedicareThresholds()));
        childTaxCredit = new ChildTaxCreditRules(childTaxCredit.amountPerChild(), childTaxCredit.refundablePerChild(),
                childTaxCredit.phaseOutStep(), childTaxCredit.phaseOutReductionPerStep(),
                perStatus("childTaxCredit.phaseOutThresholds", childTaxCredit.phaseOutThresholds()));
    }

    public List<TaxBracket> bracketsFor(FilingStatus status) {
        return ordinaryBrackets.get(status);
    }

    public BigDecimal standardDeductionFor(FilingStatus status) {
        return standardDeductions.get(status);
    }

    public BigDecimal additionalStandardDeductionFor(FilingStatus status) {
        return additionalStandardDeductions.get(status);
    }

    public CapitalGainsBreakpoints breakpointsFor(FilingStatus status) {
        return capitalGainsBreakpoints.get(status);
    }

    private static <V> Map<FilingStatus, V> perStatus(String name, Map<FilingStatus, V> values) {
        if (values == null) {
            throw new IllegalArgumentException(name + " is missing");
        }
        for (FilingStatus status : FilingStatus.values()) {
            if (values.get(status) == null) {
                throw new IllegalArgumentException(name + " has no entry for " + status);
            }
        }
        return Collections.unmodifiableMap(new EnumMap<>(values));
    }

    private static Map<FilingStatus, List<TaxBracket>> copyBrackets(Map<FilingStatus, List<TaxBracket>> brackets) {
        Map<FilingStatus, List<TaxBracket>> copy = new EnumMap<>(FilingStatus.class);
        brackets.forEach((status, list) -> copy.put(status, List.copyOf(list)));
        return copy;
    }

    private static void checkBrackets(FilingStatus status, List<TaxBracket> brackets) {
        if (brackets.isEmpty()) {
            throw new IllegalArgumentException("No brackets for " + status);
        }
        BigDecimal expectedLower = BigDecimal.ZERO;
        for (int i = 0; i < brackets.size(); i++) {
            TaxBracket bracket = brackets.get(i);
            boolean last = i == brackets.size() - 1;
            if (bracket.lowerBound().compareTo(expectedLower) != 0) {
                throw new IllegalArgumentException("Bracket " + (i + 1) + " for " + status + " does not start at " + expectedLower);
            }
            if (bracket.rate().signum() < 0) {
                throw new IllegalArgumentException("Bracket " + (i + 1) + " for " + status + " has a negative rate");
            }
            if (last != bracket.isUnbounded()) {
                throw new IllegalArgumentException("Only the last bracket for " + status + " may be unbounded");
            }
            if (!last) {
                if (bracket.upperBound().compareTo(bracket.lowerBound()) <= 0) {
                    throw new IllegalArgumentException("Bracket " + (i + 1) + " for " + status + " is empty");
                }
                expectedLower = bracket.upperBound();
            }
        }
    }
}
