package com.example.taxcalc.domain.tax;

import com.example.taxcalc.domain.model.AgiResult;
import com.example.taxcalc.domain.model.ChildTaxCreditRules;
import com.example.taxcalc.domain.model.CreditsResult;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.Money;
import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.domain.model.TaxComputationResult;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Child Tax Credit. The credit first offsets income tax; what is left is refundable up to the
 * per-child refundable limit.
 */
public class CreditsApplier {

    private final ChildTaxCreditRules rules;

    public CreditsApplier(RateTable rateTable) {
        this.rules = rateTable.childTaxCredit();
    }

    public CreditsResult apply(int qualifyingChildren, FilingStatus status, AgiResult agi, TaxComputationResult tax) {
        BigDecimal liability = tax.totalIncomeTax();
        BigDecimal credit = childTaxCredit(qualifyingChildren, status, agi.agi());
        BigDecimal nonrefundable = Money.min(credit, liability);
        BigDecimal refundableLimit = rules.refundablePerChild().multiply(BigDecimal.valueOf(qualifyingChildren));
        BigDecimal refundable = Money.min(credit.subtract(nonrefundable), refundableLimit);

        return new CreditsResult(
                Money.round(credit),
                Money.round(nonrefundable),
                Money.round(refundable),
                Money.round(nonrefundable.add(refundable)),
                Money.round(Money.atLeastZero(liability.subtract(nonrefundable))));
    }

	/**
	 * Full credit reduced by a fixed amount for each step, or fraction of a step, of AGI above the
	 * phase-out threshold. Never negative.
	 *
	 * @param qualifyingChildren number of qualifying children
	 * @param status             filing status selecting the threshold
	 * @param agi                adjusted gross income
	 * @return credit before it is split into nonrefundable and refundable parts
	 */
    public BigDecimal childTaxCredit(int qualifyingChildren, FilingStatus status, BigDecimal agi) {
        if (qualifyingChildren <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal full = rules.amountPerChild().multiply(BigDecimal.valueOf(qualifyingChildren));
        BigDecimal excess = agi.subtract(rules.phaseOutThresholds().get(status));
        if (excess.signum() <= 0) {
            return full;
        }
        BigDecimal steps = excess.divide(rules.phaseOutStep(), 0, RoundingMode.CEILING);
        return Money.atLeastZero(full.subtract(steps.multiply(rules.phaseOutReductionPerStep())));
    }
}
