package com.example.taxcalc.domain.model;

import com.example.taxcalc.domain.exception.IncompleteInputException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of one federal return: filing situation, income statements, deductions,
 * credit inputs and payments already made.
 * The constructor guards structure only (missing status, missing records); numeric constraints
 * are checked by the application-layer validator before the return reaches the pipeline.
 */
public record TaxReturnInput(
        int taxYear,
        FilingStatus filingStatus,
        boolean taxpayerOver65,
        boolean taxpayerBlind,
        boolean spouseOver65,
        boolean spouseBlind,
        List<W2Form> w2Forms,
        List<Form1099Nec> necForms,
        List<Form1099Int> interestForms,
        List<Form1099Div> dividendForms,
        List<Form1099B> brokerForms,
        ItemizedDeductions itemizedDeductions,
        boolean forceStandardDeduction,
        AboveTheLineDeductions adjustments,
        int qualifyingChildren,
        BigDecimal estimatedPayments
) {
    public TaxReturnInput {
        if (filingStatus == null) {
            throw new IncompleteInputException("Filing status is required.");
        }
        w2Forms = requireRecords("W-2", w2Forms);
        necForms = requireRecords("1099-NEC", necForms);
        interestForms = requireRecords("1099-INT", interestForms);
        dividendForms = requireRecords("1099-DIV", dividendForms);
        brokerForms = requireRecords("1099-B", brokerForms);
        adjustments = adjustments != null ? adjustments : AboveTheLineDeductions.NONE;
        estimatedPayments = Money.orZero(estimatedPayments);
    }

    public static Builder builder(int taxYear, FilingStatus filingStatus) {
        return new Builder(taxYear, filingStatus);
    }

    private static <T> List<T> requireRecords(String form, List<T> records) {
        if (records == null) {
            return List.of();
        }
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i) == null) {
                throw new IncompleteInputException(form + " #" + (i + 1) + ": record is missing.");
            }
        }
        return List.copyOf(records);
    }

    /**
     * Fluent assembly of a return, mostly used by tests and the quick-estimate path.
     */
    public static final class Builder {
        private final int taxYear;
        private final FilingStatus filingStatus;
        private boolean taxpayerOver65;
        private boolean taxpayerBlind;
        private boolean spouseOver65;
        private boolean spouseBlind;
        private final List<W2Form> w2Forms = new ArrayList<>();
        private final List<Form1099Nec> necForms = new ArrayList<>();
        private final List<Form1099Int> interestForms = new ArrayList<>();
        private final List<Form1099Div> dividendForms = new ArrayList<>();
        private final List<Form1099B> brokerForms = new ArrayList<>();
        private ItemizedDeductions itemizedDeductions;
        private boolean forceStandardDeduction;
        private AboveTheLineDeductions adjustments = AboveTheLineDeductions.NONE;
        private int qualifyingChildren;
        private BigDecimal estimatedPayments = BigDecimal.ZERO;

        private Builder(int taxYear, FilingStatus filingStatus) {
            this.taxYear = taxYear;
            this.filingStatus = filingStatus;
        }

        public Builder taxpayerOver65(boolean value) {
            this.taxpayerOver65 = value;
            return this;
        }

        public Builder taxpayerBlind(boolean value) {
            this.taxpayerBlind = value;
            return this;
        }

        public Builder spouseOver65(boolean value) {
            this.spouseOver65 = value;
            return this;
        }

        public Builder spouseBlind(boolean value) {
            this.spouseBlind = value;
            return this;
        }

        public Builder w2(W2Form form) {
            this.w2Forms.add(form);
            return this;
        }

        public Builder nec(Form1099Nec form) {
            this.necForms.add(form);
            return this;
        }

        public Builder interest(Form1099Int form) {
            this.interestForms.add(form);
            return this;
        }

        public Builder dividends(Form1099Div form) {
            this.dividendForms.add(form);
            return this;
        }

        public Builder broker(Form1099B form) {
            this.brokerForms.add(form);
            return this;
        }

        public Builder itemizedDeductions(ItemizedDeductions value) {
            this.itemizedDeductions = value;
            return this;
        }

        public Builder forceStandardDeduction(boolean value) {
            this.forceStandardDeduction = value;
            return this;
        }

        public Builder adjustments(AboveTheLineDeductions value) {
            this.adjustments = value;
            return this;
        }

        public Builder qualifyingChildren(int value) {
            this.qualifyingChildren = value;
            return this;
        }

        public Builder estimatedPayments(BigDecimal value) {
            this.estimatedPayments = value;
            return this;
        }

        public TaxReturnInput build() {
            return new TaxReturnInput(taxYear, filingStatus, taxpayerOver65, taxpayerBlind, spouseOver65, spouseBlind,
                    w2Forms, necForms, interestForms, dividendForms, brokerForms, itemizedDeductions,
                    forceStandardDeduction, adjustments, qualifyingChildren, estimatedPayments);
        }
    }
}
