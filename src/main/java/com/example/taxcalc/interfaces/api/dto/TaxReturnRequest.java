package com.example.taxcalc.interfaces.api.dto;

import com.example.taxcalc.domain.model.AboveTheLineDeductions;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.Form1099B;
import com.example.taxcalc.domain.model.Form1099Div;
import com.example.taxcalc.domain.model.Form1099Int;
import com.example.taxcalc.domain.model.Form1099Nec;
import com.example.taxcalc.domain.model.ItemizedDeductions;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.W2Form;

import java.math.BigDecimal;
import java.util.List;

/**
 * JSON body of {@code POST /api/calculate}. The filing status arrives as a free-form tag and optional
 * flags and counts may be omitted.
 */
public record TaxReturnRequest(
        Integer taxYear,
        String filingStatus,
        Boolean taxpayerOver65,
        Boolean taxpayerBlind,
        Boolean spouseOver65,
        Boolean spouseBlind,
        List<W2Form> w2Forms,
        List<Form1099Nec> necForms,
        List<Form1099Int> interestForms,
        List<Form1099Div> dividendForms,
        List<Form1099B> brokerForms,
        ItemizedDeductions itemizedDeductions,
        Boolean forceStandardDeduction,
        AboveTheLineDeductions adjustments,
        Integer qualifyingChildren,
        BigDecimal estimatedPayments
) {

	/**
	 * Converts the request into the immutable domain return.
	 *
	 * @param defaultYear year applied when the request names none
	 * @return domain return ready for validation
	 */
    public TaxReturnInput toInput(int defaultYear) {
        return new TaxReturnInput(
                taxYear != null ? taxYear : defaultYear,
                FilingStatus.fromTag(filingStatus),
                Boolean.TRUE.equals(taxpayerOver65),
                Boolean.TRUE.equals(taxpayerBlind),
                Boolean.TRUE.equals(spouseOver65),
                Boolean.TRUE.equals(spouseBlind),
                w2Forms,
                necForms,
                interestForms,
                dividendForms,
                brokerForms,
                itemizedDeductions,
                Boolean.TRUE.equals(forceStandardDeduction),
                adjustments,
                qualifyingChildren != null ? qualifyingChildren : 0,
                estimatedPayments);
    }
}
