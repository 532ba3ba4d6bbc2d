package com.example.taxcalc.interfaces.api.dto;

import com.example.taxcalc.domain.model.FilingStatus;

import java.math.BigDecimal;
import java.util.List;

/**
 * Standard deductions of one tax year, with the add-on granted per age or blindness condition.
 */
public record DeductionsResponse(int taxYear, List<StandardDeduction> standardDeductions) {

    public record StandardDeduction(FilingStatus filingStatus,
                                    String displayName,
                                    BigDecimal amount,
                                    BigDecimal additionalPerCondition) {
    }
}
