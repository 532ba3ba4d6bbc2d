package com.example.taxcalc.interfaces.api.dto;

import com.example.taxcalc.domain.model.FilingStatus;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ordinary brackets of one tax year for every filing status. A {@code null} upper bound marks the top bracket.
 */
public record BracketsResponse(int taxYear, List<StatusBrackets> filingStatuses) {

    public record StatusBrackets(FilingStatus filingStatus, String displayName, List<Bracket> brackets) {
    }

    public record Bracket(BigDecimal lowerBound, BigDecimal upperBound, BigDecimal rate) {
    }
}
