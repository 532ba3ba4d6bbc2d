package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Income taxed inside one ordinary bracket.
 */
public record BracketSlice(
        BigDecimal rate,
        BigDecimal lowerBound,
        BigDecimal upperBound,
        BigDecimal taxableAmount,
        BigDecimal tax
) {
}
