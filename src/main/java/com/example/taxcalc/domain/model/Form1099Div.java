package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Dividend income (Form 1099-DIV). Qualified dividends (box 1b) are a subset of ordinary dividends (box 1a).
 */
public record Form1099Div(BigDecimal ordinaryDividends, BigDecimal qualifiedDividends) {
    public Form1099Div {
        ordinaryDividends = Money.orZero(ordinaryDividends);
        qualifiedDividends = Money.orZero(qualifiedDividends);
    }
}
