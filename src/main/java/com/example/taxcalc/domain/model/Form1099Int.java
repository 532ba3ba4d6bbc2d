package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Interest income (Form 1099-INT box 1).
 */
public record Form1099Int(BigDecimal interest) {
    public Form1099Int {
        interest = Money.orZero(interest);
    }
}
