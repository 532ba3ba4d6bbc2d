package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Broker proceeds (Form 1099-B) reduced to net short-term and long-term gain. Either may be negative.
 */
public record Form1099B(BigDecimal shortTermGain, BigDecimal longTermGain) {
    public Form1099B {
        shortTermGain = Money.orZero(shortTermGain);
        longTermGain = Money.orZero(longTermGain);
    }
}
