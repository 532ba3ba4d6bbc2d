package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Nonemployee compensation (Form 1099-NEC box 1), treated as net self-employment income.
 */
public record Form1099Nec(BigDecimal compensation) {
    public Form1099Nec {
        compensation = Money.orZero(compensation);
    }
}
