package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * Statutory caps on individual Schedule 1 adjustments.
 */
public record AboveTheLineLimits(BigDecimal studentLoanInterestCap, BigDecimal educatorExpensesCap) {
}
