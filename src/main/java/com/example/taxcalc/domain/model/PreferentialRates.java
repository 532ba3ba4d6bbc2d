package com.example.taxcalc.domain.model;

import java.math.BigDecimal;

/**
 * The three rates applied to qualified dividends and net capital gain (0%, 15% and 20% for current years).
 */
public record PreferentialRates(BigDecimal lowRate, BigDecimal middleRate, BigDecimal highRate) {
}
