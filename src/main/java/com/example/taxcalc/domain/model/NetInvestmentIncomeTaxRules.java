package com.example.taxcalc.domain.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Surtax on net investment income above a MAGI threshold (IRC section 1411).
 */
public record NetInvestmentIncomeTaxRules(BigDecimal rate, Map<FilingStatus, BigDecimal> thresholds) {
}
