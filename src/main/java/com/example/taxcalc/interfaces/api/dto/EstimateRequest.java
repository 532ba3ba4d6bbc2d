package com.example.taxcalc.interfaces.api.dto;

import java.math.BigDecimal;

/**
 * JSON body of {@code POST /api/calculate/estimate}; {@code taxYear} is optional.
 */
public record EstimateRequest(BigDecimal grossIncome, String filingStatus, Integer taxYear) {
}
