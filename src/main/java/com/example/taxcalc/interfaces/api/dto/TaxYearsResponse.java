package com.example.taxcalc.interfaces.api.dto;

import java.util.List;

public record TaxYearsResponse(List<Integer> supportedYears, int defaultYear) {
}
