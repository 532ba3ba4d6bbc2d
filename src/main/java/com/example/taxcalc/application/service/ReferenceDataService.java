package com.example.taxcalc.application.service;

import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.TaxBracket;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the loaded rate tables for reference endpoints.
 */
@Service
public class ReferenceDataService {

    private final RateTableRegistry rateTableRegistry;

    public ReferenceDataService(RateTableRegistry rateTableRegistry) {
        this.rateTableRegistry = rateTableRegistry;
    }

    public List<Integer> supportedYears() {
        return rateTableRegistry.supportedYears();
    }

    public int defaultYear() {
        return rateTableRegistry.defaultYear();
    }

    /**
     * @throws com.example.taxcalc.domain.exception.UnsupportedTaxYearException when the year has no table
     */
    public Map<FilingStatus, List<TaxBracket>> brackets(int taxYear) {
        return rateTableRegistry.require(taxYear).ordinaryBrackets();
    }

    public Map<FilingStatus, BigDecimal> standardDeductions(int taxYear) {
        return rateTableRegistry.require(taxYear).standardDeductions();
    }

    public Map<FilingStatus, BigDecimal> additionalStandardDeductions(int taxYear) {
        return rateTableRegistry.require(taxYear).additionalStandardDeductions();
    }
}
