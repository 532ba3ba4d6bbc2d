package com.example.taxcalc.application.service;

import com.example.taxcalc.domain.exception.IncompleteInputException;
import com.example.taxcalc.domain.exception.TaxValidationException;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.FullTaxCalculationResult;
import com.example.taxcalc.domain.model.TaxEstimate;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.TaxSummary;
import com.example.taxcalc.domain.repository.CalculationRepository;
import com.example.taxcalc.domain.tax.TaxCalculationPipeline;
import com.example.taxcalc.infrastructure.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Application-layer service that runs tax calculations.
 * It validates the return, picks the pipeline for the return's year, and stores the outcome in the
 * calculation history. Storage is best effort: a failure becomes a warning on an otherwise successful result.
 */
@Service
public class TaxCalculationService {

    private static final Logger log = LoggerFactory.getLogger(TaxCalculationService.class);

    private final RateTableRegistry rateTableRegistry;
    private final TaxReturnValidator validator;
    private final CalculationRepository calculationRepository;
    private final boolean historyEnabled;

    public TaxCalculationService(RateTableRegistry rateTableRegistry,
                                 TaxReturnValidator validator,
                                 CalculationRepository calculationRepository,
                                 @Value("${app.history.enabled:true}") boolean historyEnabled) {
        this.rateTableRegistry = rateTableRegistry;
        this.validator = validator;
        this.calculationRepository = calculationRepository;
        this.historyEnabled = historyEnabled;
    }

	/**
	 * Validates and calculates a return, then records it in the history.
	 *
	 * @param input return supplied by the caller
	 * @return the full result, its history id when stored, and any warnings
	 * @throws com.example.taxcalc.domain.exception.DomainException when the return is rejected before calculation
	 */
    public CalculationOutcome calculate(TaxReturnInput input) {
        if (input == null) {
            throw new IncompleteInputException("Tax return is required.");
        }
        TaxCalculationPipeline pipeline = rateTableRegistry.pipelineFor(input.taxYear());
        validator.validate(input, pipeline.rateTable());

        FullTaxCalculationResult result = pipeline.calculate(input);
        TaxSummary summary = result.summary();
        log.debug("Calculated {} {}: income={} agi={} taxable={} incomeTax={} fica={} totalTax={}",
                summary.taxYear(), summary.filingStatus(), summary.totalIncome(), summary.agi(),
                summary.taxableIncome(), summary.totalIncomeTaxBeforeCredits(), summary.totalFica(), summary.totalTax());

        List<String> warnings = new ArrayList<>();
        Long calculationId = historyEnabled ? store(input, result, warnings) : null;
        return new CalculationOutcome(calculationId, result, warnings);
    }

	/**
	 * Quick estimate from gross income using the standard deduction and ordinary brackets only.
	 *
	 * @param grossIncome non-negative gross income
	 * @param status      filing status
	 * @param taxYear     year to use, or {@code null} for the default year
	 * @return estimate with bracket breakdown
	 */
    public TaxEstimate estimate(BigDecimal grossIncome, FilingStatus status, Integer taxYear) {
        if (grossIncome == null) {
            throw new IncompleteInputException("Gross income is required.");
        }
        if (status == null) {
            throw new IncompleteInputException("Filing status is required.");
        }
        if (grossIncome.signum() < 0) {
            throw new TaxValidationException("grossIncome", "Gross income must be non-negative.");
        }
        int year = taxYear != null ? taxYear : rateTableRegistry.defaultYear();
        return rateTableRegistry.pipelineFor(year).estimate(grossIncome, status);
    }

    private Long store(TaxReturnInput input, FullTaxCalculationResult result, List<String> warnings) {
        try {
            return calculationRepository.save(input, result);
        } catch (InfrastructureException ex) {
            log.warn("Calculation result was not saved to history: {}", ex.getMessage(), ex);
            warnings.add("Calculation was not saved to history.");
            return null;
        }
    }
}
