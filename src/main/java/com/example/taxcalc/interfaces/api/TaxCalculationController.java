package com.example.taxcalc.interfaces.api;

import com.example.taxcalc.application.service.CalculationOutcome;
import com.example.taxcalc.application.service.TaxCalculationService;
import com.example.taxcalc.domain.exception.IncompleteInputException;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.TaxEstimate;
import com.example.taxcalc.interfaces.api.dto.EstimateRequest;
import com.example.taxcalc.interfaces.api.dto.TaxReturnRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Interfaces-layer REST controller for full calculations and quick estimates.
 */
@RestController
@RequestMapping(value = "/api/calculate", produces = MediaType.APPLICATION_JSON_VALUE)
public class TaxCalculationController {

    private final TaxCalculationService taxCalculationService;
    private final int defaultYear;

    /**
     * @param taxCalculationService service running the calculation pipeline
     * @param defaultYear           tax year applied when a request names none
     */
    public TaxCalculationController(TaxCalculationService taxCalculationService,
                                    @Value("${app.tax.default-year}") int defaultYear) {
        this.taxCalculationService = taxCalculationService;
        this.defaultYear = defaultYear;
    }

    /**
     * Calculates a full return.
     *
     * @param request tax return in JSON form
     * @return result, history id and warnings
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CalculationOutcome> calculate(@RequestBody TaxReturnRequest request) {
        if (request == null) {
            throw new IncompleteInputException("Tax return is required.");
        }
        return ResponseEntity.ok(taxCalculationService.calculate(request.toInput(defaultYear)));
    }

    /**
     * Estimates tax from gross income and filing status only.
     *
     * @param request gross income, filing status and optional year
     * @return estimate with bracket breakdown
     */
    @PostMapping(value = "/estimate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TaxEstimate> estimate(@RequestBody EstimateRequest request) {
        FilingStatus status = FilingStatus.fromTag(request.filingStatus());
        return ResponseEntity.ok(taxCalculationService.estimate(request.grossIncome(), status, request.taxYear()));
    }
}
