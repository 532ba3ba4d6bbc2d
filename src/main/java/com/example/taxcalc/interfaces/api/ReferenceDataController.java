package com.example.taxcalc.interfaces.api;

import com.example.taxcalc.application.service.ReferenceDataService;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.TaxBracket;
import com.example.taxcalc.interfaces.api.dto.BracketsResponse;
import com.example.taxcalc.interfaces.api.dto.DeductionsResponse;
import com.example.taxcalc.interfaces.api.dto.TaxYearsResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Interfaces-layer REST controller exposing the loaded rate tables.
 */
@RestController
@RequestMapping(value = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class ReferenceDataController {

    private final ReferenceDataService referenceDataService;

    public ReferenceDataController(ReferenceDataService referenceDataService) {
        this.referenceDataService = referenceDataService;
    }

    @GetMapping("/tax-years")
    public ResponseEntity<TaxYearsResponse> taxYears() {
        return ResponseEntity.ok(new TaxYearsResponse(referenceDataService.supportedYears(), referenceDataService.defaultYear()));
    }

    /**
     * @param year tax year
     * @return brackets for every filing status, in enum order
     */
    @GetMapping("/brackets/{year}")
    public ResponseEntity<BracketsResponse> brackets(@PathVariable("year") int year) {
        Map<FilingStatus, List<TaxBracket>> brackets = referenceDataService.brackets(year);
        List<BracketsResponse.StatusBrackets> statuses = Arrays.stream(FilingStatus.values())
                .map(status -> new BracketsResponse.StatusBrackets(status, status.displayName(),
                        brackets.get(status).stream()
                                .map(b -> new BracketsResponse.Bracket(b.lowerBound(), b.upperBound(), b.rate()))
                                .toList()))
                .toList();
        return ResponseEntity.ok(new BracketsResponse(year, statuses));
    }

    /**
     * @param year tax year
     * @return standard deduction and per-condition add-on for every filing status
     */
    @GetMapping("/deductions/{year}")
    public ResponseEntity<DeductionsResponse> deductions(@PathVariable("year") int year) {
        Map<FilingStatus, BigDecimal> standard = referenceDataService.standardDeductions(year);
        Map<FilingStatus, BigDecimal> additional = referenceDataService.additionalStandardDeductions(year);
        List<DeductionsResponse.StandardDeduction> rows = Arrays.stream(FilingStatus.values())
                .map(status -> new DeductionsResponse.StandardDeduction(status, status.displayName(),
                        standard.get(status), additional.get(status)))
                .toList();
        return ResponseEntity.ok(new DeductionsResponse(year, rows));
    }
}
