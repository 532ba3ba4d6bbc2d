package com.example.taxcalc.interfaces.api;

import com.example.taxcalc.application.service.CalculationHistoryService;
import com.example.taxcalc.domain.model.CalculationSummary;
import com.example.taxcalc.domain.model.StoredCalculation;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Interfaces-layer REST controller for the calculation history.
 */
@RestController
@RequestMapping(value = "/api/history", produces = MediaType.APPLICATION_JSON_VALUE)
public class CalculationHistoryController {

    private final CalculationHistoryService historyService;

    public CalculationHistoryController(CalculationHistoryService historyService) {
        this.historyService = historyService;
    }

    /**
     * @param limit optional page size
     * @return newest calculations first
     */
    @GetMapping
    public ResponseEntity<List<CalculationSummary>> recent(@RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(historyService.recent(limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<StoredCalculation> get(@PathVariable("id") long id) {
        return ResponseEntity.ok(historyService.get(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        historyService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
