package com.example.taxcalc.application.service;

import com.example.taxcalc.application.exception.UseCaseValidationException;
import com.example.taxcalc.domain.exception.CalculationNotFoundException;
import com.example.taxcalc.domain.model.CalculationSummary;
import com.example.taxcalc.domain.model.StoredCalculation;
import com.example.taxcalc.domain.repository.CalculationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read and delete access to stored calculations.
 */
@Service
public class CalculationHistoryService {

    private static final Logger log = LoggerFactory.getLogger(CalculationHistoryService.class);
    static final int DEFAULT_PAGE_SIZE = 20;

    private final CalculationRepository calculationRepository;
    private final int maxPageSize;

    public CalculationHistoryService(CalculationRepository calculationRepository,
                                     @Value("${app.history.max-page-size:500}") int maxPageSize) {
        this.calculationRepository = calculationRepository;
        this.maxPageSize = maxPageSize;
    }

	/**
	 * Lists the newest calculations first.
	 *
	 * @param limit number of rows, or {@code null} for the default page size
	 * @return summaries, newest first
	 * @throws UseCaseValidationException when the limit is outside {@code 1..max-page-size}
	 */
    public List<CalculationSummary> recent(Integer limit) {
        int size = limit != null ? limit : DEFAULT_PAGE_SIZE;
        if (size < 1 || size > maxPageSize) {
            throw new UseCaseValidationException("limit must be between 1 and " + maxPageSize + ".");
        }
        return calculationRepository.findRecent(size);
    }

    public StoredCalculation get(long id) {
        return calculationRepository.findById(id).orElseThrow(() -> new CalculationNotFoundException(id));
    }

	/**
	 * @param id calculation to remove
	 * @throws CalculationNotFoundException when no calculation has that id
	 */
    public void delete(long id) {
        if (!calculationRepository.deleteById(id)) {
            throw new CalculationNotFoundException(id);
        }
        log.info("Deleted calculation {}", id);
    }
}
