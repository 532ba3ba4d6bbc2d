package com.example.taxcalc.domain.repository;

import com.example.taxcalc.domain.model.CalculationSummary;
import com.example.taxcalc.domain.model.FullTaxCalculationResult;
import com.example.taxcalc.domain.model.StoredCalculation;
import com.example.taxcalc.domain.model.TaxReturnInput;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for completed calculations. Identifiers are assigned by the store and increase monotonically.
 */
public interface CalculationRepository {

    long save(TaxReturnInput input, FullTaxCalculationResult result);

    /**
     * @param limit maximum number of rows, newest first
     */
    List<CalculationSummary> findRecent(int limit);

    Optional<StoredCalculation> findById(long id);

    boolean deleteById(long id);
}
