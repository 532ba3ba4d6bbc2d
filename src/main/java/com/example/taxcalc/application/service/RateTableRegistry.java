package com.example.taxcalc.application.service;

import com.example.taxcalc.domain.exception.UnsupportedTaxYearException;
import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.domain.tax.TaxCalculationPipeline;
import com.example.taxcalc.infrastructure.ratetable.JsonRateTableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Year-keyed registry of the rate tables loaded at startup, each with its ready-to-use pipeline.
 */
@Service
public class RateTableRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateTableRegistry.class);

    private final Map<Integer, TaxCalculationPipeline> pipelines;
    private final int defaultYear;

	/**
	 * Loads every configured rate table.
	 *
	 * @param loader      reader for the rate-table files
	 * @param defaultYear year used when a request names none
	 */
    @Autowired
    public RateTableRegistry(JsonRateTableLoader loader, @Value("${app.tax.default-year}") int defaultYear) {
        this(loader.loadAll(), defaultYear);
    }

	/**
	 * Registers the given tables.
	 *
	 * @param tables      tables for distinct years
	 * @param defaultYear year used when a request names none; must be one of the tables
	 * @throws IllegalStateException when two tables share a year or the default year has no table
	 */
    public RateTableRegistry(List<RateTable> tables, int defaultYear) {
        Map<Integer, TaxCalculationPipeline> byYear = new TreeMap<>();
        for (RateTable table : tables) {
            if (byYear.putIfAbsent(table.taxYear(), new TaxCalculationPipeline(table)) != null) {
                throw new IllegalStateException("Duplicate rate table for tax year " + table.taxYear());
            }
        }
        if (!byYear.containsKey(defaultYear)) {
            throw new IllegalStateException("No rate table for default tax year " + defaultYear);
        }
        this.pipelines = Collections.unmodifiableMap(byYear);
        this.defaultYear = defaultYear;
        log.info("Supported tax years: {} (default {})", byYear.keySet(), defaultYear);
    }

	/**
	 * @param taxYear requested year
	 * @return pipeline bound to that year's table
	 * @throws UnsupportedTaxYearException when no table exists for the year
	 */
    public TaxCalculationPipeline pipelineFor(int taxYear) {
        TaxCalculationPipeline pipeline = pipelines.get(taxYear);
        if (pipeline == null) {
            throw new UnsupportedTaxYearException(taxYear);
        }
        return pipeline;
    }

    public RateTable require(int taxYear) {
        return pipelineFor(taxYear).rateTable();
    }

    /**
     * @return supported years in ascending order
     */
    public List<Integer> supportedYears() {
        return List.copyOf(pipelines.keySet());
    }

    public int defaultYear() {
        return defaultYear;
    }
}
