package com.example.taxcalc.infrastructure.ratetable;

import com.example.taxcalc.domain.model.RateTable;
import com.example.taxcalc.infrastructure.exception.RateTableLoadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads per-year rate tables from JSON resources.
 * Each file holds one {@link RateTable}; the record's own checks reject incomplete tables.
 */
@Component
public class JsonRateTableLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonRateTableLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resolver;
    private final String location;

    /**
     * @param objectMapper   mapper used to bind the JSON files
     * @param resourceLoader loader used to resolve the location pattern
     * @param location       resource pattern, e.g. {@code classpath*:tax-tables/*.json}
     */
    public JsonRateTableLoader(ObjectMapper objectMapper,
                               ResourceLoader resourceLoader,
                               @Value("${app.tax.rate-table-location}") String location) {
        this.objectMapper = objectMapper;
        this.resolver = ResourcePatternUtils.getResourcePatternResolver(resourceLoader);
        this.location = location;
    }

	/**
	 * Loads every table matching the configured location, ordered by tax year.
	 *
	 * @return loaded tables, possibly empty
	 * @throws RateTableLoadException when a file cannot be read or fails validation
	 */
    public List<RateTable> loadAll() {
        Resource[] resources;
        try {
            resources = resolver.getResources(location);
        } catch (IOException ex) {
            throw new RateTableLoadException("Unable to resolve rate tables at " + location, ex);
        }
        List<RateTable> tables = new ArrayList<>();
        for (Resource resource : resources) {
            tables.add(load(resource));
        }
        tables.sort(Comparator.comparingInt(RateTable::taxYear));
        log.info("Loaded {} rate table(s) from {}", tables.size(), location);
        return tables;
    }

	/**
	 * Binds a single resource to a {@link RateTable}.
	 *
	 * @param resource JSON file
	 * @return parsed and validated table
	 * @throws RateTableLoadException when the file is unreadable or inconsistent
	 */
    public RateTable load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            RateTable table = objectMapper.readValue(in, RateTable.class);
            log.debug("Rate table {} read from {}", table.taxYear(), resource.getDescription());
            return table;
        } catch (IOException | IllegalArgumentException ex) {
            throw new RateTableLoadException("Invalid rate table " + resource.getDescription() + ": " + ex.getMessage(), ex);
        }
    }
}
