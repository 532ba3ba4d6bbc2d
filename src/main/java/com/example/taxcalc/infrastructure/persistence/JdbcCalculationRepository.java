package com.example.taxcalc.infrastructure.persistence;

import com.example.taxcalc.domain.model.CalculationSummary;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.FullTaxCalculationResult;
import com.example.taxcalc.domain.model.StoredCalculation;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.TaxSummary;
import com.example.taxcalc.domain.repository.CalculationRepository;
import com.example.taxcalc.infrastructure.exception.CalculationStorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Calculation history in the {@code tax_calculations} table.
 * Headline figures get their own columns for listing; the input and full result are kept as JSON documents.
 */
@Repository
public class JdbcCalculationRepository implements CalculationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCalculationRepository.class);

    private static final String INSERT = """
            INSERT INTO tax_calculations (created_at, tax_year, filing_status, input_data,
                total_income, agi, taxable_income, federal_tax, total_credits, total_tax,
                effective_rate, marginal_rate, refund_or_owed, result_data)
            VALUES (:createdAt, :taxYear, :filingStatus, :inputData,
                :totalIncome, :agi, :taxableIncome, :federalTax, :totalCredits, :totalTax,
                :effectiveRate, :marginalRate, :refundOrOwed, :resultData)
            """;
    private static final String SELECT_RECENT = """
            SELECT id, created_at, tax_year, filing_status, total_income, agi, taxable_income,
                federal_tax, total_credits, total_tax, effective_rate, marginal_rate, refund_or_owed
            FROM tax_calculations
            ORDER BY id DESC
            LIMIT :limit
            """;
    private static final String SELECT_BY_ID = """
            SELECT id, created_at, input_data, result_data
            FROM tax_calculations
            WHERE id = :id
            """;
    private static final String DELETE_BY_ID = "DELETE FROM tax_calculations WHERE id = :id";
    private static final RowMapper<CalculationSummary> SUMMARY_MAPPER = JdbcCalculationRepository::mapSummary;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcCalculationRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public long save(TaxReturnInput input, FullTaxCalculationResult result) {
        TaxSummary summary = result.summary();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("createdAt", Timestamp.from(Instant.now()))
                .addValue("taxYear", summary.taxYear())
                .addValue("filingStatus", summary.filingStatus().name())
                .addValue("inputData", toJson(input))
                .addValue("totalIncome", summary.totalIncome())
                .addValue("agi", summary.agi())
                .addValue("taxableIncome", summary.taxableIncome())
                .addValue("federalTax", summary.totalIncomeTaxBeforeCredits())
                .addValue("totalCredits", summary.totalCredits())
                .addValue("totalTax", summary.totalTax())
                .addValue("effectiveRate", summary.effectiveRate())
                .addValue("marginalRate", summary.marginalRate())
                .addValue("refundOrOwed", summary.refundOrOwed())
                .addValue("resultData", toJson(result));
        KeyHolder keys = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(INSERT, params, keys, new String[]{"id"});
        } catch (DataAccessException ex) {
            throw new CalculationStorageException("Unable to store calculation", ex);
        }
        Number id = keys.getKey();
        if (id == null) {
            throw new CalculationStorageException("No id generated for stored calculation", null);
        }
        log.debug("Stored calculation {} for {} {}", id, summary.taxYear(), summary.filingStatus());
        return id.longValue();
    }

    @Override
    public List<CalculationSummary> findRecent(int limit) {
        try {
            return jdbcTemplate.query(SELECT_RECENT, new MapSqlParameterSource("limit", limit), SUMMARY_MAPPER);
        } catch (DataAccessException ex) {
            throw new CalculationStorageException("Unable to list calculations", ex);
        }
    }

    @Override
    public Optional<StoredCalculation> findById(long id) {
        List<StoredCalculation> rows;
        try {
            rows = jdbcTemplate.query(SELECT_BY_ID, new MapSqlParameterSource("id", id), (rs, rowNum) -> new StoredCalculation(
                    rs.getLong("id"),
                    rs.getTimestamp("created_at").toInstant(),
                    fromJson(rs.getString("input_data"), TaxReturnInput.class),
                    fromJson(rs.getString("result_data"), FullTaxCalculationResult.class)));
        } catch (DataAccessException ex) {
            throw new CalculationStorageException("Unable to read calculation " + id, ex);
        }
        return rows.stream().findFirst();
    }

    @Override
    public boolean deleteById(long id) {
        try {
            return jdbcTemplate.update(DELETE_BY_ID, new MapSqlParameterSource("id", id)) > 0;
        } catch (DataAccessException ex) {
            throw new CalculationStorageException("Unable to delete calculation " + id, ex);
        }
    }

    private static CalculationSummary mapSummary(ResultSet rs, int rowNum) throws SQLException {
        return new CalculationSummary(
                rs.getLong("id"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getInt("tax_year"),
                FilingStatus.valueOf(rs.getString("filing_status")),
                rs.getBigDecimal("total_income"),
                rs.getBigDecimal("agi"),
                rs.getBigDecimal("taxable_income"),
                rs.getBigDecimal("federal_tax"),
                rs.getBigDecimal("total_credits"),
                rs.getBigDecimal("total_tax"),
                rs.getBigDecimal("effective_rate"),
                rs.getBigDecimal("marginal_rate"),
                rs.getBigDecimal("refund_or_owed"));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new CalculationStorageException("Unable to serialize " + value.getClass().getSimpleName(), ex);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new CalculationStorageException("Stored " + type.getSimpleName() + " is unreadable", ex);
        }
    }
}
