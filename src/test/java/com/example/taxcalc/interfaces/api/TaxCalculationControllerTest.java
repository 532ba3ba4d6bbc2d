package com.example.taxcalc.interfaces.api;

import com.example.taxcalc.application.service.CalculationOutcome;
import com.example.taxcalc.application.service.TaxCalculationService;
import com.example.taxcalc.domain.exception.TaxValidationException;
import com.example.taxcalc.domain.exception.UnsupportedTaxYearException;
import com.example.taxcalc.domain.model.FilingStatus;
import com.example.taxcalc.domain.model.TaxEstimate;
import com.example.taxcalc.domain.model.TaxReturnInput;
import com.example.taxcalc.domain.model.W2Form;
import com.example.taxcalc.domain.tax.TaxCalculationPipeline;
import com.example.taxcalc.infrastructure.exception.CalculationStorageException;
import com.example.taxcalc.interfaces.api.error.GlobalExceptionHandler;
import com.example.taxcalc.support.TestRateTables;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.BDDMockito;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the calculation endpoints and their error mapping.
 */
@WebMvcTest(controllers = TaxCalculationController.class)
@Import(GlobalExceptionHandler.class)
class TaxCalculationControllerTest {

    private static final String SINGLE_RETURN = """
            {
              "filingStatus": "single",
              "w2Forms": [ { "wages": 50000, "federalWithholding": 4000 } ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TaxCalculationService taxCalculationService;

    /**
     * Verifies the request is mapped to a domain return for the default year and the outcome is returned.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void calculateReturnsOutcome() throws Exception {
        TaxReturnInput input = TaxReturnInput.builder(2024, FilingStatus.SINGLE)
                .w2(W2Form.ofWages(new BigDecimal("50000"), new BigDecimal("4000")))
                .build();
        CalculationOutcome outcome = new CalculationOutcome(42L,
                new TaxCalculationPipeline(TestRateTables.year2024()).calculate(input), List.of());
        BDDMockito.given(taxCalculationService.calculate(any(TaxReturnInput.class))).willReturn(outcome);

        mockMvc.perform(post("/api/calculate").contentType(MediaType.APPLICATION_JSON).content(SINGLE_RETURN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.calculationId").value(42))
                .andExpect(jsonPath("$.result.summary.filingStatus").value("SINGLE"))
                .andExpect(jsonPath("$.result.summary.totalTax").value(7841.0))
                .andExpect(jsonPath("$.warnings").isEmpty());

        ArgumentCaptor<TaxReturnInput> captor = ArgumentCaptor.forClass(TaxReturnInput.class);
        Mockito.verify(taxCalculationService).calculate(captor.capture());
        assertThat(captor.getValue().taxYear()).isEqualTo(2024);
        assertThat(captor.getValue().w2Forms()).singleElement()
                .satisfies(form -> assertThat(form.medicareWages()).isEqualByComparingTo("50000"));
    }

    /**
     * Verifies an unknown filing status translates to HTTP 422.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unknownFilingStatusMappedTo422() throws Exception {
        mockMvc.perform(post("/api/calculate").contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"filingStatus\": \"domestic-partner\" }"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INVALID_FILING_STATUS"));
    }

    /**
     * Verifies a missing filing status translates to HTTP 422.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingFilingStatusMappedTo422() throws Exception {
        mockMvc.perform(post("/api/calculate").contentType(MediaType.APPLICATION_JSON).content("{ \"taxYear\": 2024 }"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INCOMPLETE_INPUT"));
    }

    /**
     * Verifies validation errors carry the form, record index and field.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void validationErrorCarriesDetails() throws Exception {
        BDDMockito.given(taxCalculationService.calculate(any(TaxReturnInput.class)))
                .willThrow(new TaxValidationException("W-2", 2, "wages", "wages must be non-negative"));

        mockMvc.perform(post("/api/calculate").contentType(MediaType.APPLICATION_JSON).content(SINGLE_RETURN))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("W-2 #2: wages must be non-negative"))
                .andExpect(jsonPath("$.details.form").value("W-2"))
                .andExpect(jsonPath("$.details.recordIndex").value(2))
                .andExpect(jsonPath("$.details.field").value("wages"));
    }

    /**
     * Verifies unsupported years translate to HTTP 400.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void unsupportedYearMappedToBadRequest() throws Exception {
        BDDMockito.given(taxCalculationService.calculate(any(TaxReturnInput.class)))
                .willThrow(new UnsupportedTaxYearException(2019));

        mockMvc.perform(post("/api/calculate").contentType(MediaType.APPLICATION_JSON).content(SINGLE_RETURN))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNSUPPORTED_SCENARIO"));
    }

    /**
     * Verifies unreadable numbers translate to HTTP 400.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void malformedJsonMappedToBadRequest() throws Exception {
        mockMvc.perform(post("/api/calculate").contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"filingStatus\": \"single\", \"w2Forms\": [ { \"wages\": \"lots\" } ] }"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    /**
     * Verifies infrastructure errors translate to HTTP 500.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(taxCalculationService.calculate(any(TaxReturnInput.class)))
                .willThrow(new CalculationStorageException("Unable", new RuntimeException("boom")));

        mockMvc.perform(post("/api/calculate").contentType(MediaType.APPLICATION_JSON).content(SINGLE_RETURN))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    /**
     * Verifies the estimate endpoint parses the status tag and passes the optional year through.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void estimateReturnsBreakdown() throws Exception {
        TaxEstimate estimate = new TaxCalculationPipeline(TestRateTables.year2024())
                .estimate(new BigDecimal("60000"), FilingStatus.SINGLE);
        BDDMockito.given(taxCalculationService.estimate(any(BigDecimal.class), BDDMockito.eq(FilingStatus.SINGLE), BDDMockito.isNull()))
                .willReturn(estimate);

        mockMvc.perform(post("/api/calculate/estimate").contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"grossIncome\": 60000, \"filingStatus\": \"SINGLE\" }"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.estimatedTax").value(5216.0))
                .andExpect(jsonPath("$.breakdown.length()").value(2));
    }
}
