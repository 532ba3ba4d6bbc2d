package com.example.taxcalc.application.service;

import com.example.taxcalc.domain.exception.UnsupportedScenarioException;
import com.example.taxcalc.domain.exception.UnsupportedTaxYearException;
import com.example.taxcalc.support.TestRateTables;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RateTableRegistryTest {

    @Test
    void loadsShippedTables() {
        RateTableRegistry registry = new RateTableRegistry(TestRateTables.loader(), 2024);

        assertThat(registry.supportedYears()).containsExactly(2024);
        assertThat(registry.defaultYear()).isEqualTo(2024);
        assertThat(registry.pipelineFor(2024).rateTable().taxYear()).isEqualTo(2024);
    }

    /**
     * An unknown year is reported as an unsupported scenario.
     */
    @Test
    void unknownYearIsUnsupported() {
        RateTableRegistry registry = new RateTableRegistry(List.of(TestRateTables.year2024()), 2024);

        UnsupportedTaxYearException ex = assertThrows(UnsupportedTaxYearException.class, () -> registry.require(2019));
        assertThat(ex).isInstanceOf(UnsupportedScenarioException.class);
        assertThat(ex.getMessage()).contains("2019");
    }

    @Test
    void defaultYearMustHaveTable() {
        assertThrows(IllegalStateException.class, () -> new RateTableRegistry(List.of(TestRateTables.year2024()), 2025));
    }

    @Test
    void duplicateYearsAreRejected() {
        assertThrows(IllegalStateException.class, () -> new RateTableRegistry(
                List.of(TestRateTables.year2024(), TestRateTables.year2024()), 2024));
    }
}
