package com.example.taxcalc.application.service;

import com.example.taxcalc.application.exception.UseCaseValidationException;
import com.example.taxcalc.domain.exception.CalculationNotFoundException;
import com.example.taxcalc.domain.repository.CalculationRepository;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.mockito.Mockito;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertThrows;

class CalculationHistoryServiceTest {

    private final CalculationRepository repository = Mockito.mock(CalculationRepository.class);
    private final CalculationHistoryService service = new CalculationHistoryService(repository, 100);

    @Test
    void defaultsPageSize() {
        BDDMockito.given(repository.findRecent(CalculationHistoryService.DEFAULT_PAGE_SIZE)).willReturn(List.of());

        service.recent(null);

        Mockito.verify(repository).findRecent(CalculationHistoryService.DEFAULT_PAGE_SIZE);
    }

    @Test
    void rejectsPageSizeOutsideRange() {
        assertThrows(UseCaseValidationException.class, () -> service.recent(0));
        assertThrows(UseCaseValidationException.class, () -> service.recent(101));
        Mockito.verifyNoInteractions(repository);
    }

    @Test
    void missingCalculationIsNotFound() {
        BDDMockito.given(repository.findById(5L)).willReturn(Optional.empty());
        BDDMockito.given(repository.deleteById(5L)).willReturn(false);

        assertThrows(CalculationNotFoundException.class, () -> service.get(5L));
        assertThrows(CalculationNotFoundException.class, () -> service.delete(5L));
    }

    @Test
    void deletesExistingCalculation() {
        BDDMockito.given(repository.deleteById(3L)).willReturn(true);

        service.delete(3L);

        Mockito.verify(repository).deleteById(3L);
    }
}
