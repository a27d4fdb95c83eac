package com.locamat.rental.service;

import com.locamat.rental.model.EquipmentStatus;
import com.locamat.rental.repository.ContractLineRepository;
import com.locamat.rental.repository.RentalContractRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.locamat.rental.service.RentalTestData.contract;
import static com.locamat.rental.service.RentalTestData.line;
import static com.locamat.rental.service.RentalTestData.unit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskClassifierTest {

    private static final long CLIENT_ID = 11L;
    private static final LocalDate PLANNED = LocalDate.of(2024, 1, 10);

    @Mock private RentalContractRepository contractRepository;
    @Mock private ContractLineRepository contractLineRepository;

    private RiskClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new RiskClassifier(contractRepository, contractLineRepository);
    }

    @Test
    void isRisky_noPriorContract_false() {
        when(contractRepository.findFirstByClientIdOrderByIdDesc(CLIENT_ID)).thenReturn(Optional.empty());

        assertThat(classifier.isRisky(CLIENT_ID)).isFalse();
        verify(contractLineRepository, never()).findByContractIdOrderByIdAsc(any());
    }

    @Test
    void isRisky_latestContractHasLateLine_true() {
        var latest = contract(30L, LocalDate.of(2024, 1, 1), PLANNED);
        var onTime = line(1L, latest, unit(1L, "10.00", EquipmentStatus.AVAILABLE));
        var late = line(2L, latest, unit(2L, "10.00", EquipmentStatus.AVAILABLE));
        onTime.recordReturn(PLANNED, 0, BigDecimal.ZERO);
        late.recordReturn(PLANNED.plusDays(1), 1, new BigDecimal("5.00"));
        when(contractRepository.findFirstByClientIdOrderByIdDesc(CLIENT_ID)).thenReturn(Optional.of(latest));
        when(contractLineRepository.findByContractIdOrderByIdAsc(30L)).thenReturn(List.of(onTime, late));

        assertThat(classifier.isRisky(CLIENT_ID)).isTrue();
    }

    @Test
    void isRisky_latestContractOnTimeOrOpen_false() {
        var latest = contract(31L, LocalDate.of(2024, 1, 1), PLANNED);
        var early = line(3L, latest, unit(3L, "10.00", EquipmentStatus.AVAILABLE));
        var open = line(4L, latest, unit(4L, "10.00", EquipmentStatus.RENTED));
        early.recordReturn(PLANNED.minusDays(2), 0, BigDecimal.ZERO);
        when(contractRepository.findFirstByClientIdOrderByIdDesc(CLIENT_ID)).thenReturn(Optional.of(latest));
        when(contractLineRepository.findByContractIdOrderByIdAsc(31L)).thenReturn(List.of(early, open));

        assertThat(classifier.isRisky(CLIENT_ID)).isFalse();
    }

    @Test
    void isRisky_onlyLatestContractConsulted() {
        var latest = contract(40L, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 5));
        var returned = line(9L, latest, unit(9L, "10.00", EquipmentStatus.AVAILABLE));
        returned.recordReturn(LocalDate.of(2024, 3, 5), 0, BigDecimal.ZERO);
        when(contractRepository.findFirstByClientIdOrderByIdDesc(CLIENT_ID)).thenReturn(Optional.of(latest));
        when(contractLineRepository.findByContractIdOrderByIdAsc(40L)).thenReturn(List.of(returned));

        assertThat(classifier.isRisky(CLIENT_ID)).isFalse();
        verify(contractLineRepository, never()).findByContractIdOrderByIdAsc(39L);
    }
}
