package com.locamat.rental.service;

import com.locamat.rental.exception.ResourceConflictException;
import com.locamat.rental.model.EquipmentStatus;
import com.locamat.rental.repository.ContractLineRepository;
import com.locamat.rental.repository.EquipmentUnitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;

import java.time.LocalDate;
import java.util.List;
import java.util.TreeSet;

import static com.locamat.rental.service.RentalTestData.contract;
import static com.locamat.rental.service.RentalTestData.line;
import static com.locamat.rental.service.RentalTestData.unit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InventoryLockServiceTest {

    @Mock private EquipmentUnitRepository equipmentUnitRepository;
    @Mock private ContractLineRepository contractLineRepository;

    private InventoryLockService service;

    @BeforeEach
    void setUp() {
        service = new InventoryLockService(equipmentUnitRepository, contractLineRepository);
    }

    @Test
    void lockUnits_returnsLockedRows() {
        var first = unit(1L, "10.00", EquipmentStatus.AVAILABLE);
        when(equipmentUnitRepository.findAllByIdInForUpdate(any())).thenReturn(List.of(first));

        assertThat(service.lockUnits(new TreeSet<>(List.of(1L)))).containsExactly(first);
    }

    @Test
    void lockUnits_lockWaitExpired_lockTimeoutConflictWithRequestedIds() {
        when(equipmentUnitRepository.findAllByIdInForUpdate(any()))
            .thenThrow(new PessimisticLockingFailureException("canceling statement due to lock timeout"));

        assertThatThrownBy(() -> service.lockUnits(new TreeSet<>(List.of(3L, 1L))))
            .isInstanceOfSatisfying(ResourceConflictException.class, ex -> {
                assertThat(ex.isLockTimeout()).isTrue();
                assertThat(ex.getConflictingIds()).containsExactly(1L, 3L);
                assertThat(ex.getCause()).isInstanceOf(PessimisticLockingFailureException.class);
            });
    }

    @Test
    void lockLines_deadlockDetected_lockTimeoutConflict() {
        when(contractLineRepository.findAllByIdInForUpdate(any()))
            .thenThrow(new PessimisticLockingFailureException("deadlock detected"));

        assertThatThrownBy(() -> service.lockLines(new TreeSet<>(List.of(7L))))
            .isInstanceOfSatisfying(ResourceConflictException.class, ex -> {
                assertThat(ex.isLockTimeout()).isTrue();
                assertThat(ex.getConflictingIds()).containsExactly(7L);
            });
    }

    @Test
    void lockLines_returnsLockedRows() {
        var contract = contract(1L, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3));
        var open = line(2L, contract, unit(3L, "10.00", EquipmentStatus.RENTED));
        when(contractLineRepository.findAllByIdInForUpdate(any())).thenReturn(List.of(open));

        assertThat(service.lockLines(new TreeSet<>(List.of(2L)))).containsExactly(open);
    }
}
