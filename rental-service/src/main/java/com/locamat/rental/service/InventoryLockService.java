package com.locamat.rental.service;

import com.locamat.rental.exception.ResourceConflictException;
import com.locamat.rental.model.ContractLine;
import com.locamat.rental.model.EquipmentUnit;
import com.locamat.rental.repository.ContractLineRepository;
import com.locamat.rental.repository.EquipmentUnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.SortedSet;

/**
 * Row-level locking reads for the rows the rental engine mutates. Must run inside the caller's
 * transaction: the locks are held until that transaction commits or rolls back.
 *
 * A lock wait that exceeds the store's lock_timeout, or a deadlock the store breaks by aborting
 * this transaction, is reported as a {@link ResourceConflictException#LOCK_TIMEOUT} conflict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(propagation = Propagation.MANDATORY)
public class InventoryLockService {

    private final EquipmentUnitRepository equipmentUnitRepository;
    private final ContractLineRepository contractLineRepository;

    public List<EquipmentUnit> lockUnits(SortedSet<Long> unitIds) {
        try {
            return equipmentUnitRepository.findAllByIdInForUpdate(unitIds);
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock acquisition failed on equipment units {}: {}", unitIds, e.getMessage());
            throw ResourceConflictException.lockTimeout(unitIds, e);
        }
    }

    public List<ContractLine> lockLines(SortedSet<Long> lineIds) {
        try {
            return contractLineRepository.findAllByIdInForUpdate(lineIds);
        } catch (PessimisticLockingFailureException e) {
            log.warn("Lock acquisition failed on contract lines {}: {}", lineIds, e.getMessage());
            throw ResourceConflictException.lockTimeout(lineIds, e);
        }
    }
}
