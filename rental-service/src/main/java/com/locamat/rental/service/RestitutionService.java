package com.locamat.rental.service;

import com.locamat.rental.exception.BusinessException;
import com.locamat.rental.exception.ResourceConflictException;
import com.locamat.rental.exception.ResourceNotFoundException;
import com.locamat.rental.model.ContractLine;
import com.locamat.rental.model.EquipmentStatus;
import com.locamat.rental.model.EquipmentUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Records the return of a batch of contract lines, charges late penalties and puts the
 * units back in stock. The batch is all-or-nothing.
 */
@Service
@Slf4j
public class RestitutionService {

    public static final BigDecimal DEFAULT_PENALTY_RATE_PER_DAY = new BigDecimal("5.00");

    private final InventoryLockService inventoryLockService;
    private final BigDecimal penaltyRatePerDay;

    public RestitutionService(InventoryLockService inventoryLockService,
                              @Value("${rental.penalty-rate-per-day:5.00}") BigDecimal penaltyRatePerDay) {
        if (penaltyRatePerDay == null || penaltyRatePerDay.signum() < 0) {
            throw new IllegalArgumentException("rental.penalty-rate-per-day must be a non-negative amount");
        }
        this.inventoryLockService = inventoryLockService;
        this.penaltyRatePerDay = penaltyRatePerDay;
    }

    /** Whole days past the planned date; 0 for on-time or early returns. */
    public static int lateDaysBetween(LocalDate plannedReturnDate, LocalDate actualReturnDate) {
        long late = ChronoUnit.DAYS.between(plannedReturnDate, actualReturnDate);
        return Math.toIntExact(Math.max(0, late));
    }

    public BigDecimal penaltyFor(int lateDays) {
        return penaltyRatePerDay.multiply(BigDecimal.valueOf(lateDays)).setScale(2, RoundingMode.HALF_UP);
    }

    @Transactional
    public List<ContractLine> restitute(Collection<Long> lineIds, LocalDate actualReturnDate) {
        if (lineIds == null || lineIds.isEmpty() || lineIds.stream().anyMatch(Objects::isNull)) {
            throw new BusinessException("no lines selected");
        }
        if (actualReturnDate == null) {
            throw new BusinessException("missing return date");
        }

        SortedSet<Long> requestedIds = new TreeSet<>(lineIds);
        List<ContractLine> lines = inventoryLockService.lockLines(requestedIds);

        if (lines.size() != requestedIds.size()) {
            SortedSet<Long> missingIds = new TreeSet<>(requestedIds);
            lines.forEach(line -> missingIds.remove(line.getId()));
            throw new ResourceNotFoundException("lines", missingIds);
        }

        List<Long> alreadyReturned = lines.stream()
            .filter(ContractLine::isReturned)
            .map(ContractLine::getId)
            .toList();
        if (!alreadyReturned.isEmpty()) {
            log.warn("Restitution refused: lines already returned {}", alreadyReturned);
            throw new ResourceConflictException("already returned", alreadyReturned);
        }

        SortedSet<Long> unitIds = new TreeSet<>();
        lines.forEach(line -> unitIds.add(line.getEquipmentUnit().getId()));
        List<EquipmentUnit> units = inventoryLockService.lockUnits(unitIds);

        BigDecimal totalPenalty = BigDecimal.ZERO;
        for (ContractLine line : lines) {
            int lateDays = lateDaysBetween(line.getPlannedReturnDate(), actualReturnDate);
            BigDecimal penalty = penaltyFor(lateDays);
            line.recordReturn(actualReturnDate, lateDays, penalty);
            totalPenalty = totalPenalty.add(penalty);
        }

        for (EquipmentUnit unit : units) {
            EquipmentStatus previous = unit.release();
            if (previous != EquipmentStatus.RENTED) {
                log.warn("Unit {} was {} when returned, released to AVAILABLE", unit.getId(), previous);
            }
        }

        log.info("Lines returned: lineIds={} units={} returnDate={} totalPenalty={}",
            requestedIds, unitIds, actualReturnDate, totalPenalty);
        return lines;
    }
}
