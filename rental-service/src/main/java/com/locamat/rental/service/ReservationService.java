package com.locamat.rental.service;

import com.locamat.rental.dto.PriceBreakdown;
import com.locamat.rental.dto.ReservationResult;
import com.locamat.rental.exception.BusinessException;
import com.locamat.rental.exception.ResourceConflictException;
import com.locamat.rental.exception.ResourceNotFoundException;
import com.locamat.rental.model.Client;
import com.locamat.rental.model.ContractLine;
import com.locamat.rental.model.EquipmentUnit;
import com.locamat.rental.model.RentalContract;
import com.locamat.rental.repository.ClientRepository;
import com.locamat.rental.repository.ContractLineRepository;
import com.locamat.rental.repository.RentalContractRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Rents a set of equipment units to a client in one all-or-nothing transaction.
 *
 * The requested unit rows stay locked from the availability check until commit, so two
 * overlapping reservations serialize on the first shared unit and the later one sees it RENTED.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReservationService {

    private final ClientRepository clientRepository;
    private final RentalContractRepository contractRepository;
    private final ContractLineRepository contractLineRepository;
    private final InventoryLockService inventoryLockService;
    private final RiskClassifier riskClassifier;
    private final PricingEngine pricingEngine;

    /** Inclusive day count: a rental that starts and ends on the same day lasts one day. */
    public static long durationInDays(LocalDate startDate, LocalDate endDate) {
        return ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    @Transactional
    public ReservationResult reserve(Long clientId, Collection<Long> unitIds, LocalDate startDate, LocalDate endDate) {
        if (unitIds == null || unitIds.isEmpty()) {
            throw new BusinessException("no units selected");
        }
        if (unitIds.stream().anyMatch(Objects::isNull)) {
            throw new BusinessException("invalid unit selection");
        }
        if (clientId == null) {
            throw new BusinessException("no client selected");
        }
        if (startDate == null || endDate == null || endDate.isBefore(startDate)) {
            throw new BusinessException("invalid date range");
        }
        long duration = durationInDays(startDate, endDate);
        if (duration < 1) {
            throw new BusinessException("invalid date range");
        }

        Client client = clientRepository.findById(clientId)
            .orElseThrow(() -> new ResourceNotFoundException("client", clientId));

        SortedSet<Long> requestedIds = new TreeSet<>(unitIds);
        List<EquipmentUnit> units = inventoryLockService.lockUnits(requestedIds);

        SortedSet<Long> missingIds = new TreeSet<>(requestedIds);
        units.forEach(unit -> missingIds.remove(unit.getId()));
        if (!missingIds.isEmpty()) {
            throw new ResourceNotFoundException("equipment", missingIds);
        }

        List<Long> unavailableIds = units.stream()
            .filter(unit -> !unit.isAvailable())
            .map(EquipmentUnit::getId)
            .toList();
        if (!unavailableIds.isEmpty()) {
            log.warn("Reservation refused: clientId={} unavailable units={}", clientId, unavailableIds);
            throw new ResourceConflictException("equipment unavailable", unavailableIds);
        }

        BigDecimal baseTotal = BigDecimal.ZERO;
        for (EquipmentUnit unit : units) {
            baseTotal = baseTotal.add(unit.getDailyRate().multiply(BigDecimal.valueOf(duration)));
        }

        boolean risky = riskClassifier.isRisky(clientId);
        PriceBreakdown price = pricingEngine.price(baseTotal, duration, client.isVipClient(), risky);

        RentalContract contract = new RentalContract();
        contract.setClient(client);
        contract.setStartDate(startDate);
        contract.setEndDate(endDate);
        contract = contractRepository.saveAndFlush(contract);

        List<ContractLine> lines = new ArrayList<>();
        for (EquipmentUnit unit : units) {
            lines.add(contract.addLine(unit));
        }
        contractLineRepository.saveAll(lines);

        units.forEach(EquipmentUnit::rentOut);

        log.info("Contract created: contractId={} clientId={} units={} days={} total={}",
            contract.getId(), clientId, requestedIds, duration, price.total());
        return new ReservationResult(contract, units, price);
    }
}
