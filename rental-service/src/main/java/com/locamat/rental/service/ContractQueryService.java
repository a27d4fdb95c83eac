package com.locamat.rental.service;

import com.locamat.rental.dto.ContractStatus;
import com.locamat.rental.dto.ContractSummary;
import com.locamat.rental.model.ContractLine;
import com.locamat.rental.model.RentalContract;
import com.locamat.rental.repository.ContractLineRepository;
import com.locamat.rental.repository.RentalContractRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Lock-free views over contracts for the screens that sit around the rental engine.
 * Results may be stale by the time the caller acts on them.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ContractQueryService {

    private final RentalContractRepository contractRepository;
    private final ContractLineRepository contractLineRepository;
    private final Clock clock;

    public List<ContractLine> findPendingReturns() {
        return contractLineRepository.findPendingReturns();
    }

    public List<ContractSummary> summarizeContracts() {
        LocalDate today = LocalDate.now(clock);
        return contractRepository.findAllByOrderByIdDesc().stream()
            .map(contract -> summarize(contract, today))
            .toList();
    }

    public ContractStatus statusOf(List<ContractLine> lines, LocalDate today) {
        List<ContractLine> open = lines.stream().filter(line -> !line.isReturned()).toList();
        if (open.isEmpty()) {
            return ContractStatus.COMPLETED;
        }
        boolean overdue = open.stream().anyMatch(line -> line.getPlannedReturnDate().isBefore(today));
        return overdue ? ContractStatus.OVERDUE : ContractStatus.ACTIVE;
    }

    private ContractSummary summarize(RentalContract contract, LocalDate today) {
        List<ContractLine> lines = contract.getLines();
        int openLines = (int) lines.stream().filter(line -> !line.isReturned()).count();
        BigDecimal totalPenalties = lines.stream()
            .map(ContractLine::getPenaltyAmount)
            .filter(penalty -> penalty != null)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new ContractSummary(contract, statusOf(lines, today), openLines, totalPenalties);
    }
}
