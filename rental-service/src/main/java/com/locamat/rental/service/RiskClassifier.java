package com.locamat.rental.service;

import com.locamat.rental.model.ContractLine;
import com.locamat.rental.repository.ContractLineRepository;
import com.locamat.rental.repository.RentalContractRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Flags a client as risky when any line of their most recent contract came back after its
 * planned return date. Older contracts are not consulted.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RiskClassifier {

    private final RentalContractRepository contractRepository;
    private final ContractLineRepository contractLineRepository;

    public boolean isRisky(Long clientId) {
        return contractRepository.findFirstByClientIdOrderByIdDesc(clientId)
            .map(latest -> contractLineRepository.findByContractIdOrderByIdAsc(latest.getId()).stream()
                .anyMatch(ContractLine::isReturnedLate))
            .orElse(false);
    }
}
