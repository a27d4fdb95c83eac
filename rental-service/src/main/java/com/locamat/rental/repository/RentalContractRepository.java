package com.locamat.rental.repository;

import com.locamat.rental.model.RentalContract;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RentalContractRepository extends JpaRepository<RentalContract, Long> {

    Optional<RentalContract> findFirstByClientIdOrderByIdDesc(Long clientId);

    @EntityGraph(attributePaths = {"client", "lines"})
    List<RentalContract> findAllByOrderByIdDesc();
}
