package com.locamat.rental.repository;

import com.locamat.rental.model.ContractLine;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ContractLineRepository extends JpaRepository<ContractLine, Long> {

    /** Row-locks the given lines in ascending id order. Missing ids are absent from the result. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM ContractLine l WHERE l.id IN :ids ORDER BY l.id ASC")
    List<ContractLine> findAllByIdInForUpdate(@Param("ids") Collection<Long> ids);

    List<ContractLine> findByContractIdOrderByIdAsc(Long contractId);

    @Query("""
        SELECT l FROM ContractLine l
        JOIN FETCH l.equipmentUnit
        JOIN FETCH l.contract c
        JOIN FETCH c.client
        WHERE l.actualReturnDate IS NULL
        ORDER BY l.id ASC
        """)
    List<ContractLine> findPendingReturns();
}
