package com.locamat.rental.repository;

import com.locamat.rental.model.EquipmentUnit;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface EquipmentUnitRepository extends JpaRepository<EquipmentUnit, Long> {

    /**
     * Row-locks the given units (SELECT ... FOR UPDATE). Rows are locked in ascending id order so
     * two transactions with overlapping unit sets cannot wait on each other in a cycle.
     * Ids with no row are simply absent from the result.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM EquipmentUnit u WHERE u.id IN :ids ORDER BY u.id ASC")
    List<EquipmentUnit> findAllByIdInForUpdate(@Param("ids") Collection<Long> ids);
}
