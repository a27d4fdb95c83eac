package com.locamat.rental.repository;

import com.locamat.rental.model.EquipmentModel;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EquipmentModelRepository extends JpaRepository<EquipmentModel, Long> {
}
