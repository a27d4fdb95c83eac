package com.locamat.rental.model;

import com.locamat.rental.exception.ResourceConflictException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * One rented unit on a contract. The planned return date is fixed at creation; the return
 * fields are written once, by the restitution transaction, and never change afterwards.
 */
@Entity
@Table(name = "contract_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContractLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "contract_id", nullable = false, updatable = false)
    private RentalContract contract;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "equipment_unit_id", nullable = false, updatable = false)
    private EquipmentUnit equipmentUnit;

    @Column(name = "planned_return_date", nullable = false, updatable = false)
    private LocalDate plannedReturnDate;

    @Column(name = "actual_return_date")
    private LocalDate actualReturnDate;

    @Column(name = "late_days")
    private Integer lateDays;

    @Column(name = "penalty_amount")
    private BigDecimal penaltyAmount;

    ContractLine(RentalContract contract, EquipmentUnit equipmentUnit, LocalDate plannedReturnDate) {
        this.contract = contract;
        this.equipmentUnit = equipmentUnit;
        this.plannedReturnDate = plannedReturnDate;
    }

    public boolean isReturned() {
        return actualReturnDate != null;
    }

    public boolean isReturnedLate() {
        return actualReturnDate != null && actualReturnDate.isAfter(plannedReturnDate);
    }

    public void recordReturn(LocalDate returnDate, int lateDays, BigDecimal penaltyAmount) {
        if (isReturned()) {
            throw new ResourceConflictException("already returned", List.of(id));
        }
        if (lateDays < 0 || penaltyAmount.signum() < 0) {
            throw new IllegalArgumentException("late days and penalty must be non-negative");
        }
        this.actualReturnDate = returnDate;
        this.lateDays = lateDays;
        this.penaltyAmount = penaltyAmount;
    }
}
