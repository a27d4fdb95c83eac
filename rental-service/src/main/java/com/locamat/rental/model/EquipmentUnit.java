package com.locamat.rental.model;

import com.locamat.rental.exception.ResourceConflictException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Entity
@Table(name = "equipment_units")
@Getter
@Setter
public class EquipmentUnit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "serial", nullable = false, unique = true)
    private String serial;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "model_id", nullable = false)
    private EquipmentModel model;

    @Column(name = "daily_rate", nullable = false)
    private BigDecimal dailyRate;

    @Column(name = "purchase_date")
    private LocalDate purchaseDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Setter(AccessLevel.NONE)
    private EquipmentStatus status = EquipmentStatus.AVAILABLE;

    public boolean isAvailable() {
        return status == EquipmentStatus.AVAILABLE;
    }

    /** AVAILABLE -> RENTED. Any other source status is a conflict. */
    public void rentOut() {
        status = switch (status) {
            case AVAILABLE -> EquipmentStatus.RENTED;
            case RENTED, MAINTENANCE, SCRAPPED ->
                throw new ResourceConflictException("equipment unavailable", List.of(id));
        };
    }

    /**
     * Back in stock after a return. A unit moved to servicing or written off while it was out is
     * still released, otherwise its line could never be closed.
     *
     * @return the status the unit had before the return
     */
    public EquipmentStatus release() {
        EquipmentStatus previous = status;
        status = switch (previous) {
            case RENTED, AVAILABLE, MAINTENANCE, SCRAPPED -> EquipmentStatus.AVAILABLE;
        };
        return previous;
    }

    /**
     * Status changes driven from outside the rental engine (servicing, write-off, provisioning).
     * Rental transitions go through {@link #rentOut()} and {@link #release()}.
     */
    public void setStatusExternally(EquipmentStatus status) {
        this.status = status;
    }
}
