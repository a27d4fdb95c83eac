package com.locamat.rental.dto;

import com.locamat.rental.model.EquipmentUnit;
import com.locamat.rental.model.RentalContract;

import java.util.List;

public record ReservationResult(
    RentalContract contract,
    List<EquipmentUnit> units,
    PriceBreakdown price
) {}
