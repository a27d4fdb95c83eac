package com.locamat.rental.model;

public enum EquipmentStatus {
    AVAILABLE,
    RENTED,
    MAINTENANCE,
    SCRAPPED
}
