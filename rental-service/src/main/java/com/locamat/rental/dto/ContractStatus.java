package com.locamat.rental.dto;

public enum ContractStatus {
    /** At least one unit still out, none past its planned return date. */
    ACTIVE,
    /** At least one unit still out after its planned return date. */
    OVERDUE,
    /** Every line returned. */
    COMPLETED
}
