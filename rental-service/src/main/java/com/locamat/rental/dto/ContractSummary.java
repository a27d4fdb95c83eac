package com.locamat.rental.dto;

import com.locamat.rental.model.RentalContract;

import java.math.BigDecimal;

public record ContractSummary(
    RentalContract contract,
    ContractStatus status,
    int openLines,
    BigDecimal totalPenalties
) {}
