package com.locamat.rental.dto;

import java.math.BigDecimal;

/**
 * Priced reservation, exposing every applied rate so the caller can show how the total was reached.
 * Rates are fractions (0.10 means 10%). Never persisted.
 */
public record PriceBreakdown(
    BigDecimal baseTotal,
    BigDecimal durationDiscount,
    BigDecimal vipDiscount,
    BigDecimal riskSurcharge,
    BigDecimal total
) {}
