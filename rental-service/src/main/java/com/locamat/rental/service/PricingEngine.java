package com.locamat.rental.service;

import com.locamat.rental.dto.PriceBreakdown;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prices a reservation from its base total. Adjustments compound multiplicatively in a fixed
 * order: duration discount, then VIP discount, then risk surcharge. Only the final total is rounded.
 */
@Service
public class PricingEngine {

    public static final int LONG_RENTAL_THRESHOLD_DAYS = 7;
    public static final BigDecimal LONG_RENTAL_DISCOUNT = new BigDecimal("0.10");
    public static final BigDecimal VIP_DISCOUNT = new BigDecimal("0.15");
    public static final BigDecimal RISK_SURCHARGE = new BigDecimal("0.05");

    private static final BigDecimal NO_ADJUSTMENT = new BigDecimal("0.00");

    public PriceBreakdown price(BigDecimal baseTotal, long durationDays, boolean clientVip, boolean clientRisk) {
        if (baseTotal == null || baseTotal.signum() < 0) {
            throw new IllegalArgumentException("baseTotal must be a non-negative amount");
        }
        if (durationDays < 1) {
            throw new IllegalArgumentException("durationDays must be at least 1");
        }

        BigDecimal durationDiscount = durationDays > LONG_RENTAL_THRESHOLD_DAYS ? LONG_RENTAL_DISCOUNT : NO_ADJUSTMENT;
        BigDecimal vipDiscount = clientVip ? VIP_DISCOUNT : NO_ADJUSTMENT;
        BigDecimal riskSurcharge = clientRisk ? RISK_SURCHARGE : NO_ADJUSTMENT;

        BigDecimal total = baseTotal
            .multiply(BigDecimal.ONE.subtract(durationDiscount))
            .multiply(BigDecimal.ONE.subtract(vipDiscount))
            .multiply(BigDecimal.ONE.add(riskSurcharge))
            .setScale(2, RoundingMode.HALF_UP);

        return new PriceBreakdown(baseTotal, durationDiscount, vipDiscount, riskSurcharge, total);
    }
}
