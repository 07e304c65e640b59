package com.vat.extraction.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Cent-level rounding helpers for amounts carried as doubles.
 */
public final class Money {

    /** Beyond this no amount is believable and the cent key would overflow. */
    public static final double MAX_AMOUNT = 1e13;

    private Money() {
    }

    public static double round(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            return amount;
        }
        return BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public static double sum(Collection<Double> amounts) {
        if (amounts == null || amounts.isEmpty()) {
            return 0.0;
        }
        BigDecimal total = BigDecimal.ZERO;
        for (Double amount : amounts) {
            if (amount != null) {
                total = total.add(BigDecimal.valueOf(amount));
            }
        }
        return total.setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /** Key used to deduplicate amounts by value. */
    public static long toCents(double amount) {
        return BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
    }

    /** Parses "1,234.56" style tokens. Returns null when the token is not a number. */
    public static Double parse(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return round(Double.parseDouble(cleaned));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
