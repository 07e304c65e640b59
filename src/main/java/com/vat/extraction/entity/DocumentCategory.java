package com.vat.extraction.entity;

import com.vat.extraction.model.TaxDirection;

import java.util.Optional;

/**
 * Category declared by the uploader. The prefix decides the VAT direction;
 * the suffix decides which sanity ceiling applies to extracted amounts.
 */
public enum DocumentCategory {
    SALES_INVOICE,
    SALES_RECEIPT,
    SALES_REPORT,
    PURCHASE_INVOICE,
    PURCHASE_RECEIPT,
    PURCHASE_REPORT,
    OTHER;

    public boolean isSales() {
        return name().startsWith("SALES");
    }

    public boolean isPurchase() {
        return name().startsWith("PURCHASE");
    }

    public boolean isReport() {
        return name().endsWith("_REPORT");
    }

    public boolean isReceipt() {
        return name().endsWith("_RECEIPT");
    }

    public boolean isInvoice() {
        return name().endsWith("_INVOICE");
    }

    /** Empty for {@link #OTHER}: the direction has to be inferred. */
    public Optional<TaxDirection> declaredDirection() {
        if (isSales()) return Optional.of(TaxDirection.SALES);
        if (isPurchase()) return Optional.of(TaxDirection.PURCHASE);
        return Optional.empty();
    }

    public static DocumentCategory fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
