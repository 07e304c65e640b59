package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Known-correct totals for a document, used as the validation baseline.
 */
@Value
@Builder
@Jacksonized
public class ExpectedTotals {
    String name;
    Double salesTotal;
    Double purchaseTotal;
    @Builder.Default
    ReportType reportType = ReportType.STANDARD;

    public double getTotal() {
        return Money.round(nullToZero(salesTotal) + nullToZero(purchaseTotal));
    }

    private static double nullToZero(Double value) {
        return value != null ? value : 0.0;
    }
}
