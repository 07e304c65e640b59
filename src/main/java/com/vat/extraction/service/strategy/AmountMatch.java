package com.vat.extraction.service.strategy;

import com.vat.extraction.model.TaxDirection;

/**
 * One candidate amount. The direction is set only when the document layout
 * fixes it (a VAT3 box, a sales report column); otherwise the engine uses
 * the document's direction.
 */
public record AmountMatch(double amount, TaxDirection direction) {

    public static AmountMatch undirected(double amount) {
        return new AmountMatch(amount, null);
    }
}
