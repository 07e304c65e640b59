package com.vat.extraction.model;

public enum TaxDirection {
    SALES,      // VAT owed
    PURCHASE    // VAT reclaimable
}
