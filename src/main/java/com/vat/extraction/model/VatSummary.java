package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VatSummary {
    String businessId;
    double totalSalesVat;
    double totalPurchaseVat;
    double netVat;          // sales minus purchase; negative means a refund position
    int documentCount;
    int processedCount;
    double confidence;
}
