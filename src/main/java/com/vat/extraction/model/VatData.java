package com.vat.extraction.model;

import com.vat.extraction.entity.DocumentCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * VAT figures as submitted for a return, before they are trusted.
 */
@Value
@Builder
@Jacksonized
public class VatData {
    List<Double> salesVAT;
    List<Double> purchaseVAT;
    List<Double> vatRates;
    Double totalAmount;
    String vatNumber;
    DocumentCategory documentType;
    String fileName;
    LocalDate periodStart;
    LocalDate periodEnd;
}
