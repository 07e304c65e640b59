package com.vat.extraction.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The amounts a user saw (original) or entered (corrected) when giving feedback.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionSnapshot {

    @Builder.Default
    private List<Double> salesVAT = new ArrayList<>();

    @Builder.Default
    private List<Double> purchaseVAT = new ArrayList<>();

    private Double confidence;

    public static ExtractionSnapshot of(ExtractionResult result) {
        return ExtractionSnapshot.builder()
                .salesVAT(new ArrayList<>(result.getSalesAmounts()))
                .purchaseVAT(new ArrayList<>(result.getPurchaseAmounts()))
                .confidence(result.getConfidence())
                .build();
    }

    @JsonIgnore
    public List<Double> getAllAmounts() {
        List<Double> all = new ArrayList<>();
        if (salesVAT != null) all.addAll(salesVAT);
        if (purchaseVAT != null) all.addAll(purchaseVAT);
        return all;
    }

    @JsonIgnore
    public double getTotal() {
        return Money.sum(getAllAmounts());
    }
}
