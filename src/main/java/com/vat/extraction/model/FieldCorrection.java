package com.vat.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single field the user changed, e.g. {@code salesVAT[0]: 92.00 -> 94.30}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldCorrection {
    private String field;
    private String originalValue;
    private String correctedValue;
    private String reason;
}
