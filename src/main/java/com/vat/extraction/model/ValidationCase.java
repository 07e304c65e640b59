package com.vat.extraction.model;

import com.vat.extraction.entity.DocumentCategory;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A labeled document: text to extract plus the totals it should produce.
 */
@Value
@Builder
@Jacksonized
public class ValidationCase {
    String name;
    String text;
    DocumentCategory category;
    ExpectedTotals expected;
}
