package com.vat.extraction.model;

import com.vat.extraction.entity.VatDocument;
import lombok.Builder;
import lombok.Value;

/**
 * Returned for every accepted upload, whether or not extraction succeeded.
 */
@Value
@Builder
public class UploadReceipt {
    Long documentId;
    String fileName;
    VatDocument.Status status;
    ExtractionResult extraction;
    String message;
}
