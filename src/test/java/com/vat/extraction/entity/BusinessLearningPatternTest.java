package com.vat.extraction.entity;

import com.vat.extraction.model.CorrectionRecord;
import com.vat.extraction.model.FeedbackKind;
import com.vat.extraction.model.TaxDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BusinessLearningPatternTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private static CorrectionRecord incorrect(long documentId, DocumentCategory type) {
        return CorrectionRecord.builder()
                .documentId(documentId)
                .documentType(type)
                .originalAmount(90.0)
                .correctedAmount(100.0)
                .feedback(FeedbackKind.INCORRECT)
                .recordedAt(T0.plusSeconds(documentId))
                .build();
    }

    @Test
    @DisplayName("seeding starts at frequency one with the seed confidence")
    void seed() {
        BusinessLearningPattern pattern = BusinessLearningPattern.seed("b-1", DocumentCategory.PURCHASE_INVOICE,
                incorrect(1, DocumentCategory.PURCHASE_INVOICE), 0.5, 5, T0);

        assertThat(pattern.getFrequency()).isEqualTo(1);
        assertThat(pattern.getConfidence()).isEqualTo(0.5);
        assertThat(pattern.getTaxDirection()).isEqualTo(TaxDirection.PURCHASE);
        assertThat(pattern.getPatternType()).isEqualTo(BusinessLearningPattern.VAT_CORRECTION);
        assertThat(pattern.getRecentCorrections().size()).isEqualTo(1);
        assertThat(pattern.getDocumentTypes()).containsExactly("PURCHASE_INVOICE");
    }

    @Test
    @DisplayName("repeated corrections raise frequency strictly and confidence up to the cap")
    void monotonic() {
        BusinessLearningPattern pattern = BusinessLearningPattern.seed("b-1", DocumentCategory.SALES_INVOICE,
                incorrect(1, DocumentCategory.SALES_INVOICE), 0.5, 5, T0);

        int previousFrequency = pattern.getFrequency();
        double previousConfidence = pattern.getConfidence();
        for (long i = 2; i <= 10; i++) {
            pattern.absorb(incorrect(i, DocumentCategory.SALES_INVOICE), 0.1, T0.plusSeconds(i));

            assertThat(pattern.getFrequency()).isGreaterThan(previousFrequency);
            assertThat(pattern.getConfidence()).isGreaterThanOrEqualTo(previousConfidence).isLessThanOrEqualTo(1.0);
            previousFrequency = pattern.getFrequency();
            previousConfidence = pattern.getConfidence();
        }

        assertThat(pattern.getFrequency()).isEqualTo(10);
        assertThat(pattern.getConfidence()).isCloseTo(1.0, within(1e-9));
        assertThat(pattern.getLastSeen()).isEqualTo(T0.plusSeconds(10));
    }

    @Test
    @DisplayName("six corrections leave the five most recent in the window")
    void windowBound() {
        BusinessLearningPattern pattern = BusinessLearningPattern.seed("b-1", DocumentCategory.SALES_INVOICE,
                incorrect(1, DocumentCategory.SALES_INVOICE), 0.5, 5, T0);
        for (long i = 2; i <= 6; i++) {
            pattern.absorb(incorrect(i, DocumentCategory.SALES_INVOICE), 0.1, T0);
        }

        assertThat(pattern.getRecentCorrections().getCorrections())
                .extracting(CorrectionRecord::getDocumentId)
                .containsExactly(2L, 3L, 4L, 5L, 6L);
    }

    @Test
    @DisplayName("absorbing replaces the window instead of mutating it")
    void copyOnWrite() {
        BusinessLearningPattern pattern = BusinessLearningPattern.seed("b-1", DocumentCategory.OTHER,
                incorrect(1, DocumentCategory.OTHER), 0.5, 5, T0);
        var before = pattern.getRecentCorrections();

        pattern.absorb(incorrect(2, DocumentCategory.SALES_RECEIPT), 0.1, T0);

        assertThat(pattern.getRecentCorrections()).isNotSameAs(before);
        assertThat(before.size()).isEqualTo(1);
        assertThat(pattern.getDocumentTypes()).containsExactly("OTHER", "SALES_RECEIPT");
    }
}
