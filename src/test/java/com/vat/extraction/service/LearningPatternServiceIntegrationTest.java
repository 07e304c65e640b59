package com.vat.extraction.service;

import com.vat.extraction.entity.BusinessLearningPattern;
import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.model.CorrectionRecord;
import com.vat.extraction.model.FeedbackKind;
import com.vat.extraction.repository.BusinessLearningPatternRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
class LearningPatternServiceIntegrationTest {

    @Autowired
    private LearningPatternService patternService;

    @Autowired
    private BusinessLearningPatternRepository patternRepo;

    private static CorrectionRecord correction(long documentId, double original, double corrected) {
        return CorrectionRecord.builder()
                .documentId(documentId)
                .documentName("invoice-" + documentId + ".pdf")
                .documentType(DocumentCategory.SALES_INVOICE)
                .originalAmount(original)
                .correctedAmount(corrected)
                .feedback(FeedbackKind.INCORRECT)
                .recordedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("first fold seeds the pattern, later folds absorb into it")
    void seedThenAbsorb() {
        BusinessLearningPattern seeded = patternService.fold("fold-biz", DocumentCategory.SALES_INVOICE,
                correction(1L, 90.0, 100.0));
        assertThat(seeded.getFrequency()).isEqualTo(1);
        assertThat(seeded.getConfidence()).isEqualTo(0.5);

        BusinessLearningPattern absorbed = patternService.fold("fold-biz", DocumentCategory.SALES_INVOICE,
                correction(2L, 45.0, 50.0));
        assertThat(absorbed.getId()).isEqualTo(seeded.getId());
        assertThat(absorbed.getFrequency()).isEqualTo(2);
        assertThat(absorbed.getConfidence()).isCloseTo(0.6, within(1e-9));

        BusinessLearningPattern stored = patternRepo.findByBusinessIdAndCategory("fold-biz", DocumentCategory.SALES_INVOICE)
                .orElseThrow();
        assertThat(stored.getRecentCorrections().getCorrections())
                .extracting(CorrectionRecord::getDocumentId)
                .containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("usable patterns are cached until the next fold for the same key")
    void cacheEvictedByFold() {
        patternService.fold("cache-biz", DocumentCategory.SALES_INVOICE, correction(1L, 90.0, 100.0));

        List<BusinessLearningPattern> first = patternService.findUsablePatterns("cache-biz", DocumentCategory.SALES_INVOICE);
        List<BusinessLearningPattern> second = patternService.findUsablePatterns("cache-biz", DocumentCategory.SALES_INVOICE);
        assertThat(second).isSameAs(first);
        assertThat(first).singleElement().extracting(BusinessLearningPattern::getFrequency).isEqualTo(1);

        patternService.fold("cache-biz", DocumentCategory.SALES_INVOICE, correction(2L, 45.0, 50.0));

        List<BusinessLearningPattern> refreshed = patternService.findUsablePatterns("cache-biz", DocumentCategory.SALES_INVOICE);
        assertThat(refreshed).isNotSameAs(first);
        assertThat(refreshed).singleElement().extracting(BusinessLearningPattern::getFrequency).isEqualTo(2);
    }

    @Test
    @DisplayName("patterns below the confidence floor are not surfaced")
    void floorApplies() {
        assertThat(patternService.findUsablePatterns("nobody", DocumentCategory.PURCHASE_INVOICE)).isEmpty();
    }

    @Test
    @DisplayName("concurrent folds on one key lose no update")
    void concurrentFolds() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BusinessLearningPattern>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                long documentId = i + 1;
                futures.add(pool.submit(() -> {
                    start.await();
                    return patternService.fold("race-biz", DocumentCategory.SALES_INVOICE,
                            correction(documentId, 10.0, 12.0));
                }));
            }
            start.countDown();
            for (Future<BusinessLearningPattern> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        BusinessLearningPattern stored = patternRepo.findByBusinessIdAndCategory("race-biz", DocumentCategory.SALES_INVOICE)
                .orElseThrow();
        assertThat(stored.getFrequency()).isEqualTo(threads);
        assertThat(stored.getConfidence()).isEqualTo(1.0);
        assertThat(stored.getRecentCorrections().getCorrections()).hasSize(5);
    }
}
