package com.vat.extraction.service;

import com.vat.extraction.config.LearningProperties;
import com.vat.extraction.entity.BusinessLearningPattern;
import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.model.CorrectionRecord;
import com.vat.extraction.repository.BusinessLearningPatternRepository;
import com.vat.extraction.resilience.DatabaseOperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the learned-pattern store. Folds for the same (business, category)
 * run one at a time inside this process, each as a single read-modify-write
 * transaction; the entity's version column rejects a fold that raced with
 * another instance, and the database executor retries it on fresh state.
 * Keys share a fixed set of striped locks.
 */
@Service
@Slf4j
public class LearningPatternService {

    public static final String CACHE = "learningPatterns";

    static final int LOCK_STRIPES = 64;

    private final BusinessLearningPatternRepository patternRepo;
    private final DatabaseOperationExecutor db;
    private final TransactionTemplate transactionTemplate;
    private final LearningProperties properties;
    private final Clock clock;

    private final ReentrantLock[] foldLocks = new ReentrantLock[LOCK_STRIPES];

    public LearningPatternService(BusinessLearningPatternRepository patternRepo,
                                  DatabaseOperationExecutor db,
                                  TransactionTemplate transactionTemplate,
                                  LearningProperties properties,
                                  Clock clock) {
        this.patternRepo = patternRepo;
        this.db = db;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
        for (int i = 0; i < foldLocks.length; i++) {
            foldLocks[i] = new ReentrantLock();
        }
    }

    @CacheEvict(value = CACHE, key = "#businessId + ':' + #category.name()")
    public BusinessLearningPattern fold(String businessId, DocumentCategory category, CorrectionRecord record) {
        return underFoldLock(businessId, category,
                () -> db.execute("fold-learning-pattern",
                        () -> transactionTemplate.execute(status -> applyFold(businessId, category, record))));
    }

    /**
     * Folds within the caller's transaction, so the fold commits or rolls
     * back together with whatever else the caller writes. Callers hold the
     * fold lock for the key, see {@link #underFoldLock}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    @CacheEvict(value = CACHE, key = "#businessId + ':' + #category.name()")
    public BusinessLearningPattern foldInCurrentTransaction(String businessId, DocumentCategory category,
                                                            CorrectionRecord record) {
        return applyFold(businessId, category, record);
    }

    /** Runs {@code work} while no other fold for the same key runs in this process. */
    public <T> T underFoldLock(String businessId, DocumentCategory category, Supplier<T> work) {
        ReentrantLock lock = lockFor(new PatternKey(businessId, category));
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    // Only changes when feedback is folded in
    @Cacheable(value = CACHE, key = "#businessId + ':' + #category.name()")
    public List<BusinessLearningPattern> findUsablePatterns(String businessId, DocumentCategory category) {
        List<BusinessLearningPattern> patterns = db.execute("find-learning-patterns",
                () -> patternRepo.findByBusinessIdAndCategoryAndConfidenceGreaterThanEqualOrderByConfidenceDesc(
                        businessId, category, properties.getUsabilityFloor()));
        log.debug("Loaded {} usable pattern(s) for business {} / {}", patterns.size(), businessId, category);
        return patterns;
    }

    ReentrantLock lockFor(PatternKey key) {
        return foldLocks[Math.floorMod(key.hashCode(), foldLocks.length)];
    }

    private BusinessLearningPattern applyFold(String businessId, DocumentCategory category,
                                              CorrectionRecord record) {
        Instant now = clock.instant();
        BusinessLearningPattern pattern = patternRepo.findByBusinessIdAndCategory(businessId, category)
                .map(existing -> {
                    existing.absorb(record, properties.getConfidenceStep(), now);
                    return existing;
                })
                .orElseGet(() -> BusinessLearningPattern.seed(businessId, category, record,
                        properties.getSeedConfidence(), properties.getWindowSize(), now));

        BusinessLearningPattern saved = patternRepo.saveAndFlush(pattern);
        log.info("Learning pattern for business {} / {} now at frequency {}, confidence {}",
                businessId, category, saved.getFrequency(), String.format(Locale.ROOT, "%.2f", saved.getConfidence()));
        return saved;
    }

    record PatternKey(String businessId, DocumentCategory category) {}
}
