package com.vat.extraction.repository;

import com.vat.extraction.entity.BusinessLearningPattern;
import com.vat.extraction.entity.DocumentCategory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface BusinessLearningPatternRepository extends JpaRepository<BusinessLearningPattern, Long> {

    Optional<BusinessLearningPattern> findByBusinessIdAndCategory(String businessId, DocumentCategory category);

    List<BusinessLearningPattern> findByBusinessIdAndCategoryAndConfidenceGreaterThanEqualOrderByConfidenceDesc(
            String businessId, DocumentCategory category, double minConfidence);

    List<BusinessLearningPattern> findByBusinessIdAndConfidenceGreaterThanEqualOrderByConfidenceDesc(
            String businessId, double minConfidence);
}
