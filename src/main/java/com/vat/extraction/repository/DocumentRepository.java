package com.vat.extraction.repository;

import com.vat.extraction.entity.VatDocument;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DocumentRepository extends JpaRepository<VatDocument, Long> {

    List<VatDocument> findByBusinessIdOrderByCreatedAtDesc(String businessId);

    List<VatDocument> findByBusinessIdAndStatus(String businessId, VatDocument.Status status);
}
