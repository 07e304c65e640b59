package com.vat.extraction.service.strategy;

import java.util.List;

/**
 * One named way of finding VAT amounts in document text. Strategies are
 * run in a fixed order by the extraction engine; the first strategy to
 * report a value owns it.
 */
public interface AmountExtractionStrategy {

    /** Recorded as the extraction method of the result. */
    String name();

    /** Candidate amounts in document order, rounded to cents. Never null. */
    List<Double> extract(String text);

    /**
     * Candidates as consumed by the engine. Layout-aware strategies override
     * this to tag amounts as sales or purchase.
     */
    default List<AmountMatch> match(String text) {
        return extract(text).stream().map(AmountMatch::undirected).toList();
    }

    /** Only consulted when no earlier strategy found anything. */
    default boolean fallbackOnly() {
        return false;
    }

    /**
     * Whether a match means the whole document has a known layout. Once such
     * a strategy reports an amount the remaining strategies are skipped, so
     * totals printed around the form are not read as extra VAT.
     */
    default boolean claimsDocument() {
        return false;
    }
}
