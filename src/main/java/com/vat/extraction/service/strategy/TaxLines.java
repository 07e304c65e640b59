package com.vat.extraction.service.strategy;

import java.util.regex.Pattern;

/**
 * Which lines of a document can hold a VAT amount: those that name the tax
 * and are not a total stated inclusive or exclusive of it.
 */
final class TaxLines {

    private static final Pattern TAX_LABEL = Pattern.compile(
            "\\b(?:vat|tax|cáin bhreisluacha)\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    // "Total incl. VAT", "excluding VAT", "ex VAT", "before tax"
    private static final Pattern TAX_QUALIFIED_TOTAL = Pattern.compile(
            "\\b(?:incl(?:uding|usive|\\.)?|excl(?:uding|usive|\\.)?|ex|plus|before|after|net\\s+of)\\s*(?:of\\s+)?(?:vat|tax)\\b",
            Pattern.CASE_INSENSITIVE);

    private TaxLines() {
    }

    static String[] lines(String text) {
        return text.split("\\R");
    }

    static boolean holdsTaxAmount(String line) {
        return TAX_LABEL.matcher(line).find() && !TAX_QUALIFIED_TOTAL.matcher(line).find();
    }
}
