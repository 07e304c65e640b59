package com.vat.extraction.service.strategy;

import com.vat.extraction.model.Money;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Amounts sitting next to a tax keyword on the same line, in either order:
 * {@code VAT @ 23%: 46.00} or {@code 46.00 VAT}. A decimal point is required
 * so invoice numbers and rates are not mistaken for amounts. Totals stated
 * inclusive or exclusive of VAT are skipped.
 */
@Component
@Order(5)
public class LabelAdjacentAmountStrategy implements AmountExtractionStrategy {

    public static final String NAME = "label_adjacent";

    private static final String KEYWORD = "(?:vat|tax|cáin bhreisluacha)";
    private static final String NUMBER = "(\\d{1,3}(?:,\\d{3})+\\.\\d{1,2}|\\d+\\.\\d{1,2})";

    // keyword, optional rate, then at most 20 non-digit characters before the amount
    private static final Pattern AFTER_LABEL = Pattern.compile(
            "\\b" + KEYWORD + "\\b(?:\\s*@?\\s*\\(?\\d+(?:\\.\\d+)?\\s*%\\)?)?[^0-9\\n]{0,20}?(?<![\\d.,])"
                    + NUMBER + "(?!\\s*%)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern BEFORE_LABEL = Pattern.compile(
            "(?<![\\d.,])" + NUMBER + "(?![\\d%])[^0-9\\n%]{0,15}?\\b" + KEYWORD + "\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Double> extract(String text) {
        List<Double> amounts = new ArrayList<>();
        if (text == null || text.isEmpty()) return amounts;

        // Both patterns stay within a line, so lines can be screened one at a time
        for (String line : TaxLines.lines(text)) {
            if (!TaxLines.holdsTaxAmount(line)) continue;
            collect(AFTER_LABEL.matcher(line), amounts);
            collect(BEFORE_LABEL.matcher(line), amounts);
        }
        return amounts;
    }

    private static void collect(Matcher m, List<Double> into) {
        while (m.find()) {
            Double value = Money.parse(m.group(1));
            if (value != null) {
                into.add(value);
            }
        }
    }
}
