package com.vat.extraction.service.strategy;

import com.vat.extraction.model.Money;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last resort: a VAT-inclusive total and a rate, with no VAT line printed.
 * The VAT share of the total is {@code total * rate / (100 + rate)}.
 */
@Component
@Order(6)
public class RateDerivedAmountStrategy implements AmountExtractionStrategy {

    public static final String NAME = "rate_derived";

    private static final Pattern TOTAL = Pattern.compile(
            "\\b(?:grand\\s+total|amount\\s+due|total)\\b[^0-9\\n]{0,20}?(\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern RATE = Pattern.compile("(\\d{1,2}(?:\\.\\d{1,2})?)\\s*%");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean fallbackOnly() {
        return true;
    }

    @Override
    public List<Double> extract(String text) {
        List<Double> amounts = new ArrayList<>();
        if (text == null || text.isEmpty()) return amounts;

        Double total = lastMatch(TOTAL.matcher(text));
        Double rate = firstRate(text);
        if (total == null || rate == null || total <= 0 || rate <= 0) {
            return amounts;
        }

        amounts.add(Money.round(total * rate / (100 + rate)));
        return amounts;
    }

    // Totals usually close the document; the last one is the grand total
    private static Double lastMatch(Matcher m) {
        Double last = null;
        while (m.find()) {
            Double value = Money.parse(m.group(1));
            if (value != null) last = value;
        }
        return last;
    }

    private static Double firstRate(String text) {
        Matcher m = RATE.matcher(text);
        while (m.find()) {
            Double rate = Money.parse(m.group(1));
            if (rate != null && rate > 0 && rate < 100) {
                return rate;
            }
        }
        return null;
    }
}
