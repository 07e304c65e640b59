package com.vat.extraction.service.strategy;

import com.vat.extraction.model.Money;
import com.vat.extraction.model.TaxDirection;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Irish VAT3 return boxes. T1 holds VAT on sales and T2 VAT on purchases.
 * T3 and T4 are the net payable/repayable figures derived from those two
 * and are not read, so the return's VAT is not counted twice.
 */
@Component
@Order(1)
public class Vat3ReturnBoxStrategy implements AmountExtractionStrategy {

    public static final String NAME = "vat3_return_boxes";

    private static final String NUMBER = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)";

    // "Box T1", or a bare "T1" at the start of a line; rates between label and amount are skipped
    private static final Pattern BOX = Pattern.compile(
            "(?:\\bbox\\s*|^\\s*)t([1-4])\\b(?:[^\\d\\n]|\\d+(?:\\.\\d+)?\\s*%)*?[€]?\\s*(?<![\\d.,])" + NUMBER + "(?![\\d%]|\\.\\d)",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final Pattern VAT3_MARKER = Pattern.compile("\\bvat\\s*3\\b|\\bbox\\s*t[1-4]\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean claimsDocument() {
        return true;
    }

    @Override
    public List<Double> extract(String text) {
        return match(text).stream().map(AmountMatch::amount).toList();
    }

    @Override
    public List<AmountMatch> match(String text) {
        List<AmountMatch> matches = new ArrayList<>();
        if (text == null || text.isEmpty() || !VAT3_MARKER.matcher(text).find()) {
            return matches;
        }

        Matcher m = BOX.matcher(text);
        while (m.find()) {
            TaxDirection direction = directionOf(m.group(1));
            Double value = Money.parse(m.group(2));
            if (direction != null && value != null) {
                matches.add(new AmountMatch(value, direction));
            }
        }
        return matches;
    }

    private static TaxDirection directionOf(String box) {
        if ("1".equals(box)) return TaxDirection.SALES;
        if ("2".equals(box)) return TaxDirection.PURCHASE;
        return null;
    }
}
