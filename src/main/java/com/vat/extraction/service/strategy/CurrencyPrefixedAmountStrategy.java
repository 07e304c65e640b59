package com.vat.extraction.service.strategy;

import com.vat.extraction.model.Money;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Amounts written with a currency symbol ({@code €123.45}, {@code £ 1,234.50},
 * {@code $99}) on a line that names the tax. Subtotal, net and grand total
 * lines carry currency amounts too but are not VAT, so a line counts only
 * when it mentions VAT or tax and is not a VAT-inclusive or VAT-exclusive
 * total. On a qualifying line the last amount is taken, which skips the
 * taxable base in lines like {@code VAT 23% on €100.00: €23.00}.
 */
@Component
@Order(4)
public class CurrencyPrefixedAmountStrategy implements AmountExtractionStrategy {

    public static final String NAME = "currency_prefixed";

    private static final Pattern AMOUNT = Pattern.compile(
            "[€£$]\\s?(\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Double> extract(String text) {
        List<Double> amounts = new ArrayList<>();
        if (text == null || text.isEmpty()) return amounts;

        for (String line : TaxLines.lines(text)) {
            if (!TaxLines.holdsTaxAmount(line)) continue;

            Double last = null;
            Matcher m = AMOUNT.matcher(line);
            while (m.find()) {
                Double value = Money.parse(m.group(1));
                if (value != null) last = value;
            }
            if (last != null) {
                amounts.add(last);
            }
        }
        return amounts;
    }
}
