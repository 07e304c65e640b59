package com.vat.extraction.service.strategy;

import com.vat.extraction.model.TaxDirection;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * WooCommerce country summary export: one row per country with a
 * "Net Total Tax" column. The report's VAT is the column total; refunds
 * appear as negative rows and reduce it.
 */
@Component
@Order(2)
public class WooCommerceNetTaxStrategy implements AmountExtractionStrategy {

    public static final String NAME = "woocommerce_net_total_tax";

    static final String[] NET_TAX = {"net total tax"};
    static final String[] COUNTRY = {"country", "billing country", "country code"};

    /** Header of a country summary export. */
    public static boolean isCountrySummaryHeader(List<String> header) {
        return TaxReportTable.hasColumn(header, NET_TAX) && TaxReportTable.hasColumn(header, COUNTRY);
    }

    /** Net tax per country cell as written in the export, or empty when the text is no such export. */
    public static Map<String, Double> netTaxByCountry(String text) {
        return TaxReportTable.parse(text, WooCommerceNetTaxStrategy::isCountrySummaryHeader)
                .map(table -> table.sumBy(table.column(COUNTRY), table.column(NET_TAX)))
                .orElse(Map.of());
    }

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
        TaxReportTable.parse(text, WooCommerceNetTaxStrategy::isCountrySummaryHeader).ifPresent(table -> {
            double total = table.sum(table.column(NET_TAX));
            if (total > 0) {
                matches.add(new AmountMatch(total, TaxDirection.SALES));
            }
        });
        return matches;
    }
}
