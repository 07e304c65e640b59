package com.vat.extraction.service.strategy;

import com.vat.extraction.model.Money;
import com.vat.extraction.model.TaxDirection;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * WooCommerce order detail export: one row per order with separate item
 * and shipping tax columns. Both are summed; a combined order tax column is
 * used only when the export has neither.
 */
@Component
@Order(3)
public class WooCommerceOrderTaxStrategy implements AmountExtractionStrategy {

    public static final String NAME = "woocommerce_item_shipping_tax";

    private static final String[] ITEM_TAX = {"item tax amt", "item tax amount", "item tax"};
    private static final String[] SHIPPING_TAX = {"shipping tax amt", "shipping tax amount", "shipping tax"};
    private static final String[] ORDER_TAX = {"order tax amount", "order tax"};

    static boolean isOrderDetailHeader(List<String> header) {
        boolean taxColumns = TaxReportTable.hasColumn(header, ITEM_TAX)
                || TaxReportTable.hasColumn(header, SHIPPING_TAX)
                || TaxReportTable.hasColumn(header, ORDER_TAX);
        return taxColumns && TaxReportTable.hasColumnContaining(header, "order");
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
        TaxReportTable.parse(text, WooCommerceOrderTaxStrategy::isOrderDetailHeader).ifPresent(table -> {
            int item = table.column(ITEM_TAX);
            int shipping = table.column(SHIPPING_TAX);
            double total = item >= 0 || shipping >= 0
                    ? Money.round(table.sum(item) + table.sum(shipping))
                    : table.sum(table.column(ORDER_TAX));
            if (total > 0) {
                matches.add(new AmountMatch(total, TaxDirection.SALES));
            }
        });
        return matches;
    }
}
