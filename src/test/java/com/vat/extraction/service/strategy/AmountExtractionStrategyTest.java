package com.vat.extraction.service.strategy;

import com.vat.extraction.model.TaxDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AmountExtractionStrategyTest {

    @Nested
    @DisplayName("currency prefixed")
    class CurrencyPrefixed {

        private final CurrencyPrefixedAmountStrategy strategy = new CurrencyPrefixedAmountStrategy();

        @Test
        @DisplayName("reads euro, sterling and dollar amounts with grouping")
        void readsSymbols() {
            assertThat(strategy.extract("VAT: €1,234.50\nTax £ 46.00\nSales tax $99"))
                    .containsExactly(1234.5, 46.0, 99.0);
        }

        @Test
        @DisplayName("takes only the VAT line of an invoice, not its subtotal or total")
        void onlyTaxLines() {
            assertThat(strategy.extract("Subtotal: €100.00\nVAT @ 23%: €23.00\nTotal: €123.00"))
                    .containsExactly(23.0);
        }

        @Test
        @DisplayName("skips totals stated inclusive or exclusive of VAT")
        void skipsQualifiedTotals() {
            String invoice = "Amount excl. VAT: €200.00\nVAT 23% on €200.00: €46.00\nTotal incl. VAT: €246.00";

            assertThat(strategy.extract(invoice)).containsExactly(46.0);
        }

        @Test
        @DisplayName("ignores bare numbers")
        void ignoresBareNumbers() {
            assertThat(strategy.extract("Invoice 2024-117, qty 3")).isEmpty();
            assertThat(strategy.extract(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("label adjacent")
    class LabelAdjacent {

        private final LabelAdjacentAmountStrategy strategy = new LabelAdjacentAmountStrategy();

        @Test
        @DisplayName("reads the amount after a VAT label, skipping the rate")
        void afterLabel() {
            assertThat(strategy.extract("VAT @ 23%: 46.00")).containsExactly(46.0);
        }

        @Test
        @DisplayName("reads the amount before a VAT label")
        void beforeLabel() {
            assertThat(strategy.extract("Line total 46.00 VAT")).containsExactly(46.0);
        }

        @Test
        @DisplayName("does not read the invoice total that follows the VAT line")
        void ignoresTotals() {
            assertThat(strategy.extract("Subtotal: 100.00\nVAT @ 23%: 23.00\nTotal including VAT: 123.00"))
                    .containsExactly(23.0);
        }

        @Test
        @DisplayName("needs a decimal amount so invoice numbers are not picked up")
        void requiresDecimal() {
            assertThat(strategy.extract("VAT number IE1234567T")).isEmpty();
        }
    }

    @Nested
    @DisplayName("rate derived")
    class RateDerived {

        private final RateDerivedAmountStrategy strategy = new RateDerivedAmountStrategy();

        @Test
        @DisplayName("derives the VAT share of an inclusive total")
        void derivesShare() {
            assertThat(strategy.extract("Rate 23%\nTotal: 123.00")).containsExactly(23.0);
            assertThat(strategy.fallbackOnly()).isTrue();
        }

        @Test
        @DisplayName("needs both a total and a rate")
        void needsBoth() {
            assertThat(strategy.extract("Total: 123.00")).isEmpty();
            assertThat(strategy.extract("Rate 23%")).isEmpty();
        }
    }

    @Nested
    @DisplayName("VAT3 return boxes")
    class Vat3Boxes {

        private final Vat3ReturnBoxStrategy strategy = new Vat3ReturnBoxStrategy();

        @Test
        @DisplayName("T1 is VAT on sales and T2 VAT on purchases; T3 is not read")
        void boxesCarryDirection() {
            String form = """
                    VAT 3 Return - Jan/Feb 2024
                    Box T1 VAT on Sales €2,300.00
                    Box T2 VAT on Purchases €460.00
                    Box T3 Net Payable €1,840.00
                    """;

            assertThat(strategy.match(form)).containsExactly(
                    new AmountMatch(2300.0, TaxDirection.SALES),
                    new AmountMatch(460.0, TaxDirection.PURCHASE));
            assertThat(strategy.claimsDocument()).isTrue();
        }

        @Test
        @DisplayName("skips a rate written between the box label and the amount")
        void skipsRate() {
            String form = "VAT3\nT1 23% 1,150.00\nT2 13.5% 270.00";

            assertThat(strategy.extract(form)).containsExactly(1150.0, 270.0);
        }

        @Test
        @DisplayName("ignores documents that are not VAT3 returns")
        void otherDocuments() {
            assertThat(strategy.match("Order T1 shipped\nVAT: €10.00")).isEmpty();
            assertThat(strategy.match(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("WooCommerce country summary")
    class WooCommerceNetTax {

        private final WooCommerceNetTaxStrategy strategy = new WooCommerceNetTaxStrategy();

        private static final String EXPORT = """
                Country,Orders,Net Total Tax
                Ireland,12,"1,150.00"
                Germany,3,190.00
                Ireland,1,-50.00
                Total,16,1290.00
                """;

        @Test
        @DisplayName("the report VAT is the net tax column total, refunds included, summary row excluded")
        void sumsNetTax() {
            assertThat(strategy.match(EXPORT)).containsExactly(new AmountMatch(1290.0, TaxDirection.SALES));
        }

        @Test
        @DisplayName("breaks net tax down by country")
        void byCountry() {
            assertThat(WooCommerceNetTaxStrategy.netTaxByCountry(EXPORT))
                    .containsEntry("Ireland", 1100.0)
                    .containsEntry("Germany", 190.0)
                    .hasSize(2);
        }

        @Test
        @DisplayName("a table without a net tax column is not a country summary")
        void otherTables() {
            assertThat(strategy.match("Country,Orders\nIreland,12")).isEmpty();
            assertThat(WooCommerceNetTaxStrategy.netTaxByCountry("VAT: 10.00")).isEmpty();
        }
    }

    @Nested
    @DisplayName("WooCommerce order detail")
    class WooCommerceOrderTax {

        private final WooCommerceOrderTaxStrategy strategy = new WooCommerceOrderTaxStrategy();

        @Test
        @DisplayName("adds item and shipping tax across orders")
        void itemAndShipping() {
            String export = """
                    Order ID,Order Date,Item Tax Amt.,Shipping Tax Amt.
                    1001,2024-03-01,23.00,1.15
                    1002,2024-03-02,46.00,0
                    """;

            assertThat(strategy.match(export)).containsExactly(new AmountMatch(70.15, TaxDirection.SALES));
        }

        @Test
        @DisplayName("falls back to the order tax column in semicolon exports")
        void orderTaxColumn() {
            assertThat(strategy.extract("Order Number;Order Tax\n1;10.00\n2;5.50")).containsExactly(15.5);
        }

        @Test
        @DisplayName("needs an order column")
        void needsOrderColumn() {
            assertThat(strategy.extract("Product,Item Tax\nMug,2.30")).isEmpty();
        }
    }
}
