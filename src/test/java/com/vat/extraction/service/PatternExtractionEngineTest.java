package com.vat.extraction.service;

import com.vat.extraction.config.ExtractionProperties;
import com.vat.extraction.config.LearningProperties;
import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.model.ConfidenceSource;
import com.vat.extraction.model.ExtractionResult;
import com.vat.extraction.model.TaxDirection;
import com.vat.extraction.service.strategy.AmountExtractionStrategy;
import com.vat.extraction.service.strategy.CurrencyPrefixedAmountStrategy;
import com.vat.extraction.service.strategy.LabelAdjacentAmountStrategy;
import com.vat.extraction.service.strategy.RateDerivedAmountStrategy;
import com.vat.extraction.service.strategy.Vat3ReturnBoxStrategy;
import com.vat.extraction.service.strategy.WooCommerceNetTaxStrategy;
import com.vat.extraction.service.strategy.WooCommerceOrderTaxStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PatternExtractionEngineTest {

    private ExtractionProperties properties;
    private PatternExtractionEngine engine;

    @BeforeEach
    void setUp() {
        properties = new ExtractionProperties();
        engine = engineWith(defaultStrategies());
    }

    private static List<AmountExtractionStrategy> defaultStrategies() {
        return List.of(new Vat3ReturnBoxStrategy(),
                new WooCommerceNetTaxStrategy(),
                new WooCommerceOrderTaxStrategy(),
                new CurrencyPrefixedAmountStrategy(),
                new LabelAdjacentAmountStrategy(),
                new RateDerivedAmountStrategy());
    }

    private PatternExtractionEngine engineWith(List<AmountExtractionStrategy> strategies) {
        ConfidenceEstimator estimator = new ConfidenceEstimator(properties, new LearningProperties());
        return new PatternExtractionEngine(strategies, estimator, properties);
    }

    @Test
    @DisplayName("a labelled euro amount on a sales invoice is a sales amount at the high prior")
    void salesInvoiceScenario() {
        ExtractionResult result = engine.extract("Total VAT: €123.45", DocumentCategory.SALES_INVOICE);

        assertThat(result.getSalesAmounts()).containsExactly(123.45);
        assertThat(result.getPurchaseAmounts()).isEmpty();
        assertThat(result.getConfidence()).isGreaterThanOrEqualTo(0.85);
        assertThat(result.getConfidenceSource()).isEqualTo(ConfidenceSource.AMOUNTS_FOUND_PRIOR);
        assertThat(result.getMethod()).isEqualTo(CurrencyPrefixedAmountStrategy.NAME);
    }

    @Test
    @DisplayName("empty text gives no amounts at the low prior")
    void emptyPurchaseReceipt() {
        ExtractionResult result = engine.extract("", DocumentCategory.PURCHASE_RECEIPT);

        assertThat(result.getAllAmounts()).isEmpty();
        assertThat(result.getConfidence()).isCloseTo(0.3, within(1e-9));
        assertThat(result.getDirection()).isEqualTo(TaxDirection.PURCHASE);
    }

    @Test
    @DisplayName("null text and null category do not throw")
    void nullInputs() {
        ExtractionResult result = engine.extract(null, null);

        assertThat(result.getCategory()).isEqualTo(DocumentCategory.OTHER);
        assertThat(result.hasAmounts()).isFalse();
    }

    @Nested
    @DisplayName("strategy chain")
    class Chain {

        @Test
        @DisplayName("unions strategies in order and keeps the first owner of a value")
        void unionsInOrder() {
            ExtractionResult result = engine.extract("Shipping €5.00\nVAT 23%: 46.00\nVAT €5.00",
                    DocumentCategory.PURCHASE_INVOICE);

            assertThat(result.getPurchaseAmounts()).containsExactly(5.0, 46.0);
            assertThat(result.getMethod()).isEqualTo(CurrencyPrefixedAmountStrategy.NAME);
        }

        @Test
        @DisplayName("the fallback runs only when nothing else matched")
        void fallbackOnlyWhenEmpty() {
            ExtractionResult derived = engine.extract("Rate 23%\nTotal: 123.00", DocumentCategory.SALES_RECEIPT);
            assertThat(derived.getSalesAmounts()).containsExactly(23.0);
            assertThat(derived.getMethod()).isEqualTo(RateDerivedAmountStrategy.NAME);

            ExtractionResult direct = engine.extract("Rate 23%\nVAT: 23.00\nTotal: 200.00", DocumentCategory.SALES_RECEIPT);
            assertThat(direct.getSalesAmounts()).containsExactly(23.0);
            assertThat(direct.getMethod()).isEqualTo(LabelAdjacentAmountStrategy.NAME);
        }

        @Test
        @DisplayName("a throwing strategy is skipped and noted")
        void brokenStrategy() {
            List<AmountExtractionStrategy> strategies = new ArrayList<>();
            strategies.add(new AmountExtractionStrategy() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public List<Double> extract(String text) {
                    throw new IllegalStateException("bad pattern");
                }
            });
            strategies.addAll(defaultStrategies());

            ExtractionResult result = engineWith(strategies).extract("VAT: €10.00", DocumentCategory.SALES_INVOICE);

            assertThat(result.getSalesAmounts()).containsExactly(10.0);
            assertThat(result.getDiagnostics()).anyMatch(d -> d.contains("Strategy broken failed"));
        }
    }

    @Test
    @DisplayName("amounts above the category ceiling are discarded with a diagnostic")
    void ceilingFilter() {
        ExtractionResult result = engine.extract("VAT: €20,000.00", DocumentCategory.SALES_RECEIPT);

        assertThat(result.hasAmounts()).isFalse();
        assertThat(result.getConfidence()).isCloseTo(0.3, within(1e-9));
        assertThat(result.getDiagnostics()).anyMatch(d -> d.startsWith("Discarded 20000.0"));
    }

    @Test
    @DisplayName("an invoice yields its VAT line only, not subtotal or total")
    void invoiceTotalsAreNotVat() {
        ExtractionResult result = engine.extract("Subtotal: €100.00\nVAT @ 23%: €23.00\nTotal: €123.00",
                DocumentCategory.SALES_INVOICE);

        assertThat(result.getSalesAmounts()).containsExactly(23.0);
    }

    @Nested
    @DisplayName("absurd amounts")
    class AbsurdAmounts {

        @Test
        @DisplayName("a reference number beside the VAT amount does not break extraction")
        void hugeNumberInText() {
            ExtractionResult result = engine.extract("Ref €100000000000000000 VAT: €12.00", DocumentCategory.SALES_INVOICE);

            assertThat(result.getSalesAmounts()).containsExactly(12.0);
        }

        @Test
        @DisplayName("a huge labelled amount is discarded, not keyed")
        void hugeLabelledAmount() {
            ExtractionResult result = engine.extract("VAT: €100000000000000000.00\nVAT: €12.00",
                    DocumentCategory.SALES_REPORT);

            assertThat(result.getSalesAmounts()).containsExactly(12.0);
            assertThat(result.getDiagnostics()).anyMatch(d -> d.startsWith("Discarded 1.0E17"));
        }

        @Test
        @DisplayName("values no cent key can hold are dropped even under a generous ceiling")
        void beyondCentRange() {
            properties.getCeilings().setOther(Double.MAX_VALUE);
            AmountExtractionStrategy wild = new AmountExtractionStrategy() {
                @Override
                public String name() {
                    return "wild";
                }

                @Override
                public List<Double> extract(String text) {
                    return List.of(1e300, Double.POSITIVE_INFINITY, Double.NaN, 12.0);
                }
            };

            ExtractionResult result = engineWith(List.of(wild)).extract("anything", DocumentCategory.OTHER);

            assertThat(result.getAllAmounts()).containsExactly(12.0);
        }
    }

    @Nested
    @DisplayName("known report layouts")
    class Layouts {

        @Test
        @DisplayName("a VAT3 return fills both buckets from its boxes and skips the generic strategies")
        void vat3Return() {
            String form = "VAT 3 Return\nBox T1 VAT on Sales €2,300.00\nBox T2 VAT on Purchases €460.00\nVAT: €99.00";

            ExtractionResult result = engine.extract(form, DocumentCategory.SALES_REPORT);

            assertThat(result.getSalesAmounts()).containsExactly(2300.0);
            assertThat(result.getPurchaseAmounts()).containsExactly(460.0);
            assertThat(result.getMethod()).isEqualTo(Vat3ReturnBoxStrategy.NAME);
            assertThat(result.getDiagnostics())
                    .contains("Document layout recognised by vat3_return_boxes; remaining strategies skipped");
        }

        @Test
        @DisplayName("a WooCommerce country summary gives the net tax total and its country breakdown")
        void wooCommerceSummary() {
            String export = "Country,Orders,Net Total Tax\nIreland,12,\"1,150.00\"\nGermany,3,190.00\nIreland,1,-50.00";

            ExtractionResult result = engine.extract(export, DocumentCategory.SALES_REPORT);

            assertThat(result.getSalesAmounts()).containsExactly(1290.0);
            assertThat(result.getMethod()).isEqualTo(WooCommerceNetTaxStrategy.NAME);
            assertThat(result.getCountryBreakdown())
                    .containsEntry("IE", 1100.0)
                    .containsEntry("DE", 190.0)
                    .hasSize(2);
        }
    }

    @Test
    @DisplayName("text beyond the scan limit is ignored")
    void truncation() {
        properties.setMaxTextLength(20);
        String text = "VAT: €10.00" + " ".repeat(50) + "VAT: €99.00";

        ExtractionResult result = engine.extract(text, DocumentCategory.SALES_INVOICE);

        assertThat(result.getSalesAmounts()).containsExactly(10.0);
        assertThat(result.getDiagnostics()).anyMatch(d -> d.startsWith("Text truncated"));
    }

    @Test
    @DisplayName("a declared confidence in the text wins over the prior")
    void explicitConfidence() {
        ExtractionResult result = engine.extract("VAT: €10.00\nConfidence: 92%", DocumentCategory.SALES_INVOICE);

        assertThat(result.getConfidence()).isCloseTo(0.92, within(1e-9));
        assertThat(result.getConfidenceSource()).isEqualTo(ConfidenceSource.EXPLICIT);
    }

    @Nested
    @DisplayName("uncategorized documents")
    class Direction {

        @Test
        @DisplayName("purchase wording makes amounts purchases")
        void purchaseHint() {
            ExtractionResult result = engine.extract("Supplier bill\nVAT: €10.00", DocumentCategory.OTHER);

            assertThat(result.getDirection()).isEqualTo(TaxDirection.PURCHASE);
            assertThat(result.getPurchaseAmounts()).containsExactly(10.0);
        }

        @Test
        @DisplayName("without any hint amounts default to sales")
        void defaultsToSales() {
            ExtractionResult result = engine.extract("VAT: €10.00", DocumentCategory.OTHER);

            assertThat(result.getDirection()).isEqualTo(TaxDirection.SALES);
            assertThat(result.getSalesAmounts()).containsExactly(10.0);
        }
    }

    @Test
    @DisplayName("reports carry a per-country breakdown keyed by ISO code")
    void countryBreakdown() {
        ExtractionResult result = engine.extract("IE: 1,234.56\nGermany 88.10\nIE 10.00", DocumentCategory.SALES_REPORT);

        assertThat(result.getCountryBreakdown())
                .containsEntry("IE", 1244.56)
                .containsEntry("DE", 88.10)
                .hasSize(2);
    }
}
