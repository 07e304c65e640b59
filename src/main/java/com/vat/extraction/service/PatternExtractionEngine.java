package com.vat.extraction.service;

import com.vat.extraction.config.ExtractionProperties;
import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.model.ConfidenceEstimate;
import com.vat.extraction.model.ExtractionResult;
import com.vat.extraction.model.Money;
import com.vat.extraction.model.TaxDirection;
import com.vat.extraction.service.strategy.AmountExtractionStrategy;
import com.vat.extraction.service.strategy.AmountMatch;
import com.vat.extraction.service.strategy.WooCommerceNetTaxStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns document text into VAT amounts.
 *
 * Every strategy in the chain is run and the matches are unioned in chain
 * order. Amounts are deduplicated by their value in cents; the first
 * strategy to report a value owns it. Fallback strategies only run when
 * nothing has matched so far. A strategy that recognises a whole document
 * layout ends the chain once it has matched, and its amounts may carry
 * their own sales/purchase direction. Extraction never throws on bad
 * input: empty or unreadable text gives an empty, low-confidence result.
 */
@Service
@Slf4j
public class PatternExtractionEngine {

    private static final Map<String, String> COUNTRY_NAMES = Map.ofEntries(
            Map.entry("IRELAND", "IE"), Map.entry("UNITED KINGDOM", "GB"), Map.entry("GERMANY", "DE"),
            Map.entry("FRANCE", "FR"), Map.entry("SPAIN", "ES"), Map.entry("ITALY", "IT"),
            Map.entry("NETHERLANDS", "NL"), Map.entry("BELGIUM", "BE"), Map.entry("AUSTRIA", "AT"),
            Map.entry("POLAND", "PL"), Map.entry("PORTUGAL", "PT"), Map.entry("SWEDEN", "SE"),
            Map.entry("DENMARK", "DK"), Map.entry("FINLAND", "FI"), Map.entry("LUXEMBOURG", "LU")
    );

    private static final Set<String> COUNTRY_CODES = new HashSet<>(COUNTRY_NAMES.values());

    private static final Pattern COUNTRY_LINE = Pattern.compile(
            "^\\s*([A-Za-z][A-Za-z ]{1,29}?)\\s*[:,;\\t]?\\s*[€£$]?\\s*(\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)\\s*$",
            Pattern.MULTILINE);

    private static final List<String> PURCHASE_HINTS = List.of("purchase", "supplier", "bill from");
    private static final List<String> SALES_HINTS = List.of("sales", "invoice to", "customer", "bill to");

    private final List<AmountExtractionStrategy> strategies;
    private final ConfidenceEstimator confidenceEstimator;
    private final ExtractionProperties properties;

    public PatternExtractionEngine(List<AmountExtractionStrategy> strategies,
                                   ConfidenceEstimator confidenceEstimator,
                                   ExtractionProperties properties) {
        this.strategies = List.copyOf(strategies);
        this.confidenceEstimator = confidenceEstimator;
        this.properties = properties;
    }

    /**
     * Main entry point. The declared category decides the sales/purchase
     * bucket and the sanity ceiling for amounts.
     */
    public ExtractionResult extract(String text, DocumentCategory category) {
        DocumentCategory declared = category != null ? category : DocumentCategory.OTHER;

        if (text == null || text.isBlank()) {
            ConfidenceEstimate low = confidenceEstimator.estimate("", false);
            return ExtractionResult.empty(declared, low.getValue(), "No readable text in document");
        }

        List<String> diagnostics = new ArrayList<>();
        int limit = properties.getMaxTextLength();
        final String scanned = text.length() > limit ? text.substring(0, limit) : text;
        if (scanned.length() < text.length()) {
            diagnostics.add("Text truncated from " + text.length() + " to " + limit + " characters");
        }

        // ─── CANDIDATES ─────────────────────────────────────────────────
        double ceiling = properties.ceilingFor(declared);
        List<Candidate> kept = new ArrayList<>(collectCandidates(scanned, ceiling, diagnostics).values());
        String method = kept.isEmpty() ? ExtractionResult.METHOD_NONE : kept.get(0).strategy();

        // ─── DIRECTION ──────────────────────────────────────────────────
        TaxDirection direction = declared.declaredDirection()
                .orElseGet(() -> inferDirection(scanned, diagnostics));

        // Layout-tagged amounts keep their own bucket
        List<Double> sales = new ArrayList<>();
        List<Double> purchases = new ArrayList<>();
        for (Candidate c : kept) {
            TaxDirection bucket = c.direction() != null ? c.direction() : direction;
            (bucket == TaxDirection.PURCHASE ? purchases : sales).add(c.amount());
        }

        ConfidenceEstimate confidence = confidenceEstimator.estimate(scanned, !kept.isEmpty());

        Map<String, Double> countries = declared.isReport() ? parseCountryBreakdown(scanned) : Map.of();

        return ExtractionResult.builder()
                .category(declared)
                .direction(direction)
                .salesAmounts(sales)
                .purchaseAmounts(purchases)
                .confidence(confidence.getValue())
                .confidenceSource(confidence.getSource())
                .method(method)
                .diagnostics(diagnostics)
                .countryBreakdown(countries)
                .build();
    }

    // ─── STRATEGY CHAIN ────────────────────────────────────────────────

    /**
     * Runs the chain. Candidates outside {@code 0 < amount <= ceiling} are
     * dropped before they are keyed by cents, so absurd values never reach
     * the key arithmetic.
     */
    private Map<Long, Candidate> collectCandidates(String text, double ceiling, List<String> diagnostics) {
        Map<Long, Candidate> byCents = new LinkedHashMap<>();
        double bound = Math.min(ceiling, Money.MAX_AMOUNT);
        int discarded = 0;

        for (AmountExtractionStrategy strategy : strategies) {
            if (strategy.fallbackOnly() && !byCents.isEmpty()) {
                continue;
            }

            List<AmountMatch> found;
            try {
                found = strategy.match(text);
            } catch (RuntimeException e) {
                // A broken pattern must not sink the other strategies
                log.warn("Strategy {} failed: {}", strategy.name(), e.getMessage());
                diagnostics.add("Strategy " + strategy.name() + " failed: " + e.getMessage());
                continue;
            }

            int added = 0;
            for (AmountMatch match : found) {
                if (match == null || Double.isNaN(match.amount()) || Double.isInfinite(match.amount())) continue;
                double rounded = Money.round(match.amount());
                if (rounded <= 0 || rounded > bound) {
                    discarded++;
                    diagnostics.add("Discarded " + rounded + " from " + strategy.name()
                            + " (outside 0 < amount <= " + ceiling + ")");
                    continue;
                }
                if (byCents.putIfAbsent(Money.toCents(rounded),
                        new Candidate(rounded, strategy.name(), match.direction())) == null) {
                    added++;
                }
            }
            log.debug("Strategy {} found {} amount(s), {} new", strategy.name(), found.size(), added);

            if (strategy.claimsDocument() && added > 0) {
                diagnostics.add("Document layout recognised by " + strategy.name() + "; remaining strategies skipped");
                break;
            }
        }
        if (discarded > 0) {
            log.debug("Discarded {} candidate amount(s) outside the ceiling of {}", discarded, ceiling);
        }
        return byCents;
    }

    // ─── CATEGORIZATION ────────────────────────────────────────────────

    /**
     * For documents without a declared direction. Purchase wording wins over
     * sales wording; with neither, amounts are treated as sales.
     */
    TaxDirection inferDirection(String text, List<String> diagnostics) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (PURCHASE_HINTS.stream().anyMatch(lower::contains)) {
            diagnostics.add("Direction inferred as PURCHASE from document wording");
            return TaxDirection.PURCHASE;
        }
        if (SALES_HINTS.stream().anyMatch(lower::contains)) {
            diagnostics.add("Direction inferred as SALES from document wording");
            return TaxDirection.SALES;
        }
        diagnostics.add("No direction hint found, defaulting to SALES");
        return TaxDirection.SALES;
    }

    // ─── COUNTRY BREAKDOWN ─────────────────────────────────────────────

    /**
     * Per-country lines of a summary report, e.g. {@code IE: 1,234.56} or
     * {@code Germany 88.10}. Keys are ISO codes; repeated countries add up.
     */
    Map<String, Double> parseCountryBreakdown(String text) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        Matcher m = COUNTRY_LINE.matcher(text);
        while (m.find()) {
            String code = toCountryCode(m.group(1).trim());
            Double amount = Money.parse(m.group(2));
            if (code == null || amount == null) continue;
            breakdown.merge(code, amount, (a, b) -> Money.round(a + b));
        }
        if (breakdown.isEmpty()) {
            WooCommerceNetTaxStrategy.netTaxByCountry(text).forEach((country, amount) -> {
                String code = toCountryCode(country);
                if (code != null) {
                    breakdown.merge(code, amount, (a, b) -> Money.round(a + b));
                }
            });
        }
        return breakdown;
    }

    private static String toCountryCode(String label) {
        String upper = label.toUpperCase(Locale.ROOT);
        if (upper.length() == 2 && COUNTRY_CODES.contains(upper)) {
            return upper;
        }
        return COUNTRY_NAMES.get(upper);
    }

    private record Candidate(double amount, String strategy, TaxDirection direction) {}
}
