package com.vat.extraction.service;

import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.model.Money;
import com.vat.extraction.model.VatData;
import com.vat.extraction.model.VatDataReport;
import com.vat.extraction.model.VatDataReport.Finding;
import com.vat.extraction.model.VatDataReport.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Structural checks on VAT figures before they go into a return: Irish
 * rates, arithmetic consistency, suspicious values and registration hints.
 * A report is valid when it carries no HIGH severity error.
 */
@Service
@Slf4j
public class VatDataValidator {

    static final Set<Double> IRISH_VAT_RATES = Set.of(0.0, 4.8, 9.0, 13.5, 23.0);

    private static final Pattern IRISH_VAT_NUMBER = Pattern.compile("^IE[0-9]{7}[A-Z]{1,2}$", Pattern.CASE_INSENSITIVE);
    private static final double LARGE_VALUE = 100_000;
    private static final double REGISTRATION_THRESHOLD = 37_500;

    public VatDataReport validate(VatData data) {
        List<Finding> errors = new ArrayList<>();
        List<Finding> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        if (data == null || (data.getSalesVAT() == null && data.getPurchaseVAT() == null)) {
            errors.add(error("NO_VAT_DATA", "No VAT data provided", "vatData", Severity.HIGH));
            return VatDataReport.builder()
                    .valid(false)
                    .confidence(0.0)
                    .errors(errors)
                    .warnings(warnings)
                    .suggestions(List.of("Provide sales or purchase VAT amounts"))
                    .build();
        }

        List<Double> sales = nonNull(data.getSalesVAT());
        List<Double> purchase = nonNull(data.getPurchaseVAT());
        List<Double> all = new ArrayList<>(sales);
        all.addAll(purchase);

        checkValues(all, errors, warnings);
        checkRates(data, errors, warnings);
        checkArithmetic(data, all, warnings);
        checkBusinessRules(data, sales, purchase, errors, warnings, suggestions);
        checkCompliance(data, all, warnings);
        checkDocumentContext(data, sales, purchase, warnings);

        double confidence = confidence(data, errors, warnings);
        addSuggestions(data, all, errors, warnings, suggestions);

        boolean valid = errors.stream().noneMatch(e -> e.getSeverity() == Severity.HIGH);
        log.debug("VAT data validation: valid={}, errors={}, warnings={}", valid, errors.size(), warnings.size());

        return VatDataReport.builder()
                .valid(valid)
                .confidence(confidence)
                .errors(errors)
                .warnings(warnings)
                .suggestions(suggestions)
                .correctedData(autoCorrect(sales, purchase))
                .build();
    }

    public static boolean isValidIrishVatNumber(String vatNumber) {
        return vatNumber != null && IRISH_VAT_NUMBER.matcher(vatNumber.replaceAll("\\s", "")).matches();
    }

    // ─── CHECKS ────────────────────────────────────────────────────────

    private void checkValues(List<Double> all, List<Finding> errors, List<Finding> warnings) {
        List<Double> negative = all.stream().filter(v -> v < 0).toList();
        if (!negative.isEmpty()) {
            errors.add(error("NEGATIVE_VAT_VALUES", "Negative VAT values detected: " + join(negative),
                    "vatAmounts", Severity.HIGH));
        }

        List<Double> large = all.stream().filter(v -> v > LARGE_VALUE).toList();
        if (!large.isEmpty()) {
            warnings.add(warning("LARGE_VAT_VALUES", "Unusually large VAT values: €" + join(large),
                    "vatAmounts", "Verify these amounts are correct"));
        }

        List<Double> tiny = all.stream().filter(v -> v > 0 && v < 0.01).toList();
        if (!tiny.isEmpty()) {
            warnings.add(warning("SMALL_VAT_VALUES", "Very small VAT values: €" + join(tiny),
                    "vatAmounts", "Check if these are correctly extracted"));
        }
    }

    private void checkRates(VatData data, List<Finding> errors, List<Finding> warnings) {
        List<Double> rates = nonNull(data.getVatRates());
        if (rates.isEmpty()) {
            warnings.add(warning("NO_VAT_RATES", "No VAT rates specified", "vatRates",
                    "Consider extracting VAT rates for better validation"));
            return;
        }

        List<Double> invalid = rates.stream().filter(r -> !IRISH_VAT_RATES.contains(r)).toList();
        if (!invalid.isEmpty()) {
            errors.add(error("INVALID_IRISH_VAT_RATES", "Invalid Irish VAT rates: " + join(invalid) + "%",
                    "vatRates", Severity.MEDIUM));
        }

        for (Double rate : rates) {
            if (rate == 20.0) {
                warnings.add(warning("UK_VAT_RATE_DETECTED",
                        "UK VAT rate (20%) detected - Irish standard rate is 23%", "vatRates",
                        "Verify this is not a UK document"));
            } else if (rate == 25.0) {
                warnings.add(warning("NORDIC_VAT_RATE_DETECTED",
                        "Nordic VAT rate (25%) detected - Irish standard rate is 23%", "vatRates",
                        "Verify this is an Irish document"));
            }
        }
    }

    private void checkArithmetic(VatData data, List<Double> all, List<Finding> warnings) {
        double totalVat = Money.sum(all);
        Double totalAmount = data.getTotalAmount();

        if (totalAmount != null && totalAmount > 0 && data.getVatRates() != null && !data.getVatRates().isEmpty()) {
            double calculated = nonNull(data.getVatRates()).stream()
                    .mapToDouble(rate -> totalAmount * rate / 100)
                    .sum();
            // 5% of the document total absorbs rounding and inclusive/exclusive differences
            if (Math.abs(calculated - totalVat) > totalAmount * 0.05) {
                warnings.add(warning("VAT_CALCULATION_MISMATCH",
                        "Extracted VAT amounts do not match calculated VAT", "vatAmounts",
                        "Verify VAT calculation is correct"));
            }
        }

        Set<Double> seen = new HashSet<>();
        Set<Double> duplicates = new LinkedHashSet<>();
        for (Double value : all) {
            if (!seen.add(value)) duplicates.add(value);
        }
        if (!duplicates.isEmpty()) {
            warnings.add(warning("DUPLICATE_VAT_VALUES",
                    "Duplicate VAT values detected: €" + join(new ArrayList<>(duplicates)), "vatAmounts",
                    "Check if values were extracted multiple times"));
        }

        if (totalAmount != null && totalAmount > 0) {
            double share = totalVat / totalAmount * 100;
            if (share > 30) {
                warnings.add(warning("HIGH_VAT_PERCENTAGE",
                        String.format(Locale.ROOT, "VAT represents %.1f%% of total amount", share), "vatAmounts",
                        "Verify this is correct - usually VAT is 0-25% of total"));
            }
        }
    }

    private void checkBusinessRules(VatData data, List<Double> sales, List<Double> purchase,
                                    List<Finding> errors, List<Finding> warnings, List<String> suggestions) {
        double salesTotal = Money.sum(sales);
        double purchaseTotal = Money.sum(purchase);

        if (salesTotal > 0 && purchaseTotal > 0) {
            warnings.add(warning("MIXED_VAT_DOCUMENT", "Document contains both sales and purchase VAT",
                    "documentType", "Verify document type and VAT categorization"));
        }

        if (salesTotal == 0 && purchaseTotal == 0) {
            errors.add(error("NO_VAT_DETECTED", "No VAT amounts detected in document", "vatAmounts",
                    Severity.MEDIUM));
            suggestions.add("Check if document is VAT exempt or if extraction failed");
        }

        if (data.getVatNumber() != null && !isValidIrishVatNumber(data.getVatNumber())) {
            errors.add(error("INVALID_VAT_NUMBER_FORMAT", "Invalid Irish VAT number format: " + data.getVatNumber(),
                    "vatNumber", Severity.MEDIUM));
        }

        boolean roundValues = sales.stream().anyMatch(VatDataValidator::isRoundAndLarge)
                || purchase.stream().anyMatch(VatDataValidator::isRoundAndLarge);
        if (roundValues) {
            warnings.add(warning("ROUND_VAT_VALUES", "VAT amounts appear to be round numbers", "vatAmounts",
                    "Verify these are exact amounts, not estimates"));
        }
    }

    private void checkCompliance(VatData data, List<Double> all, List<Finding> warnings) {
        double totalVat = Money.sum(all);

        if (data.getPeriodStart() != null && data.getPeriodEnd() != null && totalVat > 0) {
            long months = Math.max(1, ChronoUnit.MONTHS.between(
                    data.getPeriodStart().withDayOfMonth(1), data.getPeriodEnd().withDayOfMonth(1)));
            double annualized = totalVat / months * 12;
            if (annualized > REGISTRATION_THRESHOLD && data.getVatNumber() == null) {
                warnings.add(warning("VAT_REGISTRATION_REQUIRED",
                        "VAT amounts suggest registration threshold exceeded", "vatNumber",
                        "Business may need VAT registration"));
            }
        }

        if (data.getDocumentType() == DocumentCategory.PURCHASE_INVOICE
                && data.getVatNumber() != null
                && !data.getVatNumber().toUpperCase(Locale.ROOT).startsWith("IE")) {
            warnings.add(warning("POTENTIAL_REVERSE_CHARGE", "International supplier detected", "vatNumber",
                    "Check if reverse charge VAT applies"));
        }
    }

    private void checkDocumentContext(VatData data, List<Double> sales, List<Double> purchase,
                                      List<Finding> warnings) {
        if (data.getDocumentType() == DocumentCategory.SALES_INVOICE && sales.isEmpty()) {
            warnings.add(warning("CATEGORY_VAT_MISMATCH", "Sales invoice but no sales VAT detected", "category",
                    "Verify document category or VAT extraction"));
        }
        if (data.getDocumentType() == DocumentCategory.PURCHASE_INVOICE && purchase.isEmpty()) {
            warnings.add(warning("CATEGORY_VAT_MISMATCH", "Purchase invoice but no purchase VAT detected", "category",
                    "Verify document category or VAT extraction"));
        }

        String fileName = data.getFileName();
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).contains("credit")
                && sales.stream().anyMatch(v -> v > 0)) {
            warnings.add(warning("CREDIT_NOTE_WITH_POSITIVE_VAT", "Credit note with positive VAT amounts",
                    "vatAmounts", "Credit notes typically have negative VAT amounts"));
        }
    }

    // ─── SCORING ───────────────────────────────────────────────────────

    double confidence(VatData data, List<Finding> errors, List<Finding> warnings) {
        double confidence = 0.8;

        long high = errors.stream().filter(e -> e.getSeverity() == Severity.HIGH).count();
        long medium = errors.stream().filter(e -> e.getSeverity() == Severity.MEDIUM).count();
        confidence -= high * 0.3 + medium * 0.15;
        confidence -= warnings.size() * 0.05;

        if (data.getVatRates() != null && !data.getVatRates().isEmpty()) confidence += 0.1;
        if (isValidIrishVatNumber(data.getVatNumber())) confidence += 0.1;
        if (data.getTotalAmount() != null && data.getTotalAmount() > 0) confidence += 0.05;

        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private void addSuggestions(VatData data, List<Double> all, List<Finding> errors,
                                List<Finding> warnings, List<String> suggestions) {
        if (!errors.isEmpty()) {
            suggestions.add("Review and correct validation errors before submission");
        }
        if (!warnings.isEmpty()) {
            suggestions.add("Consider reviewing warnings to improve accuracy");
        }
        if (Money.sum(all) == 0) {
            suggestions.add("If document should contain VAT, try re-uploading with better quality");
        }
        if (data.getVatNumber() == null) {
            suggestions.add("Include VAT number if available for better validation");
        }
    }

    /** Drops duplicates and zeros. Null when there was nothing to correct. */
    VatDataReport.CorrectedVatData autoCorrect(List<Double> sales, List<Double> purchase) {
        List<String> corrections = new ArrayList<>();

        List<Double> uniqueSales = new ArrayList<>(new LinkedHashSet<>(sales));
        if (uniqueSales.size() != sales.size()) {
            corrections.add("Removed duplicate sales VAT values");
        }
        List<Double> uniquePurchase = new ArrayList<>(new LinkedHashSet<>(purchase));
        if (uniquePurchase.size() != purchase.size()) {
            corrections.add("Removed duplicate purchase VAT values");
        }

        List<Double> cleanSales = uniqueSales.stream().filter(v -> v > 0).toList();
        List<Double> cleanPurchase = uniquePurchase.stream().filter(v -> v > 0).toList();
        if (cleanSales.size() != uniqueSales.size() || cleanPurchase.size() != uniquePurchase.size()) {
            corrections.add("Removed zero or negative VAT values");
        }

        if (corrections.isEmpty()) {
            return null;
        }
        return new VatDataReport.CorrectedVatData(cleanSales, cleanPurchase, corrections);
    }

    // ─── HELPERS ───────────────────────────────────────────────────────

    private static boolean isRoundAndLarge(double value) {
        return value > 100 && value % 1 == 0;
    }

    private static List<Double> nonNull(List<Double> values) {
        if (values == null) return List.of();
        return values.stream().filter(Objects::nonNull).toList();
    }

    private static String join(List<Double> values) {
        StringJoiner joiner = new StringJoiner(", ");
        values.forEach(v -> joiner.add(String.format(Locale.ROOT, "%.2f", v)));
        return joiner.toString();
    }

    private static Finding error(String code, String message, String field, Severity severity) {
        return Finding.builder().code(code).message(message).field(field).severity(severity).build();
    }

    private static Finding warning(String code, String message, String field, String recommendation) {
        return Finding.builder().code(code).message(message).field(field).recommendation(recommendation).build();
    }
}
