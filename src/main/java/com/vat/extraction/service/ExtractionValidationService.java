package com.vat.extraction.service;

import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.model.*;
import com.vat.extraction.service.strategy.WooCommerceOrderTaxStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;

/**
 * Measures extraction output against known totals, singly or as a labeled suite.
 *
 * Accuracy is {@code 100 - |extracted - expected| / expected * 100}, floored
 * at 0. An expected total of zero reads 100 when less than a cent was
 * extracted and 0 otherwise. A result passes when it is within one cent.
 */
@Service
@Slf4j
public class ExtractionValidationService {

    static final double TOLERANCE = 0.01;

    private final PatternExtractionEngine extractionEngine;
    private final Clock clock;

    public ExtractionValidationService(PatternExtractionEngine extractionEngine, Clock clock) {
        this.extractionEngine = extractionEngine;
        this.clock = clock;
    }

    public ValidationResult validate(ExtractionResult extracted, ExpectedTotals expected) {
        return validate(extracted, expected, expected.getName());
    }

    public ValidationResult validate(ExtractionResult extracted, ExpectedTotals expected, String testName) {
        ReportType reportType = expected.getReportType() != null ? expected.getReportType() : ReportType.STANDARD;

        double expectedTotal = expected.getTotal();
        double extractedTotal = extracted.getTotal();
        double difference = Money.round(Math.abs(extractedTotal - expectedTotal));
        double accuracy = accuracy(expectedTotal, extractedTotal, difference);
        boolean passed = difference < TOLERANCE;
        double confidence = extracted.getConfidence();

        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        // Per-direction components, when the baseline states them
        if (expected.getSalesTotal() != null
                && Math.abs(extracted.getSalesTotal() - expected.getSalesTotal()) > TOLERANCE) {
            issues.add(String.format(Locale.ROOT, "Sales VAT mismatch: expected €%.2f, got €%.2f",
                    expected.getSalesTotal(), extracted.getSalesTotal()));
        }
        if (expected.getPurchaseTotal() != null
                && Math.abs(extracted.getPurchaseTotal() - expected.getPurchaseTotal()) > TOLERANCE) {
            issues.add(String.format(Locale.ROOT, "Purchase VAT mismatch: expected €%.2f, got €%.2f",
                    expected.getPurchaseTotal(), extracted.getPurchaseTotal()));
        }

        // Confidence against outcome
        if (passed && confidence < 0.8) {
            warnings.add("Low confidence (" + percent(confidence) + "%) for accurate extraction");
        }
        if (!passed && confidence > 0.8) {
            issues.add("High confidence (" + percent(confidence) + "%) for inaccurate extraction");
        }
        if (confidence < 0.5) {
            warnings.add("Low confidence: " + percent(confidence) + "%");
        }

        // Accuracy bands
        if (accuracy < 95 && accuracy >= 90) {
            warnings.add(String.format(Locale.ROOT, "Moderate accuracy: %.1f%%", accuracy));
        } else if (accuracy < 90) {
            issues.add(String.format(Locale.ROOT, "Low accuracy: %.1f%%", accuracy));
        }

        // Report shape
        if (reportType == ReportType.COUNTRY_SUMMARY && extracted.getCountryBreakdown().isEmpty()) {
            warnings.add("Country summary report should have country breakdown");
        }
        if (reportType == ReportType.ORDER_DETAIL
                && extracted.hasAmounts()
                && !WooCommerceOrderTaxStrategy.NAME.equals(extracted.getMethod())) {
            warnings.add("Expected shipping/item tax extraction method for order detail report");
        }
        if (extracted.getCategory() == DocumentCategory.OTHER && extracted.hasAmounts()) {
            warnings.add("Document type not classified but VAT amounts found");
        }

        ValidationResult result = ValidationResult.builder()
                .testName(testName)
                .documentType(extracted.getCategory().name())
                .method(extracted.getMethod())
                .expectedTotal(expectedTotal)
                .extractedTotal(extractedTotal)
                .difference(difference)
                .accuracyPercentage(accuracy)
                .confidence(confidence)
                .passed(passed)
                .reportType(reportType)
                .issues(issues)
                .warnings(warnings)
                .timestamp(clock.instant())
                .build();

        log.info("Validation '{}': passed={}, accuracy={}%, difference=€{}, issues={}, warnings={}",
                testName, passed, String.format(Locale.ROOT, "%.1f", accuracy), difference, issues.size(), warnings.size());
        return result;
    }

    // ─── SUITE ─────────────────────────────────────────────────────────

    /**
     * Extracts and validates every case. A case whose extraction blows up
     * is recorded as failed; the rest of the suite still runs.
     */
    public ValidationSummary runValidationSuite(List<ValidationCase> cases) {
        log.info("Starting validation suite with {} case(s)", cases.size());

        List<ValidationResult> results = new ArrayList<>();
        for (ValidationCase testCase : cases) {
            results.add(runCase(testCase));
        }

        ValidationSummary summary = summarize(results);
        log.info("Validation suite: {}/{} passed, average accuracy {}%, overall score {}",
                summary.getPassedTests(), summary.getTotalTests(),
                String.format(Locale.ROOT, "%.1f", summary.getAverageAccuracy()),
                String.format(Locale.ROOT, "%.1f", summary.getOverallScore()));
        return summary;
    }

    private ValidationResult runCase(ValidationCase testCase) {
        ExpectedTotals expected = testCase.getExpected() != null
                ? testCase.getExpected()
                : ExpectedTotals.builder().build();
        try {
            ExtractionResult extracted = extractionEngine.extract(testCase.getText(), testCase.getCategory());
            return validate(extracted, expected, testCase.getName());
        } catch (RuntimeException e) {
            log.error("Extraction failed for validation case '{}'", testCase.getName(), e);
            double expectedTotal = expected.getTotal();
            return ValidationResult.builder()
                    .testName(testCase.getName())
                    .documentType(testCase.getCategory() != null ? testCase.getCategory().name() : "error")
                    .method("failed")
                    .expectedTotal(expectedTotal)
                    .extractedTotal(0)
                    .difference(expectedTotal)
                    .accuracyPercentage(0)
                    .confidence(0)
                    .passed(false)
                    .reportType(expected.getReportType())
                    .issue("Extraction failed: " + e.getMessage())
                    .timestamp(clock.instant())
                    .build();
        }
    }

    public ValidationSummary summarize(List<ValidationResult> results) {
        int total = results.size();
        int passed = (int) results.stream().filter(ValidationResult::isPassed).count();
        int failed = total - passed;

        double averageAccuracy = results.stream().mapToDouble(ValidationResult::getAccuracyPercentage)
                .average().orElse(0.0);
        double averageConfidence = results.stream().mapToDouble(ValidationResult::getConfidence)
                .average().orElse(0.0);
        double overallScore = (averageAccuracy + averageConfidence * 100) / 2;

        Set<String> issues = new LinkedHashSet<>();
        results.forEach(r -> issues.addAll(r.getIssues()));

        List<String> recommendations = new ArrayList<>();
        if (failed > 0) {
            recommendations.add(failed + " of " + total + " tests failed - review extraction logic");
        }
        if (total > 0 && failed * 2 > total) {
            recommendations.add("More than 50% of tests failed - review core extraction logic");
        }
        if (total > 0 && averageAccuracy < 95) {
            recommendations.add(String.format(Locale.ROOT, "Average accuracy %.1f%% is below 95%% target", averageAccuracy));
        }
        if (total > 0 && averageConfidence < 0.85) {
            recommendations.add("Average confidence " + percent(averageConfidence)
                    + "% is below 85% target - improve pattern detection");
        }

        return ValidationSummary.builder()
                .totalTests(total)
                .passedTests(passed)
                .failedTests(failed)
                .averageAccuracy(averageAccuracy)
                .averageConfidence(averageConfidence)
                .overallScore(overallScore)
                .issues(new ArrayList<>(issues))
                .recommendations(recommendations)
                .results(List.copyOf(results))
                .build();
    }

    // ─── TRAINING DATA ─────────────────────────────────────────────────

    public TrainingData generateTrainingData(List<ValidationResult> results) {
        List<ValidationResult> passed = results.stream().filter(ValidationResult::isPassed).toList();
        List<ValidationResult> failed = results.stream().filter(r -> !r.isPassed()).toList();

        List<TrainingData.PatternSample> successful = passed.stream()
                .filter(r -> r.getConfidence() > 0.8)
                .map(r -> sample(r, List.of()))
                .distinct()
                .toList();
        List<TrainingData.PatternSample> failures = failed.stream()
                .map(r -> sample(r, r.getIssues()))
                .distinct()
                .toList();

        Set<String> recommendations = new LinkedHashSet<>();
        if (failed.size() > passed.size()) {
            recommendations.add("More than 50% of tests failed - review core extraction logic");
        }
        long lowConfidence = results.stream().filter(r -> r.getConfidence() < 0.7).count();
        if (lowConfidence > results.size() * 0.3) {
            recommendations.add("More than 30% of extractions have low confidence - improve pattern detection");
        }
        if (failed.stream().anyMatch(r -> r.getReportType() == ReportType.COUNTRY_SUMMARY)) {
            recommendations.add("Country summary report extraction needs improvement");
        }
        if (failed.stream().anyMatch(r -> r.getReportType() == ReportType.ORDER_DETAIL)) {
            recommendations.add("Order detail report extraction needs improvement");
        }

        return TrainingData.builder()
                .successfulPatterns(successful)
                .failedPatterns(failures)
                .improvementRecommendations(new ArrayList<>(recommendations))
                .build();
    }

    // ─── HELPERS ───────────────────────────────────────────────────────

    static double accuracy(double expectedTotal, double extractedTotal, double difference) {
        if (expectedTotal <= 0) {
            return Math.abs(extractedTotal) < TOLERANCE ? 100.0 : 0.0;
        }
        return Math.max(0.0, Math.min(100.0, 100.0 - (difference / expectedTotal) * 100.0));
    }

    private static TrainingData.PatternSample sample(ValidationResult r, List<String> issues) {
        return TrainingData.PatternSample.builder()
                .method(r.getMethod())
                .documentType(r.getDocumentType())
                .accuracy(Math.round(r.getAccuracyPercentage() * 10) / 10.0)
                .confidence(r.getConfidence())
                .issues(List.copyOf(issues))
                .build();
    }

    private static long percent(double confidence) {
        return Math.round(confidence * 100);
    }
}
