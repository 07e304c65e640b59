package com.vat.extraction.service;

import com.vat.extraction.config.ExtractionProperties;
import com.vat.extraction.model.ExtractionAttempt;
import com.vat.extraction.model.ExtractionResult;
import com.vat.extraction.model.MonitorStats;
import com.vat.extraction.service.strategy.Vat3ReturnBoxStrategy;
import com.vat.extraction.service.strategy.WooCommerceNetTaxStrategy;
import com.vat.extraction.service.strategy.WooCommerceOrderTaxStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory record of extraction attempts and the running statistics
 * derived from them. Safe for concurrent recording; every stats call works
 * on a snapshot of the attempts taken at call time. Attempts are held for
 * the configured retention and never beyond the configured count.
 */
@Component
@Slf4j
public class ExtractionMonitor {

    static final long SLOW_ATTEMPT_MS = 10_000;
    private static final List<String> SPECIALIZED_MARKERS = List.of("woocommerce", "icwoocommercetaxpro", "tax_report");
    private static final Set<String> LAYOUT_METHODS = Set.of(Vat3ReturnBoxStrategy.NAME,
            WooCommerceNetTaxStrategy.NAME, WooCommerceOrderTaxStrategy.NAME);

    private final Map<String, ExtractionAttempt> attempts = new ConcurrentHashMap<>();
    private final ExtractionProperties.Monitor settings;
    private final Clock clock;

    public ExtractionMonitor(ExtractionProperties properties, Clock clock) {
        this.settings = properties.getMonitor();
        this.clock = clock;
    }

    /** Builds an attempt from an extraction outcome; accuracy is filled in when the expected amount is known. */
    public ExtractionAttempt createAttempt(String fileName, ExtractionResult result, Double expectedAmount,
                                           long processingTimeMs, String businessId) {
        double extracted = result.getTotal();
        Double accuracy = null;
        if (expectedAmount != null) {
            double difference = Math.abs(extracted - expectedAmount);
            accuracy = ExtractionValidationService.accuracy(expectedAmount, extracted, difference);
        }

        ExtractionAttempt.ExtractionAttemptBuilder builder = ExtractionAttempt.builder()
                .id(UUID.randomUUID().toString())
                .fileName(fileName)
                .fileType(fileType(fileName))
                .specializedFormat(isSpecializedFormat(fileName) || LAYOUT_METHODS.contains(result.getMethod()))
                .method(result.getMethod())
                .extractedAmount(extracted)
                .expectedAmount(expectedAmount)
                .confidence(result.getConfidence())
                .accuracy(accuracy)
                .processingTimeMs(processingTimeMs)
                .success(result.hasAmounts())
                .warnings(result.getDiagnostics())
                .timestamp(clock.instant())
                .businessId(businessId);
        if (!result.hasAmounts()) {
            builder.error("No VAT amounts extracted");
        }
        return builder.build();
    }

    public void recordAttempt(ExtractionAttempt attempt) {
        ExtractionAttempt stored = attempt.getTimestamp() != null
                ? attempt
                : attempt.toBuilder().timestamp(clock.instant()).build();
        attempts.put(stored.getId(), stored);
        trimToCapacity();

        log.info("Extraction attempt {}: file={}, method={}, amount={}, confidence={}%, {}ms",
                stored.getId(), stored.getFileName(), stored.getMethod(), stored.getExtractedAmount(),
                Math.round(stored.getConfidence() * 100), stored.getProcessingTimeMs());

        if (!stored.isSuccess()) {
            log.warn("Extraction failed for {}: {}", stored.getFileName(), String.join(", ", stored.getErrors()));
        }
        if (stored.isSuccess() && stored.getConfidence() < 0.5) {
            log.warn("Low confidence for {}: {}%", stored.getFileName(), Math.round(stored.getConfidence() * 100));
        }
        if (stored.getAccuracy() != null && stored.getAccuracy() < 90) {
            log.warn("Low accuracy for {}: {}%", stored.getFileName(), String.format("%.1f", stored.getAccuracy()));
        }
    }

    public MonitorStats getStats() {
        List<ExtractionAttempt> snapshot = new ArrayList<>(attempts.values());
        int total = snapshot.size();
        if (total == 0) {
            return emptyStats();
        }

        List<ExtractionAttempt> successes = snapshot.stream().filter(ExtractionAttempt::isSuccess).toList();
        double successRate = successes.size() * 100.0 / total;
        OptionalDouble averageAccuracy = averageAccuracy(successes);
        double averageConfidence = successes.stream().mapToDouble(ExtractionAttempt::getConfidence).average().orElse(0.0);
        double averageTime = snapshot.stream().mapToLong(ExtractionAttempt::getProcessingTimeMs).average().orElse(0.0);

        List<ExtractionAttempt> specialized = snapshot.stream().filter(ExtractionAttempt::isSpecializedFormat).toList();
        List<ExtractionAttempt> specializedSuccesses = specialized.stream().filter(ExtractionAttempt::isSuccess).toList();
        MonitorStats.FormatStats formatStats = MonitorStats.FormatStats.builder()
                .attempts(specialized.size())
                .successes(specializedSuccesses.size())
                .successRate(specialized.isEmpty() ? 0.0 : specializedSuccesses.size() * 100.0 / specialized.size())
                .averageAccuracy(averageAccuracy(specializedSuccesses).orElse(0.0))
                .build();

        List<String> recommendations = new ArrayList<>();
        if (successRate < 80) {
            recommendations.add("Success rate below 80% - review error handling and file format support");
        }
        if (averageAccuracy.isPresent() && averageAccuracy.getAsDouble() < 90) {
            recommendations.add("Average accuracy below 90% - improve pattern matching and validation");
        }
        if (!successes.isEmpty() && averageConfidence < 0.8) {
            recommendations.add("Average confidence below 80% - enhance detection algorithms");
        }
        if (!specialized.isEmpty() && formatStats.getSuccessRate() < successRate) {
            recommendations.add("Specialized report extraction performing below overall average - review report handling");
        }
        long slow = snapshot.stream().filter(a -> a.getProcessingTimeMs() > SLOW_ATTEMPT_MS).count();
        if (slow > total * 0.2) {
            recommendations.add("More than 20% of extractions are slow (>10s) - optimize processing performance");
        }

        return MonitorStats.builder()
                .totalAttempts(total)
                .successfulAttempts(successes.size())
                .successRate(successRate)
                .averageAccuracy(averageAccuracy.orElse(0.0))
                .averageConfidence(averageConfidence)
                .averageProcessingTimeMs(averageTime)
                .specializedFormats(formatStats)
                .methodStats(methodStats(snapshot))
                .commonIssues(commonIssues(snapshot))
                .recommendations(recommendations)
                .build();
    }

    /** Drops attempts older than the retention window. Returns how many were removed. */
    public int cleanup(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int before = attempts.size();
        attempts.values().removeIf(a -> a.getTimestamp().isBefore(cutoff));
        int removed = before - attempts.size();
        if (removed > 0) {
            log.info("Removed {} extraction attempt(s) older than {}", removed, retention);
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${vat.extraction.monitor.cleanup-interval-ms:600000}",
               initialDelayString = "${vat.extraction.monitor.cleanup-interval-ms:600000}")
    public int evictExpired() {
        return cleanup(settings.getRetention());
    }

    /** Oldest first. */
    public List<ExtractionAttempt> export() {
        return attempts.values().stream()
                .sorted(Comparator.comparing(ExtractionAttempt::getTimestamp))
                .toList();
    }

    // ─── INTERNALS ─────────────────────────────────────────────────────

    // Concurrent recorders may overshoot briefly; each one trims back down
    private void trimToCapacity() {
        int excess = attempts.size() - settings.getMaxAttempts();
        if (excess <= 0) {
            return;
        }
        attempts.values().stream()
                .sorted(Comparator.comparing(ExtractionAttempt::getTimestamp))
                .limit(excess)
                .map(ExtractionAttempt::getId)
                .toList()
                .forEach(attempts::remove);
        log.debug("Monitor at capacity, dropped {} oldest attempt(s)", excess);
    }

    private static OptionalDouble averageAccuracy(List<ExtractionAttempt> list) {
        return list.stream()
                .map(ExtractionAttempt::getAccuracy)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
    }

    private static Map<String, MonitorStats.MethodStats> methodStats(List<ExtractionAttempt> snapshot) {
        Map<String, List<ExtractionAttempt>> byMethod = snapshot.stream()
                .collect(Collectors.groupingBy(a -> a.getMethod() != null ? a.getMethod() : ExtractionResult.METHOD_NONE,
                        TreeMap::new, Collectors.toList()));

        Map<String, MonitorStats.MethodStats> stats = new LinkedHashMap<>();
        byMethod.forEach((method, list) -> {
            List<ExtractionAttempt> ok = list.stream().filter(ExtractionAttempt::isSuccess).toList();
            stats.put(method, MonitorStats.MethodStats.builder()
                    .attempts(list.size())
                    .successes(ok.size())
                    .averageConfidence(ok.stream().mapToDouble(ExtractionAttempt::getConfidence).average().orElse(0.0))
                    .averageProcessingTimeMs(list.stream().mapToLong(ExtractionAttempt::getProcessingTimeMs).average().orElse(0.0))
                    .build());
        });
        return stats;
    }

    private static List<MonitorStats.IssueCount> commonIssues(List<ExtractionAttempt> snapshot) {
        Map<String, Integer> counts = new HashMap<>();
        Map<String, Instant> lastSeen = new HashMap<>();
        for (ExtractionAttempt attempt : snapshot) {
            for (String error : attempt.getErrors()) {
                counts.merge(error, 1, Integer::sum);
                lastSeen.merge(error, attempt.getTimestamp(), (a, b) -> a.isAfter(b) ? a : b);
            }
        }

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(10)
                .map(e -> new MonitorStats.IssueCount(e.getKey(), e.getValue(), lastSeen.get(e.getKey())))
                .toList();
    }

    static boolean isSpecializedFormat(String fileName) {
        if (fileName == null) return false;
        String lower = fileName.toLowerCase(Locale.ROOT);
        return SPECIALIZED_MARKERS.stream().anyMatch(lower::contains);
    }

    static String fileType(String fileName) {
        if (fileName == null) return "other";
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) return "pdf";
        if (lower.endsWith(".csv") || lower.endsWith(".xlsx") || lower.endsWith(".xls")) return "spreadsheet";
        if (lower.endsWith(".png") || lower.endsWith(".jpg") || lower.endsWith(".jpeg")) return "image";
        if (lower.endsWith(".txt")) return "text";
        return "other";
    }

    private static MonitorStats emptyStats() {
        return MonitorStats.builder()
                .specializedFormats(MonitorStats.FormatStats.builder().build())
                .methodStats(Map.of())
                .commonIssues(List.of())
                .recommendations(List.of())
                .build();
    }
}
