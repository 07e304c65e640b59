package com.vat.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class MonitorStats {
    int totalAttempts;
    int successfulAttempts;
    double successRate;            // percentage
    double averageAccuracy;
    double averageConfidence;
    double averageProcessingTimeMs;
    FormatStats specializedFormats;
    Map<String, MethodStats> methodStats;
    List<IssueCount> commonIssues;
    List<String> recommendations;

    @Value
    @Builder
    public static class FormatStats {
        int attempts;
        int successes;
        double successRate;
        double averageAccuracy;
    }

    @Value
    @Builder
    public static class MethodStats {
        int attempts;
        int successes;
        double averageConfidence;
        double averageProcessingTimeMs;
    }

    @Value
    public static class IssueCount {
        String issue;
        int count;
        Instant lastSeen;
    }
}
