package com.vat.extraction.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "vat.resilience")
public class ResilienceProperties {

    private Database database = new Database();

    @Data
    public static class Database {
        private int failureThreshold = 5;
        private int successThreshold = 1;
        private Duration timeout = Duration.ofSeconds(5);
        private int maxRetries = 2;
        private Duration baseBackoff = Duration.ofSeconds(2);
        private double jitterFactor = 0.5;
        private Duration operationTimeout = Duration.ofSeconds(10);
    }
}
