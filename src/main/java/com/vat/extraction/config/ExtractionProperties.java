package com.vat.extraction.config;

import com.vat.extraction.entity.DocumentCategory;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "vat.extraction")
public class ExtractionProperties {

    /** Characters scanned per document; the rest is ignored. */
    private int maxTextLength = 50_000;

    private double amountsFoundConfidence = 0.85;

    private double noAmountsConfidence = 0.3;

    private Ceilings ceilings = new Ceilings();

    private Monitor monitor = new Monitor();

    /** Largest believable single VAT amount per category family. */
    public double ceilingFor(DocumentCategory category) {
        if (category.isReceipt()) return ceilings.getReceipt();
        if (category.isInvoice()) return ceilings.getInvoice();
        if (category.isReport()) return ceilings.getReport();
        return ceilings.getOther();
    }

    @Data
    public static class Monitor {
        /** Attempts older than this are dropped by the periodic sweep. */
        private Duration retention = Duration.ofHours(24);
        /** Hard cap on held attempts; the oldest go first. */
        private int maxAttempts = 10_000;
        private long cleanupIntervalMs = 600_000;
    }

    @Data
    public static class Ceilings {
        private double receipt = 10_000;
        private double invoice = 100_000;
        private double report = 1_000_000;
        private double other = 100_000;
    }
}
