package com.vat.extraction.controller;

import com.vat.extraction.model.ExtractionAttempt;
import com.vat.extraction.model.MonitorStats;
import com.vat.extraction.resilience.CircuitBreakerStats;
import com.vat.extraction.resilience.DatabaseOperationExecutor;
import com.vat.extraction.service.ExtractionMonitor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/monitoring")
public class MonitoringController {

    private final ExtractionMonitor monitor;
    private final DatabaseOperationExecutor db;

    public MonitoringController(ExtractionMonitor monitor, DatabaseOperationExecutor db) {
        this.monitor = monitor;
        this.db = db;
    }

    @GetMapping("/extraction-stats")
    public ResponseEntity<MonitorStats> extractionStats() {
        return ResponseEntity.ok(monitor.getStats());
    }

    /** Raw attempts, oldest first. */
    @GetMapping("/extraction-attempts")
    public ResponseEntity<List<ExtractionAttempt>> extractionAttempts() {
        return ResponseEntity.ok(monitor.export());
    }

    @GetMapping("/circuit-breaker")
    public ResponseEntity<CircuitBreakerStats> circuitBreaker() {
        return ResponseEntity.ok(db.getCircuitStats());
    }

    // Closes the breaker early when the database answers again
    @PostMapping("/circuit-breaker/health-check")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        boolean healthy = db.healthCheck();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("healthy", healthy);
        body.put("circuit", db.getCircuitStats());
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
