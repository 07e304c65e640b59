package com.vat.extraction.config;

import com.vat.extraction.resilience.CircuitBreaker;
import com.vat.extraction.resilience.CircuitBreakerConfig;
import com.vat.extraction.resilience.DatabaseOperationExecutor;
import com.vat.extraction.resilience.LoggingCircuitBreakerListener;
import com.vat.extraction.resilience.RetrySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class ResilienceConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreaker databaseCircuitBreaker(ResilienceProperties properties, Clock clock) {
        ResilienceProperties.Database db = properties.getDatabase();
        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
                .failureThreshold(db.getFailureThreshold())
                .successThreshold(db.getSuccessThreshold())
                .timeout(db.getTimeout())
                .build();
        log.info("Database circuit breaker: failureThreshold={}, successThreshold={}, timeout={}",
                db.getFailureThreshold(), db.getSuccessThreshold(), db.getTimeout());
        return new CircuitBreaker("database", config, new LoggingCircuitBreakerListener(), clock);
    }

    // Attempts run here so a hung query can be abandoned at its deadline
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService databaseAttemptExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "db-attempt-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public DatabaseOperationExecutor databaseOperationExecutor(CircuitBreaker databaseCircuitBreaker,
                                                               ResilienceProperties properties,
                                                               ExecutorService databaseAttemptExecutor,
                                                               JdbcTemplate jdbcTemplate) {
        ResilienceProperties.Database db = properties.getDatabase();
        RetrySettings settings = RetrySettings.builder()
                .maxRetries(db.getMaxRetries())
                .baseBackoff(db.getBaseBackoff())
                .jitterFactor(db.getJitterFactor())
                .operationTimeout(db.getOperationTimeout())
                .build();
        return new DatabaseOperationExecutor(databaseCircuitBreaker, settings, databaseAttemptExecutor,
                () -> jdbcTemplate.queryForObject("SELECT 1", Integer.class));
    }
}
