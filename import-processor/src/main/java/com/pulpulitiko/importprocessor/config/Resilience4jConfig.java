package com.pulpulitiko.importprocessor.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j bulkhead configuration.
 *
 * <p>One {@code SemaphoreBulkhead} per downstream service caps the number of concurrent calls
 * across all running imports. A caller that cannot get a permit within {@code max-wait-duration}
 * fails fast with {@link io.github.resilience4j.bulkhead.BulkheadFullException}; nothing is retried.
 *
 * <p>Property values are read from {@code application.yml} under the {@code resilience4j.*}
 * namespace so that they can be overridden per environment without recompilation.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    // ── SemaphoreBulkhead: reference-service ─────────────────────────────────

    @Value("${resilience4j.bulkhead.instances.referenceServiceBulkhead.max-concurrent-calls:10}")
    private int referenceServiceMaxConcurrent;

    @Value("${resilience4j.bulkhead.instances.referenceServiceBulkhead.max-wait-duration:500ms}")
    private Duration referenceServiceMaxWait;

    // ── SemaphoreBulkhead: registry-service ──────────────────────────────────

    @Value("${resilience4j.bulkhead.instances.registryServiceBulkhead.max-concurrent-calls:10}")
    private int registryServiceMaxConcurrent;

    @Value("${resilience4j.bulkhead.instances.registryServiceBulkhead.max-wait-duration:1s}")
    private Duration registryServiceMaxWait;

    // ─── Beans ───────────────────────────────────────────────────────────────

    /**
     * SemaphoreBulkhead for calls to <em>reference-service</em> (catalog load and jurisdiction lookups).
     */
    @Bean("referenceServiceBulkhead")
    public Bulkhead referenceServiceBulkhead(BulkheadRegistry registry) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(referenceServiceMaxConcurrent)
                .maxWaitDuration(referenceServiceMaxWait)
                .build();
        Bulkhead bh = registry.bulkhead("referenceServiceBulkhead", cfg);
        log.info("SemaphoreBulkhead 'referenceServiceBulkhead' created: maxConcurrent={}, maxWait={}",
                referenceServiceMaxConcurrent, referenceServiceMaxWait);
        return bh;
    }

    /**
     * SemaphoreBulkhead for calls to <em>registry-service</em> (current holder reads and writes).
     */
    @Bean("registryServiceBulkhead")
    public Bulkhead registryServiceBulkhead(BulkheadRegistry registry) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(registryServiceMaxConcurrent)
                .maxWaitDuration(registryServiceMaxWait)
                .build();
        Bulkhead bh = registry.bulkhead("registryServiceBulkhead", cfg);
        log.info("SemaphoreBulkhead 'registryServiceBulkhead' created: maxConcurrent={}, maxWait={}",
                registryServiceMaxConcurrent, registryServiceMaxWait);
        return bh;
    }

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        return BulkheadRegistry.ofDefaults();
    }
}
