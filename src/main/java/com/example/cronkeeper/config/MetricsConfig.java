package com.example.cronkeeper.config;

import com.example.cronkeeper.domain.enums.DoIfRunning;
import com.example.cronkeeper.domain.enums.WorkStatus;
import com.example.cronkeeper.service.DaemonRuntime;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring the daemon's works.
 * <p>
 * Exposes:
 * - Work counts by status
 * - Start and failure counters
 * - Counts of running-conflict policy applications
 */
@Configuration
@Profile("daemon")
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final DaemonRuntime daemonRuntime;

    private final Map<WorkStatus, AtomicLong> statusCounters = new EnumMap<>(WorkStatus.class);

    @PostConstruct
    public void initializeMetrics() {
        for (var status : WorkStatus.values()) {
            var counter = new AtomicLong(0);
            statusCounters.put(status, counter);

            Gauge.builder("cronkeeper_works", counter, AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of works by status")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically update gauge metrics from the work list
     */
    @Scheduled(fixedDelayString = "${cronkeeper.metrics-update-interval-ms:30000}")
    public void updateMetrics() {
        var counts = new EnumMap<WorkStatus, Long>(WorkStatus.class);
        for (var handle : daemonRuntime.works()) {
            counts.merge(handle.status(), 1L, Long::sum);
        }
        statusCounters.forEach((status, counter) -> counter.set(counts.getOrDefault(status, 0L)));
    }

    public void recordStart() {
        meterRegistry.counter("cronkeeper_work_starts").increment();
    }

    public void recordFailure(String errorType) {
        meterRegistry.counter("cronkeeper_work_failures",
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordRunningPolicy(DoIfRunning policy) {
        meterRegistry.counter("cronkeeper_running_policy",
                "policy", policy.name().toLowerCase()
        ).increment();
    }
}
