package com.taskweaver.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for scheduling runs.
 */
@Service
public class SchedulingMetrics {

    private final MeterRegistry registry;

    public SchedulingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordScheduleDuration(long ms) {
        Timer.builder("taskweaver.schedule.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param result one of "scheduled", "cycle", "missing_start"
     */
    public void recordRunResult(String result) {
        Counter.builder("taskweaver.schedule.runs")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordDiagnostics(int count) {
        DistributionSummary.builder("taskweaver.validation.diagnostics")
                .register(registry)
                .record(count);
    }

    public void recordCriticalPathLength(int length) {
        DistributionSummary.builder("taskweaver.critical_path.length")
                .register(registry)
                .record(length);
    }
}
