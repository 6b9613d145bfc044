package com.sqconfig.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for audit, export and import runs.
 */
@Service
public class SyncMetrics {

    private final MeterRegistry registry;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one fanned-out task.
     *
     * @param operation "audit", "export" or "import"
     * @param outcome   the task outcome status
     */
    public void recordTask(String operation, String outcome, long ms) {
        Timer.builder("sqconfig.task.duration")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRun(String operation, int total, int failed) {
        DistributionSummary.builder("sqconfig.run.size")
                .tag("operation", operation)
                .register(registry)
                .record(total);
        Counter.builder("sqconfig.run.failures")
                .tag("operation", operation)
                .register(registry)
                .increment(failed);
    }

    public void recordAuditProblem(String ruleId, String severity) {
        Counter.builder("sqconfig.audit.problems")
                .tag("rule", ruleId)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordRecordsWritten(long count) {
        Counter.builder("sqconfig.writer.records")
                .description("Records serialized by streaming writers")
                .register(registry)
                .increment(count);
    }

    public void recordImport(String objectType, String status) {
        Counter.builder("sqconfig.import.objects")
                .tag("type", objectType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
