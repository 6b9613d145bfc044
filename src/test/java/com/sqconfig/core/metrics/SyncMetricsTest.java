package com.sqconfig.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyncMetricsTest {

    private SimpleMeterRegistry registry;
    private SyncMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SyncMetrics(registry);
    }

    @Test
    @DisplayName("recordTask creates a timer tagged by operation and outcome")
    void recordTask() {
        metrics.recordTask("export", "SUCCESS", 120);
        metrics.recordTask("export", "SUCCESS", 80);
        metrics.recordTask("export", "TIMEOUT", 5000);

        var success = registry.find("sqconfig.task.duration")
                .tag("operation", "export").tag("outcome", "SUCCESS").timer();
        var timeout = registry.find("sqconfig.task.duration")
                .tag("outcome", "TIMEOUT").timer();
        assertNotNull(success);
        assertNotNull(timeout);
        assertEquals(2, success.count());
        assertEquals(1, timeout.count());
    }

    @Test
    @DisplayName("recordRun records the run size and its failures")
    void recordRun() {
        metrics.recordRun("audit", 10, 2);
        metrics.recordRun("audit", 4, 0);

        var size = registry.find("sqconfig.run.size").tag("operation", "audit").summary();
        var failures = registry.find("sqconfig.run.failures").tag("operation", "audit").counter();
        assertNotNull(size);
        assertEquals(2, size.count());
        assertEquals(14.0, size.totalAmount());
        assertEquals(2.0, failures.count());
    }

    @Test
    @DisplayName("recordAuditProblem counts problems per rule")
    void recordAuditProblem() {
        metrics.recordAuditProblem("QG_NO_CONDITIONS", "HIGH");
        metrics.recordAuditProblem("QG_NO_CONDITIONS", "HIGH");
        metrics.recordAuditProblem("GROUP_EMPTY", "LOW");

        assertEquals(2.0, registry.find("sqconfig.audit.problems")
                .tag("rule", "QG_NO_CONDITIONS").counter().count());
        assertEquals(1.0, registry.find("sqconfig.audit.problems")
                .tag("severity", "LOW").counter().count());
    }

    @Test
    @DisplayName("recordRecordsWritten accumulates")
    void recordRecordsWritten() {
        metrics.recordRecordsWritten(100);
        metrics.recordRecordsWritten(25);
        assertEquals(125.0, registry.find("sqconfig.writer.records").counter().count());
    }

    @Test
    @DisplayName("recordImport counts objects by type and status")
    void recordImport() {
        metrics.recordImport("groups", "CREATED");
        metrics.recordImport("groups", "UPDATED");
        metrics.recordImport("groups", "CREATED");

        assertEquals(2.0, registry.find("sqconfig.import.objects")
                .tag("type", "groups").tag("status", "CREATED").counter().count());
        assertEquals(1.0, registry.find("sqconfig.import.objects")
                .tag("status", "UPDATED").counter().count());
    }
}
