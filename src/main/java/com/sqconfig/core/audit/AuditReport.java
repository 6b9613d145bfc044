package com.sqconfig.core.audit;

import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.runner.RunSummary;

import java.util.List;
import java.util.Map;

/**
 * Outcome of an audit run.
 *
 * @param problemsFound problems raised, before output filtering
 * @param runs          per-type fan-out summaries
 * @param skipped       types skipped because the platform does not support them
 */
public record AuditReport(long problemsFound, Map<ObjectType, RunSummary> runs, List<ObjectType> skipped) {

    public int failedObjects() {
        return runs.values().stream().mapToInt(RunSummary::failed).sum();
    }
}
