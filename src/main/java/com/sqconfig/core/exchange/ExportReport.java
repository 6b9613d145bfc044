package com.sqconfig.core.exchange;

import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.runner.RunSummary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param runs    one summary per exported object type
 * @param skipped types not supported by the platform's edition
 */
public record ExportReport(Map<ObjectType, RunSummary> runs, List<ObjectType> skipped) {

    public ExportReport {
        runs = Collections.unmodifiableMap(new LinkedHashMap<>(runs));
        skipped = List.copyOf(skipped);
    }

    public int exportedObjects() {
        return runs.values().stream().mapToInt(RunSummary::succeeded).sum();
    }

    public int failedObjects() {
        return runs.values().stream().mapToInt(RunSummary::failed).sum();
    }
}
