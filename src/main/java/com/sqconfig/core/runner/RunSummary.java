package com.sqconfig.core.runner;

import java.util.Map;

/**
 * Aggregate result of a batch: total items, successes and failures by category.
 */
public record RunSummary(String operation, int total, int succeeded, Map<OutcomeStatus, Integer> failures) {

    public RunSummary {
        failures = Map.copyOf(failures);
    }

    public int failed() {
        return failures.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int failed(OutcomeStatus status) {
        return failures.getOrDefault(status, 0);
    }

    @Override
    public String toString() {
        return "%s: %d items, %d succeeded, %d failed %s".formatted(operation, total, succeeded, failed(), failures);
    }
}
