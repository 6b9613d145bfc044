package com.sqconfig.core.audit;

import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.ProblemType;
import com.sqconfig.core.model.Severity;

import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Selects which problems reach the audit output. Empty sets and a null pattern
 * accept everything; the rule pattern must match the whole rule id.
 */
public record AuditProblemFilter(Set<Severity> severities, Set<ProblemType> types, Pattern rulePattern)
        implements Predicate<AuditProblem> {

    public AuditProblemFilter {
        severities = severities == null ? Set.of() : Set.copyOf(severities);
        types = types == null ? Set.of() : Set.copyOf(types);
    }

    public static AuditProblemFilter acceptAll() {
        return new AuditProblemFilter(Set.of(), Set.of(), null);
    }

    @Override
    public boolean test(AuditProblem problem) {
        if (!severities.isEmpty() && !severities.contains(problem.severity())) {
            return false;
        }
        if (!types.isEmpty() && !types.contains(problem.type())) {
            return false;
        }
        return rulePattern == null || rulePattern.matcher(problem.ruleId().name()).matches();
    }
}
