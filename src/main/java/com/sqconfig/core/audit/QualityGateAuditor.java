package com.sqconfig.core.audit;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.QualityGate;
import com.sqconfig.core.model.QualityGateCondition;
import com.sqconfig.core.model.RuleId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Quality gate rules. Built-in gates are not audited.
 */
@Component
public class QualityGateAuditor implements ObjectAuditor<QualityGate> {

    static final String MAX_CONDITIONS = "audit.qualitygates.maxConditions";
    static final String MAX_GATES = "audit.qualitygates.maxNumber";

    record Range(double min, double max, String advice) {
        boolean contains(double value) {
            return value >= min && value <= max;
        }
    }

    /**
     * Metrics recommended in a gate and the acceptable range of their error threshold.
     */
    static final Map<String, Range> RECOMMENDED = Map.ofEntries(
            Map.entry("new_reliability_rating", new Range(1, 1, "any new bug should fail the gate")),
            Map.entry("new_security_rating", new Range(1, 1, "any new vulnerability should fail the gate")),
            Map.entry("new_maintainability_rating", new Range(1, 1, "new code should be rated A")),
            Map.entry("reliability_rating", new Range(4, 4, "only a D rating or worse should fail on overall code")),
            Map.entry("security_rating", new Range(4, 4, "only a D rating or worse should fail on overall code")),
            Map.entry("new_coverage", new Range(20, 90, "below 20% is too low a bar, above 90% is overkill")),
            Map.entry("new_duplicated_lines_density", new Range(1, 5, "expected between 1% and 5%")),
            Map.entry("new_security_hotspots_reviewed", new Range(100, 100, "all new hotspots should be reviewed")),
            Map.entry("new_bugs", new Range(0, 0, "no new bug should be tolerated")),
            Map.entry("new_vulnerabilities", new Range(0, 0, "no new vulnerability should be tolerated")),
            Map.entry("new_security_hotspots", new Range(0, 0, "no new hotspot should be tolerated")),
            Map.entry("new_blocker_violations", new Range(0, 0, "no new blocker issue should be tolerated")),
            Map.entry("new_critical_violations", new Range(0, 0, "no new critical issue should be tolerated")),
            Map.entry("new_major_violations", new Range(0, 0, "no new major issue should be tolerated"))
    );

    @Override
    public ObjectType type() {
        return ObjectType.QUALITY_GATE;
    }

    @Override
    public List<QualityGate> list(Platform platform) {
        return new ArrayList<>(QualityGate.search(platform).values());
    }

    @Override
    public List<AuditProblem> audit(QualityGate gate, AuditSettings settings) {
        if (gate.isBuiltIn()) {
            return List.of();
        }
        var problems = new ArrayList<AuditProblem>();
        var subject = gate.toString();
        var conditions = gate.conditions();
        int maxConditions = settings.getInt(MAX_CONDITIONS, 8);

        if (conditions.isEmpty()) {
            problems.add(AuditProblem.of(RuleId.QG_NO_COND, subject, gate.url(), subject));
        } else if (conditions.size() > maxConditions) {
            problems.add(AuditProblem.of(RuleId.QG_TOO_MANY_COND, subject, gate.url(),
                    subject, conditions.size(), maxConditions));
        }
        for (QualityGateCondition condition : conditions) {
            var range = RECOMMENDED.get(condition.metric());
            if (range == null) {
                problems.add(AuditProblem.of(RuleId.QG_WRONG_METRIC, subject, gate.url(), subject, condition.metric()));
            } else if (!range.contains(condition.threshold())) {
                problems.add(AuditProblem.of(RuleId.QG_WRONG_THRESHOLD, subject, gate.url(),
                        subject, condition.metric(), condition.error(), range.advice()));
            }
        }
        if (!gate.isDefault() && gate.projectCount() == 0) {
            problems.add(AuditProblem.of(RuleId.QG_NOT_USED, subject, gate.url(), subject));
        }
        return problems;
    }

    @Override
    public List<AuditProblem> auditAll(List<QualityGate> gates, AuditSettings settings) {
        int maxGates = settings.getInt(MAX_GATES, 5);
        var custom = gates.stream().filter(g -> !g.isBuiltIn()).toList();
        if (custom.size() <= maxGates) {
            return List.of();
        }
        var url = custom.get(0).platform().link("/quality_gates");
        return List.of(AuditProblem.of(RuleId.QG_TOO_MANY_GATES, "Quality gates", url, custom.size(), maxGates));
    }
}
