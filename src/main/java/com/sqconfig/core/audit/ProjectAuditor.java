package com.sqconfig.core.audit;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.Permissions;
import com.sqconfig.core.model.Project;
import com.sqconfig.core.model.RuleId;
import com.sqconfig.core.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Project rules: analysis freshness, visibility, size, administration and
 * likely duplicates.
 */
@Component
public class ProjectAuditor implements ObjectAuditor<Project> {

    static final String MAX_ANALYSIS_AGE = "audit.projects.maxLastAnalysisAge";
    static final String CHECK_VISIBILITY = "audit.projects.visibility";
    static final String CHECK_DUPLICATES = "audit.projects.duplicates";

    private static final int VERY_OLD_DAYS = 365;
    private static final String SEPARATORS = "-_:.";

    private final Clock clock;

    public ProjectAuditor() {
        this(Clock.systemUTC());
    }

    ProjectAuditor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ObjectType type() {
        return ObjectType.PROJECT;
    }

    @Override
    public List<Project> list(Platform platform) {
        return new ArrayList<>(Project.search(platform).values());
    }

    @Override
    public List<AuditProblem> audit(Project project, AuditSettings settings) {
        var problems = new ArrayList<AuditProblem>();
        var subject = project.toString();
        var lastAnalysis = project.lastAnalysis();

        if (lastAnalysis.isEmpty()) {
            problems.add(AuditProblem.of(RuleId.PROJ_NOT_ANALYZED, subject, project.url(), subject));
        } else {
            long age = Duration.between(lastAnalysis.get().toInstant(), clock.instant()).toDays();
            if (age > settings.getInt(MAX_ANALYSIS_AGE, 180)) {
                var severity = age > VERY_OLD_DAYS ? Severity.HIGH : Severity.MEDIUM;
                problems.add(AuditProblem.of(RuleId.PROJ_LAST_ANALYSIS, severity, subject, project.url(), subject, age));
            }
            if (project.ncloc() == 0) {
                problems.add(AuditProblem.of(RuleId.PROJ_ZERO_LOC, subject, project.url(), subject));
            }
        }
        if (settings.getBoolean(CHECK_VISIBILITY, true) && "public".equals(project.visibility())) {
            problems.add(AuditProblem.of(RuleId.PROJ_VISIBILITY, subject, project.url(), subject));
        }
        if (!Permissions.hasAdmin(project.permissions())) {
            problems.add(AuditProblem.of(RuleId.OBJECT_WITH_NO_ADMIN_PERMISSION, subject, project.url(), subject));
        }
        return problems;
    }

    /**
     * Flags a project whose key is another project's key extended by a separator
     * and a prefix or suffix, such as {@code acme} and {@code acme-copy}.
     */
    @Override
    public List<AuditProblem> auditAll(List<Project> projects, AuditSettings settings) {
        if (!settings.getBoolean(CHECK_DUPLICATES, true)) {
            return List.of();
        }
        var byKey = projects.stream().collect(Collectors.toMap(Project::key, Function.identity(), (a, b) -> a));
        var problems = new ArrayList<AuditProblem>();
        for (var pair : extendedKeys(byKey.keySet().stream().sorted().toList(), false)) {
            var duplicate = byKey.get(pair[1]);
            problems.add(AuditProblem.of(RuleId.PROJ_DUPLICATE, duplicate.toString(), duplicate.url(),
                    duplicate.toString(), byKey.get(pair[0]).toString()));
        }
        var reversed = byKey.keySet().stream().map(ProjectAuditor::reverse).sorted().toList();
        for (var pair : extendedKeys(reversed, true)) {
            var duplicate = byKey.get(pair[1]);
            problems.add(AuditProblem.of(RuleId.PROJ_DUPLICATE, duplicate.toString(), duplicate.url(),
                    duplicate.toString(), byKey.get(pair[0]).toString()));
        }
        return problems;
    }

    /**
     * Pairs (base, extended) where extended starts with base followed by a
     * separator. Runs over sorted keys, so all extensions of a base follow it.
     */
    static List<String[]> extendedKeys(List<String> sortedKeys, boolean reversedKeys) {
        var pairs = new ArrayList<String[]>();
        for (int i = 0; i < sortedKeys.size(); i++) {
            var base = sortedKeys.get(i);
            for (int j = i + 1; j < sortedKeys.size() && sortedKeys.get(j).startsWith(base); j++) {
                var candidate = sortedKeys.get(j);
                if (candidate.length() > base.length() && SEPARATORS.indexOf(candidate.charAt(base.length())) >= 0) {
                    pairs.add(reversedKeys
                            ? new String[]{reverse(base), reverse(candidate)}
                            : new String[]{base, candidate});
                }
            }
        }
        pairs.sort(Comparator.comparing((String[] p) -> p[1]));
        return pairs;
    }

    private static String reverse(String s) {
        return new StringBuilder(s).reverse().toString();
    }
}
