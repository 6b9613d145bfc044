package com.sqconfig.core.audit;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ObjectNotFoundException;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.QualityProfile;
import com.sqconfig.core.model.RuleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Quality profile rules. Built-in profiles are not audited individually.
 */
@Component
public class QualityProfileAuditor implements ObjectAuditor<QualityProfile> {

    private static final Logger log = LoggerFactory.getLogger(QualityProfileAuditor.class);

    static final String MAX_CHANGE_AGE = "audit.qualityProfiles.maxLastChangeAge";
    static final String MAX_UNUSED_AGE = "audit.qualityProfiles.maxUnusedAge";
    static final String MAX_PER_LANGUAGE = "audit.qualityProfiles.maxPerLanguage";

    private final Clock clock;

    public QualityProfileAuditor() {
        this(Clock.systemUTC());
    }

    QualityProfileAuditor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ObjectType type() {
        return ObjectType.QUALITY_PROFILE;
    }

    @Override
    public List<QualityProfile> list(Platform platform) {
        return QualityProfile.search(platform);
    }

    @Override
    public List<AuditProblem> audit(QualityProfile profile, AuditSettings settings) {
        if (profile.isBuiltIn()) {
            return List.of();
        }
        var problems = new ArrayList<AuditProblem>();
        var subject = profile.toString();

        int maxChangeAge = settings.getInt(MAX_CHANGE_AGE, 180);
        profile.lastUpdated().ifPresent(updated -> {
            long age = daysSince(updated);
            if (age > maxChangeAge) {
                problems.add(AuditProblem.of(RuleId.QP_LAST_CHANGE_DATE, subject, profile.url(), subject, age));
            }
        });

        if (!profile.isDefault() && profile.projectCount() == 0) {
            problems.add(AuditProblem.of(RuleId.QP_NOT_USED, subject, profile.url(), subject));
        } else {
            int maxUnusedAge = settings.getInt(MAX_UNUSED_AGE, 60);
            profile.lastUsed().ifPresent(used -> {
                long age = daysSince(used);
                if (age > maxUnusedAge) {
                    problems.add(AuditProblem.of(RuleId.QP_LAST_USED_DATE, subject, profile.url(), subject, age));
                }
            });
        }

        int deprecated = profile.deprecatedRuleCount();
        int inherited = builtInAncestor(profile).map(QualityProfile::deprecatedRuleCount).orElse(0);
        if (deprecated > inherited) {
            problems.add(AuditProblem.of(RuleId.QP_USE_DEPRECATED_RULES, subject, profile.url(),
                    subject, deprecated, inherited));
        }
        return problems;
    }

    @Override
    public List<AuditProblem> auditAll(List<QualityProfile> profiles, AuditSettings settings) {
        int max = settings.getInt(MAX_PER_LANGUAGE, 5);
        var byLanguage = profiles.stream()
                .collect(Collectors.groupingBy(QualityProfile::language, TreeMap::new, Collectors.counting()));
        var problems = new ArrayList<AuditProblem>();
        byLanguage.forEach((language, count) -> {
            if (count > max) {
                var url = profiles.get(0).platform().link("/profiles?language=" + language);
                problems.add(AuditProblem.of(RuleId.QP_TOO_MANY_QP, "Language " + language, url, language, count, max));
            }
        });
        return problems;
    }

    private Optional<QualityProfile> builtInAncestor(QualityProfile profile) {
        var current = profile;
        var visited = new HashSet<String>();
        while (current.parentName().isPresent() && visited.add(current.name())) {
            try {
                current = QualityProfile.get(profile.platform(), profile.language(), current.parentName().get());
            } catch (ObjectNotFoundException e) {
                log.warn("Parent of {} not found: {}", current, e.getMessage());
                return Optional.empty();
            }
            if (current.isBuiltIn()) {
                return Optional.of(current);
            }
        }
        return Optional.empty();
    }

    private long daysSince(OffsetDateTime date) {
        return Duration.between(date.toInstant(), clock.instant()).toDays();
    }
}
