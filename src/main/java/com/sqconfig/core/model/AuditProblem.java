package com.sqconfig.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One finding of an audit. Problems are immutable and aggregated by concatenation.
 */
public record AuditProblem(
        RuleId ruleId,
        Severity severity,
        ProblemType type,
        String subject,
        String message,
        String url
) {

    private static final Logger log = LoggerFactory.getLogger(AuditProblem.class);

    /**
     * Creates a problem with the rule's default severity and logs it.
     */
    public static AuditProblem of(RuleId rule, String subject, String url, Object... args) {
        return of(rule, rule.severity(), subject, url, args);
    }

    public static AuditProblem of(RuleId rule, Severity severity, String subject, String url, Object... args) {
        var problem = new AuditProblem(rule, severity, rule.type(), subject, rule.message(args), url);
        log.warn("{}", problem.message());
        return problem;
    }
}
