package com.sqconfig.core.model;

/**
 * Catalogue of audit rules. Each rule has a stable numeric id, a default type and
 * severity, and a {@link String#format} message template.
 */
public enum RuleId {

    PROJ_LAST_ANALYSIS(1000, ProblemType.OPERATIONS, Severity.MEDIUM,
            "%s last analysis is %d days old, it may be deletable"),
    PROJ_NOT_ANALYZED(1001, ProblemType.OPERATIONS, Severity.LOW,
            "%s has never been analyzed"),
    PROJ_VISIBILITY(1002, ProblemType.SECURITY, Severity.HIGH,
            "%s visibility is public, it should be private"),
    PROJ_DUPLICATE(1003, ProblemType.OPERATIONS, Severity.MEDIUM,
            "%s may be a duplicate of %s"),
    PROJ_ZERO_LOC(1004, ProblemType.OPERATIONS, Severity.HIGH,
            "%s has been analyzed but has 0 lines of code"),
    OBJECT_WITH_NO_ADMIN_PERMISSION(1005, ProblemType.GOVERNANCE, Severity.HIGH,
            "%s has no user or group with administer permission"),

    QG_NO_COND(2000, ProblemType.BAD_PRACTICE, Severity.HIGH,
            "%s has no conditions"),
    QG_TOO_MANY_COND(2001, ProblemType.BAD_PRACTICE, Severity.HIGH,
            "%s has %d conditions, more than the recommended %d"),
    QG_NOT_USED(2002, ProblemType.OPERATIONS, Severity.MEDIUM,
            "%s is not used by any project"),
    QG_TOO_MANY_GATES(2003, ProblemType.BAD_PRACTICE, Severity.MEDIUM,
            "There are %d quality gates, more than the recommended %d"),
    QG_WRONG_METRIC(2004, ProblemType.BAD_PRACTICE, Severity.MEDIUM,
            "%s has a condition on metric '%s' which is not recommended"),
    QG_WRONG_THRESHOLD(2005, ProblemType.BAD_PRACTICE, Severity.HIGH,
            "%s condition on metric '%s' has threshold %s, %s"),

    QP_TOO_MANY_QP(3000, ProblemType.BAD_PRACTICE, Severity.MEDIUM,
            "Language %s has %d quality profiles, more than the recommended %d"),
    QP_LAST_CHANGE_DATE(3001, ProblemType.GOVERNANCE, Severity.MEDIUM,
            "%s has not been updated since %d days"),
    QP_NOT_USED(3002, ProblemType.OPERATIONS, Severity.MEDIUM,
            "%s is not used by any project"),
    QP_LAST_USED_DATE(3003, ProblemType.OPERATIONS, Severity.MEDIUM,
            "%s has not been used since %d days"),
    QP_USE_DEPRECATED_RULES(3004, ProblemType.BAD_PRACTICE, Severity.MEDIUM,
            "%s has %d deprecated rules activated, more than its built-in ancestor (%d)"),

    PORTFOLIO_EMPTY(5000, ProblemType.OPERATIONS, Severity.LOW,
            "%s is empty"),
    PORTFOLIO_SINGLETON(5001, ProblemType.OPERATIONS, Severity.LOW,
            "%s has a single project"),
    APPLICATION_EMPTY(5100, ProblemType.OPERATIONS, Severity.LOW,
            "%s has no projects"),
    APPLICATION_SINGLETON(5101, ProblemType.OPERATIONS, Severity.LOW,
            "%s has a single project"),

    USER_UNUSED(6000, ProblemType.SECURITY, Severity.MEDIUM,
            "%s has not logged in since %d days"),
    GROUP_EMPTY(6100, ProblemType.OPERATIONS, Severity.LOW,
            "%s has no members");

    private final int id;
    private final ProblemType type;
    private final Severity severity;
    private final String template;

    RuleId(int id, ProblemType type, Severity severity, String template) {
        this.id = id;
        this.type = type;
        this.severity = severity;
        this.template = template;
    }

    public int id() { return id; }
    public ProblemType type() { return type; }
    public Severity severity() { return severity; }

    public String message(Object... args) {
        return template.formatted(args);
    }
}
