package com.sqconfig.core.model;

public enum ProblemType {
    SECURITY,
    GOVERNANCE,
    CONFIGURATION,
    PERFORMANCE,
    BAD_PRACTICE,
    OPERATIONS
}
