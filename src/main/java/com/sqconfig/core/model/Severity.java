package com.sqconfig.core.model;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
