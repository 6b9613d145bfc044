package com.sqconfig.core.exchange;

public enum ImportStatus {
    CREATED,
    UPDATED,
    SKIPPED,
    FAILED
}
