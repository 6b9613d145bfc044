package com.sqconfig.core.client;

import java.util.Locale;

/**
 * Platform editions, ordered by feature set.
 */
public enum Edition {
    COMMUNITY,
    DEVELOPER,
    ENTERPRISE,
    DATACENTER;

    public static Edition fromString(String value) {
        if (value == null || value.isBlank()) {
            return COMMUNITY;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "developer" -> DEVELOPER;
            case "enterprise" -> ENTERPRISE;
            case "datacenter", "data center" -> DATACENTER;
            default -> COMMUNITY;
        };
    }

    public boolean atLeast(Edition other) {
        return compareTo(other) >= 0;
    }
}
