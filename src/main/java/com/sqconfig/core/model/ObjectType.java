package com.sqconfig.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of configuration objects handled by sqconfig. The section name is the
 * key used for the type in export documents and on the command line.
 */
public enum ObjectType {

    QUALITY_GATE("qualityGates", "Quality gate"),
    QUALITY_PROFILE("qualityProfiles", "Quality profile"),
    GROUP("groups", "Group"),
    USER("users", "User"),
    PROJECT("projects", "Project"),
    APPLICATION("applications", "Application"),
    PORTFOLIO("portfolios", "Portfolio");

    private final String section;
    private final String label;

    ObjectType(String section, String label) {
        this.section = section;
        this.label = label;
    }

    public String section() {
        return section;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a section name, case-insensitively ({@code projects}, {@code qualitygates}, ...).
     */
    public static Optional<ObjectType> fromSection(String name) {
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.section.toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
