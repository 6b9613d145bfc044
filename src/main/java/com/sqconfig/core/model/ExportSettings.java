package com.sqconfig.core.model;

/**
 * Options of an export run.
 *
 * @param mode          CONFIG for a re-importable document, MIGRATION for the superset
 * @param full          include read-only fields (ids, dates, counters)
 * @param taskHistory   number of background tasks kept per project in MIGRATION mode
 */
public record ExportSettings(ExportMode mode, boolean full, int taskHistory) {

    public enum ExportMode { CONFIG, MIGRATION }

    public static ExportSettings config() {
        return new ExportSettings(ExportMode.CONFIG, false, 0);
    }

    public static ExportSettings migration(int taskHistory) {
        return new ExportSettings(ExportMode.MIGRATION, true, taskHistory);
    }

    public boolean isMigration() {
        return mode == ExportMode.MIGRATION;
    }
}
