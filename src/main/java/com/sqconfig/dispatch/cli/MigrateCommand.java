package com.sqconfig.dispatch.cli;

import com.sqconfig.core.config.PlatformFactory;
import com.sqconfig.core.exchange.ConfigExporter;
import com.sqconfig.core.metrics.SyncMetrics;
import com.sqconfig.core.model.ExportSettings;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: sqconfig migrate
 * <p>
 * Export with everything a migration needs on top of the configuration: read-only
 * data, recent background tasks and the scanner context of the last analysis.
 * The resulting document is not importable.
 */
@Command(name = "migrate", mixinStandardHelpOptions = true,
        description = "Export the platform configuration and analysis history for a migration")
@Component
public class MigrateCommand extends DocumentExportCommand {

    @Option(names = "--task-history", defaultValue = "10",
            description = "Number of background tasks kept per project (default: ${DEFAULT-VALUE})")
    int taskHistory;

    public MigrateCommand(ConfigExporter exporter, PlatformFactory platformFactory, SyncMetrics metrics) {
        super(exporter, platformFactory, metrics);
    }

    @Override
    protected String operation() {
        return "migrate";
    }

    @Override
    protected ExportSettings settings() {
        return ExportSettings.migration(taskHistory);
    }
}
