package com.sqconfig.dispatch.cli;

import com.sqconfig.core.config.PlatformFactory;
import com.sqconfig.core.exchange.ConfigExporter;
import com.sqconfig.core.metrics.SyncMetrics;
import com.sqconfig.core.model.ExportSettings;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: sqconfig export
 * <p>
 * Writes the configuration of the selected object types as one JSON document,
 * re-importable with {@code sqconfig import}.
 */
@Command(name = "export", mixinStandardHelpOptions = true, description = "Export the platform configuration as JSON")
@Component
public class ExportCommand extends DocumentExportCommand {

    @Option(names = "--full", description = "Also export read-only data (dates, counters)")
    boolean full;

    public ExportCommand(ConfigExporter exporter, PlatformFactory platformFactory, SyncMetrics metrics) {
        super(exporter, platformFactory, metrics);
    }

    @Override
    protected String operation() {
        return "export";
    }

    @Override
    protected ExportSettings settings() {
        return full ? new ExportSettings(ExportSettings.ExportMode.CONFIG, true, 0) : ExportSettings.config();
    }
}
