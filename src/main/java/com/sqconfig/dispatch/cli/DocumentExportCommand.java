package com.sqconfig.dispatch.cli;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.config.PlatformFactory;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.exchange.ConfigExporter;
import com.sqconfig.core.exchange.ExportReport;
import com.sqconfig.core.metrics.SyncMetrics;
import com.sqconfig.core.model.ExportSettings;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import com.sqconfig.core.writer.SectionEntry;
import com.sqconfig.core.writer.SectionedJsonRecordFormat;
import com.sqconfig.core.writer.StreamingResultWriter;
import picocli.CommandLine.Option;

/**
 * Streams the selected object types into one JSON document keyed by type.
 */
abstract class DocumentExportCommand extends PlatformCommand {

    @Option(names = "--what", description = "Comma separated object types to export (default: all)")
    String what;

    @Option(names = "--keys", description = "Regexp selecting the keys of the objects to export")
    String keys;

    @Option(names = {"-f", "--file"}, description = "Output file (default: stdout)")
    String file;

    private final ConfigExporter exporter;
    private final SyncMetrics metrics;

    protected DocumentExportCommand(ConfigExporter exporter, PlatformFactory platformFactory, SyncMetrics metrics) {
        super(platformFactory);
        this.exporter = exporter;
        this.metrics = metrics;
    }

    protected abstract ExportSettings settings();

    @Override
    protected int execute(Platform platform, ConcurrentTaskRunner runner) {
        var selection = ObjectTypeSelection.parse(what);
        var keyPattern = compile(keys, "--keys");

        var writer = new StreamingResultWriter<SectionEntry>(new SectionedJsonRecordFormat(platform.mapper()),
                e -> true, platformFactory.writerCapacity());
        writer.start(OutputTarget.open(file), operation());
        ExportReport report;
        try {
            report = exporter.export(platform, selection.types(), selection.explicit(), settings(),
                    keyPattern, runner, writer);
        } catch (RuntimeException e) {
            finishAfterFailure(writer);
            throw e;
        }
        metrics.recordRecordsWritten(writer.finish());

        ConsoleOutput.separator();
        report.runs().forEach((type, run) -> ConsoleOutput.runSummary(type.section(), run));
        report.skipped().forEach(type -> ConsoleOutput.warn(type.section() + " skipped, not supported by this platform"));
        ConsoleOutput.success(report.exportedObjects() + " objects exported"
                + (file == null ? "" : " to " + file));
        if (report.failedObjects() > 0) {
            ConsoleOutput.error(report.failedObjects() + " objects could not be exported, see log");
        }
        return ErrorCode.OK.exitCode();
    }
}
