package com.sqconfig.dispatch.cli;

import com.sqconfig.core.audit.AuditProblemFilter;
import com.sqconfig.core.audit.AuditProblemFormats;
import com.sqconfig.core.audit.AuditReport;
import com.sqconfig.core.audit.AuditService;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.config.PlatformFactory;
import com.sqconfig.core.config.SqConfigProperties;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.metrics.SyncMetrics;
import com.sqconfig.core.model.AuditProblem;
import com.sqconfig.core.model.AuditSettings;
import com.sqconfig.core.model.ProblemType;
import com.sqconfig.core.model.Severity;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import com.sqconfig.core.writer.StreamingResultWriter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI command: sqconfig audit
 * <p>
 * Audits the selected object types and writes the problems found as CSV or JSON,
 * to a file or stdout, while the audit is still running.
 */
@Command(name = "audit", mixinStandardHelpOptions = true, description = "Audit the platform configuration")
@Component
public class AuditCommand extends PlatformCommand {

    enum Format { csv, json }

    @Option(names = "--what", description = "Comma separated object types to audit (default: all)")
    String what;

    @Option(names = "--keys", description = "Regexp selecting the keys of the objects to audit")
    String keys;

    @Option(names = {"-f", "--file"}, description = "Output file (default: stdout)")
    String file;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: from the file extension, else csv)")
    Format format;

    @Option(names = "--csv-separator", defaultValue = ",", description = "CSV field separator (default: ${DEFAULT-VALUE})")
    char csvSeparator;

    @Option(names = "--with-url", description = "Add the link to each problem's object")
    boolean withUrl;

    @Option(names = "--with-server-id", description = "Add the platform's server id to each problem")
    boolean withServerId;

    @Option(names = "--severities", description = "Comma separated severities to report")
    String severities;

    @Option(names = "--types", description = "Comma separated problem types to report")
    String types;

    @Option(names = "--problems", description = "Regexp selecting the problem ids to report")
    String problems;

    @Option(names = "--setting", description = "Audit setting override, key=value")
    Map<String, String> settingOverrides = new LinkedHashMap<>();

    private final AuditService auditService;
    private final SqConfigProperties properties;
    private final SyncMetrics metrics;

    public AuditCommand(AuditService auditService, PlatformFactory platformFactory,
                        SqConfigProperties properties, SyncMetrics metrics) {
        super(platformFactory);
        this.auditService = auditService;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    protected String operation() {
        return "audit";
    }

    @Override
    protected int execute(Platform platform, ConcurrentTaskRunner runner) {
        var selection = ObjectTypeSelection.parse(what);
        var keyPattern = compile(keys, "--keys");
        var settings = AuditSettings.defaults()
                .withOverrides(properties.getAudit().getSettings())
                .withOverrides(settingOverrides);
        var filter = new AuditProblemFilter(parseEnums(Severity.class, severities, "--severities"),
                parseEnums(ProblemType.class, types, "--types"), compile(problems, "--problems"));

        boolean json = format != null ? format == Format.json : OutputTarget.isJson(file);
        var serverId = withServerId ? platform.serverId() : null;
        var recordFormat = json
                ? AuditProblemFormats.json(platform.mapper(), withUrl, serverId)
                : AuditProblemFormats.csv(csvSeparator, withUrl, serverId);

        var writer = new StreamingResultWriter<AuditProblem>(recordFormat, filter, platformFactory.writerCapacity());
        writer.start(OutputTarget.open(file), operation());
        AuditReport report;
        try {
            report = auditService.audit(platform, selection.types(), selection.explicit(), settings,
                    keyPattern, runner, writer);
        } catch (RuntimeException e) {
            finishAfterFailure(writer);
            throw e;
        }
        long written = writer.finish();
        metrics.recordRecordsWritten(written);

        ConsoleOutput.separator();
        report.runs().forEach((type, run) -> ConsoleOutput.runSummary(type.section(), run));
        report.skipped().forEach(type -> ConsoleOutput.warn(type.section() + " skipped, not supported by this platform"));
        ConsoleOutput.success(report.problemsFound() + " problems found, " + written + " reported");
        if (report.failedObjects() > 0) {
            ConsoleOutput.error(report.failedObjects() + " objects could not be audited, see log");
        }
        return ErrorCode.OK.exitCode();
    }
}
