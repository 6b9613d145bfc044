package com.sqconfig.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for sqconfig.
 * Routes to subcommands: audit, export, import, migrate, health.
 */
@Command(
        name = "sqconfig",
        mixinStandardHelpOptions = true,
        version = "sqconfig 0.1.0",
        description = "Audits, exports and imports the configuration of a code quality platform",
        subcommands = {
                AuditCommand.class,
                ExportCommand.class,
                ImportCommand.class,
                MigrateCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SqConfigCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.err);
    }
}
