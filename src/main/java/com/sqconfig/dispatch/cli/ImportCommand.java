package com.sqconfig.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.config.PlatformFactory;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.exchange.ConfigImporter;
import com.sqconfig.core.exchange.ImportStatus;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * CLI command: sqconfig import
 * <p>
 * Creates or updates the objects of an export document. Importing the same
 * document twice creates nothing the second time.
 */
@Command(name = "import", mixinStandardHelpOptions = true, description = "Import a configuration export")
@Component
public class ImportCommand extends PlatformCommand {

    @Option(names = {"-f", "--file"}, required = true, description = "Export document to import")
    String file;

    @Option(names = "--what", description = "Comma separated object types to import (default: all)")
    String what;

    @Option(names = "--keys", description = "Regexp selecting the keys of the objects to import")
    String keys;

    private final ConfigImporter importer;

    public ImportCommand(ConfigImporter importer, PlatformFactory platformFactory) {
        super(platformFactory);
        this.importer = importer;
    }

    @Override
    protected String operation() {
        return "import";
    }

    @Override
    protected int execute(Platform platform, ConcurrentTaskRunner runner) {
        var selection = ObjectTypeSelection.parse(what);
        var keyPattern = compile(keys, "--keys");
        var document = read(platform, file);

        var report = importer.importConfig(platform, document, selection.types(), selection.explicit(),
                keyPattern, runner);

        ConsoleOutput.separator();
        for (var failure : report.failures()) {
            ConsoleOutput.error(failure.type().label() + " '" + failure.key() + "': " + failure);
        }
        report.skippedTypes().forEach(type -> ConsoleOutput.warn(type.section() + " skipped, not supported by this platform"));
        ConsoleOutput.success(report.count(ImportStatus.CREATED) + " created, "
                + report.count(ImportStatus.UPDATED) + " updated, "
                + report.count(ImportStatus.SKIPPED) + " skipped, "
                + report.count(ImportStatus.FAILED) + " failed");
        return ErrorCode.OK.exitCode();
    }

    private static JsonNode read(Platform platform, String file) {
        try {
            return platform.mapper().readTree(Path.of(file).toFile());
        } catch (JsonProcessingException e) {
            throw new SqConfigException(ErrorCode.ARGS_ERROR, file + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SqConfigException(ErrorCode.OS_ERROR, "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }
}
