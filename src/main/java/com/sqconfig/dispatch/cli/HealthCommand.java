package com.sqconfig.dispatch.cli;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.config.PlatformFactory;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.health.HealthCheckService;
import com.sqconfig.core.health.HealthStatus;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: sqconfig health
 * <p>
 * Checks that the platform is reachable and the token valid, and displays the
 * platform's version and edition.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check platform connectivity")
@Component
public class HealthCommand extends PlatformCommand {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService, PlatformFactory platformFactory) {
        super(platformFactory);
        this.healthCheckService = healthCheckService;
    }

    @Override
    protected String operation() {
        return "health";
    }

    @Override
    protected int execute(Platform platform, ConcurrentTaskRunner runner) {
        ConsoleOutput.printBanner();

        var exitCode = ErrorCode.OK;
        for (var check : healthCheckService.checkAll(platform)) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    if (exitCode == ErrorCode.OK) {
                        exitCode = failureCode(check);
                    }
                }
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        ConsoleOutput.separator();
        if (exitCode == ErrorCode.OK) {
            ConsoleOutput.success("Overall: platform reachable and token valid");
        } else {
            ConsoleOutput.error("Overall: platform unreachable or token rejected");
        }
        return exitCode.exitCode();
    }

    private static ErrorCode failureCode(HealthStatus check) {
        return "authentication".equals(check.component()) ? ErrorCode.AUTHENTICATION : ErrorCode.TRANSPORT;
    }
}
