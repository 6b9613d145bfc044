package com.sqconfig.dispatch.cli;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.config.PlatformFactory;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.logging.MdcContext;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import com.sqconfig.core.writer.StreamingResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Base of the commands working against a platform: connects, provides a task
 * runner, and turns errors into the exit code of their {@link ErrorCode}.
 */
abstract class PlatformCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlatformCommand.class);

    @Mixin
    ConnectionOptions connection = new ConnectionOptions();

    protected final PlatformFactory platformFactory;

    protected PlatformCommand(PlatformFactory platformFactory) {
        this.platformFactory = platformFactory;
    }

    protected abstract String operation();

    /**
     * @return the process exit code
     */
    protected abstract int execute(Platform platform, ConcurrentTaskRunner runner);

    @Override
    public Integer call() {
        MdcContext.setOperation(operation());
        long start = System.currentTimeMillis();
        try (var runner = platformFactory.runner(connection.threads, connection.taskTimeoutSeconds)) {
            var platform = platformFactory.connect(connection.url, connection.token);
            int exitCode = execute(platform, runner);
            ConsoleOutput.info(operation() + " completed in " + ConsoleOutput.formatDuration(System.currentTimeMillis() - start));
            return exitCode;
        } catch (SqConfigException e) {
            log.debug("{} failed", operation(), e);
            ConsoleOutput.error(e.getMessage());
            return e.errorCode().exitCode();
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", operation(), e);
            ConsoleOutput.error("Unexpected error: " + e);
            return ErrorCode.UNEXPECTED.exitCode();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Ends a writer after the command failed, so the sink gets closed. The original
     * failure is the one reported.
     */
    static void finishAfterFailure(StreamingResultWriter<?> writer) {
        try {
            writer.finish();
        } catch (SqConfigException e) {
            log.warn("Output could not be completed: {}", e.getMessage());
        }
    }

    static Pattern compile(String regex, String option) {
        if (regex == null || regex.isBlank()) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new SqConfigException(ErrorCode.ARGS_ERROR, "Invalid " + option + " regexp: " + e.getDescription(), e);
        }
    }

    static <E extends Enum<E>> Set<E> parseEnums(Class<E> type, String csv, String option) {
        var result = EnumSet.noneOf(type);
        if (csv == null || csv.isBlank()) {
            return result;
        }
        for (var name : csv.split(",")) {
            if (name.isBlank()) {
                continue;
            }
            try {
                result.add(Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new SqConfigException(ErrorCode.ARGS_ERROR, "Invalid " + option + " value '" + name.trim() + "'", e);
            }
        }
        return result;
    }
}
