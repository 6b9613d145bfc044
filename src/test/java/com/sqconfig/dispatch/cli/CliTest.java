package com.sqconfig.dispatch.cli;

import com.sqconfig.core.audit.AuditService;
import com.sqconfig.core.cache.RemoteObjectCache;
import com.sqconfig.core.client.FakeApiTransport;
import com.sqconfig.core.config.PlatformFactory;
import com.sqconfig.core.config.SqConfigProperties;
import com.sqconfig.core.exchange.ConfigExporter;
import com.sqconfig.core.exchange.ConfigImporter;
import com.sqconfig.core.health.HealthCheckService;
import com.sqconfig.core.metrics.SyncMetrics;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the sqconfig CLI command structure.
 * These tests exercise picocli directly without Spring context, with a
 * fake platform behind a mocked {@link PlatformFactory}.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private final SyncMetrics metrics = new SyncMetrics(new SimpleMeterRegistry());
    private HealthCheckService healthCheckService = new HealthCheckService();

    /**
     * A factory handing out the given platform and a small real task runner.
     */
    private PlatformFactory mockFactory(FakeApiTransport transport) {
        PlatformFactory factory = mock(PlatformFactory.class);
        when(factory.connect(any(), any())).thenAnswer(inv -> transport.platform());
        when(factory.runner(any(), any())).thenAnswer(inv -> new ConcurrentTaskRunner(2, Duration.ofSeconds(5), metrics));
        when(factory.writerCapacity()).thenReturn(16);
        return factory;
    }

    private CommandLine.IFactory createFactory(PlatformFactory platformFactory) {
        var properties = new SqConfigProperties();
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService, platformFactory);
                }
                if (cls == AuditCommand.class) {
                    return (K) new AuditCommand(mock(AuditService.class), platformFactory, properties, metrics);
                }
                if (cls == ExportCommand.class) {
                    return (K) new ExportCommand(mock(ConfigExporter.class), platformFactory, metrics);
                }
                if (cls == MigrateCommand.class) {
                    return (K) new MigrateCommand(mock(ConfigExporter.class), platformFactory, metrics);
                }
                if (cls == ImportCommand.class) {
                    return (K) new ImportCommand(mock(ConfigImporter.class), platformFactory);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    /**
     * Runs the CLI capturing both streams: picocli help goes to stdout, status
     * output to stderr.
     */
    private CliResult execute(PlatformFactory platformFactory, String... args) {
        var capture = new ByteArrayOutputStream();
        var capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            var cmd = new CommandLine(new SqConfigCommand(), createFactory(platformFactory));
            int exitCode = cmd.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult execute(String... args) {
        return execute(mockFactory(FakeApiTransport.withEdition("community")), args);
    }

    @Nested
    @DisplayName("Help and usage")
    class Help {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            var result = execute("--help");
            assertEquals(0, result.exitCode());
            for (var name : new String[]{"audit", "export", "import", "migrate", "health"}) {
                assertTrue(result.output().contains(name), "help should mention " + name);
            }
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            var result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("sqconfig 0.1.0"));
        }

        @Test
        @DisplayName("No subcommand prints banner and usage")
        void noSubcommand() {
            var result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SQCONFIG"));
            assertTrue(result.output().contains("Usage: sqconfig"));
        }

        @Test
        @DisplayName("audit --help documents the filtering options")
        void auditHelp() {
            var result = execute("audit", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--severities"));
            assertTrue(result.output().contains("--with-server-id"));
        }

        @Test
        @DisplayName("import without --file is a usage error")
        void importRequiresFile() {
            var result = execute("import");
            assertEquals(CommandLine.ExitCode.USAGE, result.exitCode());
            assertTrue(result.output().contains("--file"));
        }
    }

    @Nested
    @DisplayName("Argument errors")
    class ArgumentErrors {

        @Test
        @DisplayName("Unknown --what type exits with the argument error code")
        void unknownType() {
            var result = execute("audit", "--what", "widgets");
            assertEquals(10, result.exitCode());
            assertTrue(result.output().contains("Unknown object type 'widgets'"));
        }

        @Test
        @DisplayName("Invalid --keys regexp exits with the argument error code")
        void invalidKeyRegexp() {
            var result = execute("export", "--keys", "[unclosed");
            assertEquals(10, result.exitCode());
            assertTrue(result.output().contains("Invalid --keys regexp"));
        }

        @Test
        @DisplayName("Invalid --severities value exits with the argument error code")
        void invalidSeverity() {
            var result = execute("audit", "--severities", "HIGH,EXTREME");
            assertEquals(10, result.exitCode());
            assertTrue(result.output().contains("EXTREME"));
        }

        @Test
        @DisplayName("Missing token exits with the token missing code")
        void missingToken() {
            var factory = new PlatformFactory(new SqConfigProperties(), new RemoteObjectCache(), metrics);
            var result = execute(factory, "health");
            assertEquals(4, result.exitCode());
            assertTrue(result.output().contains("No token provided"));
        }
    }

    @Nested
    @DisplayName("health")
    class Health {

        @Test
        @DisplayName("Healthy platform exits 0")
        void healthy() {
            var transport = FakeApiTransport.withEdition("enterprise")
                    .onGet("authentication/validate", Map.of("valid", true));
            var result = execute(mockFactory(transport), "health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("enterprise edition"));
            assertTrue(result.output().contains("Overall: platform reachable"));
        }

        @Test
        @DisplayName("Rejected token exits with the authentication code")
        void rejectedToken() {
            var transport = FakeApiTransport.withEdition("community")
                    .onGet("authentication/validate", Map.of("valid", false));
            var result = execute(mockFactory(transport), "health");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Token rejected"));
        }

        @Test
        @DisplayName("Unreachable server exits with the transport code")
        void unreachableServer() {
            var transport = new FakeApiTransport()
                    .onGet("authentication/validate", Map.of("valid", true))
                    .onGet("navigation/global", Map.of("version", "10.4", "edition", "community"));
            var result = execute(mockFactory(transport), "health");
            assertEquals(15, result.exitCode());
        }

        @Test
        @DisplayName("Failure outside the error taxonomy exits with the unexpected error code")
        void unexpectedFailure() {
            healthCheckService = mock(HealthCheckService.class);
            when(healthCheckService.checkAll(any())).thenThrow(new IllegalStateException("boom"));
            var result = execute("health");
            assertEquals(16, result.exitCode());
            assertTrue(result.output().contains("Unexpected error: java.lang.IllegalStateException: boom"));
        }
    }
}
