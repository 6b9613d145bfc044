package com.sqconfig.core.config;

import com.sqconfig.core.cache.RemoteObjectCache;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.metrics.SyncMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PlatformFactoryTest {

    private final SqConfigProperties properties = new SqConfigProperties();
    private final PlatformFactory factory = new PlatformFactory(properties, new RemoteObjectCache(),
            new SyncMetrics(new SimpleMeterRegistry()));

    @Test
    @DisplayName("No token anywhere -> TOKEN_MISSING")
    void missingToken() {
        var e = assertThrows(SqConfigException.class, () -> factory.connect(null, null));
        assertEquals(ErrorCode.TOKEN_MISSING, e.errorCode());
        assertEquals(4, e.errorCode().exitCode());
    }

    @Test
    @DisplayName("Blank command-line token is not replaced by the configured one")
    void blankTokenRejected() {
        properties.getServer().setToken("configured");
        var e = assertThrows(SqConfigException.class, () -> factory.connect(null, "  "));
        assertEquals(ErrorCode.TOKEN_MISSING, e.errorCode());
    }

    @Test
    @DisplayName("Command-line URL wins over configuration and loses its trailing slash")
    void urlOverride() {
        properties.getServer().setToken("configured");
        var platform = factory.connect("https://sq.example.com/", null);
        assertEquals("https://sq.example.com", platform.url());
    }

    @Test
    @DisplayName("Configured URL is used by default")
    void configuredUrl() {
        properties.getServer().setUrl("https://configured.example.com");
        var platform = factory.connect(null, "tok");
        assertEquals("https://configured.example.com", platform.url());
    }

    @Test
    @DisplayName("Runner takes overrides, else the configured values")
    void runnerSettings() {
        properties.getRunner().setThreads(3);
        properties.getRunner().setTaskTimeoutSeconds(42);
        try (var configured = factory.runner(null, null); var overridden = factory.runner(5, 7)) {
            assertEquals(3, configured.threads());
            assertEquals(Duration.ofSeconds(42), configured.taskTimeout());
            assertEquals(5, overridden.threads());
            assertEquals(Duration.ofSeconds(7), overridden.taskTimeout());
        }
    }

    @Test
    @DisplayName("Writer capacity comes from the runner queue capacity")
    void writerCapacity() {
        properties.getRunner().setQueueCapacity(64);
        assertEquals(64, factory.writerCapacity());
    }
}
