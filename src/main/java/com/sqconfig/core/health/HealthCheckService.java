package com.sqconfig.core.health;

import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.SqConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Connectivity checks against a platform: server status, token validity and
 * identification of the version and edition.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    public List<HealthStatus> checkAll(Platform platform) {
        var results = new ArrayList<HealthStatus>();
        results.add(checkServer(platform));
        results.add(checkAuthentication(platform));
        results.add(checkIdentity(platform));
        return results;
    }

    private HealthStatus checkServer(Platform platform) {
        try {
            var json = platform.get("system/status");
            var status = json.path("status").asText("UNKNOWN");
            var metadata = Map.of("status", status, "id", json.path("id").asText(""));
            if ("UP".equals(status)) {
                return new HealthStatus("server", HealthStatus.Status.UP,
                        platform.url() + " is up", metadata);
            }
            return new HealthStatus("server", HealthStatus.Status.DEGRADED,
                    platform.url() + " status is " + status, metadata);
        } catch (SqConfigException e) {
            log.warn("Server health check failed: {}", e.getMessage());
            return new HealthStatus("server", HealthStatus.Status.DOWN,
                    "Server unreachable: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkAuthentication(Platform platform) {
        try {
            if (platform.get("authentication/validate").path("valid").asBoolean(false)) {
                return new HealthStatus("authentication", HealthStatus.Status.UP,
                        "Token accepted", Map.of());
            }
            return new HealthStatus("authentication", HealthStatus.Status.DOWN,
                    "Token rejected", Map.of());
        } catch (SqConfigException e) {
            log.warn("Authentication health check failed: {}", e.getMessage());
            return new HealthStatus("authentication", HealthStatus.Status.DOWN,
                    "Authentication error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkIdentity(Platform platform) {
        try {
            var version = platform.version();
            var edition = platform.edition();
            return new HealthStatus("platform", HealthStatus.Status.UP,
                    "Version " + version + ", " + edition.name().toLowerCase() + " edition",
                    Map.of("version", version, "edition", edition.name()));
        } catch (SqConfigException e) {
            log.warn("Platform identification failed: {}", e.getMessage());
            return new HealthStatus("platform", HealthStatus.Status.DEGRADED,
                    "Version and edition unknown: " + e.getMessage(), Map.of());
        }
    }
}
