package com.sqconfig.core.config;

import com.sqconfig.core.cache.RemoteObjectCache;
import com.sqconfig.core.client.HttpApiTransport;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.metrics.SyncMetrics;
import com.sqconfig.core.runner.ConcurrentTaskRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Opens platform connections and task runners from configuration, with optional
 * command-line overrides.
 */
@Component
public class PlatformFactory {

    private final SqConfigProperties properties;
    private final RemoteObjectCache cache;
    private final SyncMetrics metrics;

    public PlatformFactory(SqConfigProperties properties, RemoteObjectCache cache, SyncMetrics metrics) {
        this.properties = properties;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * @param url   platform URL, null for the configured one
     * @param token user token, null for the configured one
     * @throws SqConfigException with {@link ErrorCode#TOKEN_MISSING} if no token is available
     */
    public Platform connect(String url, String token) {
        var server = properties.getServer();
        var effectiveUrl = stripTrailingSlash(url != null ? url : server.getUrl());
        var effectiveToken = token != null ? token : server.getToken();
        if (effectiveToken == null || effectiveToken.isBlank()) {
            throw new SqConfigException(ErrorCode.TOKEN_MISSING,
                    "No token provided, use --token or the SQ_TOKEN environment variable");
        }
        var transport = new HttpApiTransport(effectiveUrl, effectiveToken,
                Duration.ofSeconds(server.getConnectTimeoutSeconds()),
                Duration.ofSeconds(server.getRequestTimeoutSeconds()),
                server.getMaxRetries(), server.getRetryBackoffMillis());
        return new Platform(effectiveUrl, transport, cache);
    }

    /**
     * @param threads        worker count, null for the configured one
     * @param timeoutSeconds per-task timeout, null for the configured one
     */
    public ConcurrentTaskRunner runner(Integer threads, Integer timeoutSeconds) {
        var runner = properties.getRunner();
        return new ConcurrentTaskRunner(threads != null ? threads : runner.getThreads(),
                Duration.ofSeconds(timeoutSeconds != null ? timeoutSeconds : runner.getTaskTimeoutSeconds()),
                metrics);
    }

    public int writerCapacity() {
        return properties.getRunner().getQueueCapacity();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
