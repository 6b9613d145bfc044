package com.sqconfig.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * Connection and concurrency options shared by every command talking to a platform.
 * Unset options fall back to the {@code sqconfig.*} configuration.
 */
public class ConnectionOptions {

    @Option(names = {"-u", "--url"}, description = "Platform URL (default: sqconfig.server.url or SQ_URL)")
    String url;

    @Option(names = {"-t", "--token"}, description = "User token (default: sqconfig.server.token or SQ_TOKEN)")
    String token;

    @Option(names = "--threads", description = "Number of parallel workers")
    Integer threads;

    @Option(names = "--task-timeout", description = "Timeout of each object's processing, in seconds")
    Integer taskTimeoutSeconds;
}
