package com.sqconfig.core.client;

import java.util.Map;

/**
 * Minimal contract for reaching the platform's web API.
 *
 * <p>Implementations return only successful (2xx) responses and translate every
 * other outcome into the {@code com.sqconfig.core.error} taxonomy:
 * {@link com.sqconfig.core.error.ObjectNotFoundException} on 404,
 * {@link com.sqconfig.core.error.PermissionDeniedException} on 401/403,
 * {@link com.sqconfig.core.error.RateLimitedException} on 429 and
 * {@link com.sqconfig.core.error.TransportException} on network failure.
 */
public interface ApiTransport {

    /**
     * @param method GET sends params in the query string, POST as a form body
     * @param path   API path relative to {@code <url>/api/}, e.g. {@code qualitygates/list}
     * @param params request parameters, may be empty
     */
    ApiResponse call(HttpMethod method, String path, Map<String, String> params);
}
