package com.sqconfig.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.ObjectAlreadyExistsException;
import com.sqconfig.core.error.ObjectNotFoundException;
import com.sqconfig.core.error.PermissionDeniedException;
import com.sqconfig.core.error.RateLimitedException;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link ApiTransport} over the JDK {@link HttpClient}.
 *
 * <p>Authenticates with the user token as basic-auth login, which every platform
 * version accepts. Rate limiting and network failures can be retried a bounded
 * number of times with exponential backoff; the default is no retry.
 */
public class HttpApiTransport implements ApiTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpApiTransport.class);

    private final String baseUrl;
    private final String authorization;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final int maxRetries;
    private final long retryBackoffMillis;

    public HttpApiTransport(String baseUrl, String token, Duration connectTimeout, Duration requestTimeout,
                            int maxRetries, long retryBackoffMillis) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((token + ":").getBytes(StandardCharsets.UTF_8));
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        this.objectMapper = new ObjectMapper();
        this.requestTimeout = requestTimeout;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryBackoffMillis = retryBackoffMillis;
    }

    @Override
    public ApiResponse call(HttpMethod method, String path, Map<String, String> params) {
        int attempt = 0;
        while (true) {
            try {
                return send(method, path, params);
            } catch (RateLimitedException | TransportException e) {
                if (attempt >= maxRetries) {
                    throw e;
                }
                long delay = retryBackoffMillis * (1L << attempt);
                attempt++;
                log.warn("{} {} failed ({}), retry {}/{} in {}ms",
                        method, path, e.getMessage(), attempt, maxRetries, delay);
                sleep(delay);
            }
        }
    }

    private ApiResponse send(HttpMethod method, String path, Map<String, String> params) {
        var query = encodeParams(params);
        var builder = HttpRequest.newBuilder()
                .timeout(requestTimeout)
                .header("Authorization", authorization)
                .header("Accept", "application/json");
        if (method == HttpMethod.GET) {
            var uri = baseUrl + "/api/" + path + (query.isEmpty() ? "" : "?" + query);
            builder.uri(URI.create(uri)).GET();
        } else {
            builder.uri(URI.create(baseUrl + "/api/" + path))
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(query));
        }

        HttpResponse<String> response;
        try {
            log.debug("{} {} {}", method, path, params);
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransportException(ErrorCode.REQUEST_TIMEOUT, "Request timed out: " + method + " " + path, e);
        } catch (IOException e) {
            throw new TransportException("Request failed: " + method + " " + path + " (" + e.getMessage() + ")", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request interrupted: " + method + " " + path, e);
        }
        return classify(method, path, response.statusCode(), response.body());
    }

    ApiResponse classify(HttpMethod method, String path, int status, String body) {
        if (status >= 200 && status < 300) {
            return new ApiResponse(status, body);
        }
        var detail = "%s %s failed (HTTP %d): %s".formatted(method, path, status, errorMessage(body));
        switch (status) {
            case 401 -> throw new PermissionDeniedException(ErrorCode.AUTHENTICATION, detail);
            case 403 -> throw new PermissionDeniedException(ErrorCode.AUTHORIZATION, detail);
            case 404 -> throw new ObjectNotFoundException(detail);
            case 429 -> throw new RateLimitedException(detail);
            default -> {
                if (status == 400 && errorMessage(body).toLowerCase().contains("already exist")) {
                    throw new ObjectAlreadyExistsException(detail);
                }
                throw new SqConfigException(ErrorCode.API, detail);
            }
        }
    }

    /**
     * Extracts {@code errors[].msg} from an error body, or returns the raw body.
     */
    String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            var errors = json.path("errors");
            if (errors.isArray() && !errors.isEmpty()) {
                var sb = new StringBuilder();
                for (JsonNode error : errors) {
                    if (sb.length() > 0) sb.append(" | ");
                    sb.append(error.path("msg").asText());
                }
                return sb.toString();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body;
    }

    private static String encodeParams(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        return params.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting to retry", e);
        }
    }
}
