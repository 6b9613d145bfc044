package com.sqconfig.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.cache.RemoteObjectCache;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;
import com.sqconfig.core.error.UnsupportedFeatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One platform endpoint: the transport to reach it, its identity (server id,
 * version, edition) and the object cache every remote object resolves through.
 */
public class Platform {

    private static final Logger log = LoggerFactory.getLogger(Platform.class);

    public static final int PAGE_SIZE = 500;

    private final String url;
    private final ApiTransport transport;
    private final RemoteObjectCache cache;
    private final ObjectMapper objectMapper;

    private String serverId;
    private String version;
    private Edition edition;

    public Platform(String url, ApiTransport transport, RemoteObjectCache cache) {
        this.url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.transport = transport;
        this.cache = cache;
        this.objectMapper = new ObjectMapper();
    }

    public String url() {
        return url;
    }

    /**
     * Identity used in cache keys: two platforms with the same URL share objects.
     */
    public String endpointId() {
        return url;
    }

    public RemoteObjectCache cache() {
        return cache;
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }

    public JsonNode get(String path, Map<String, String> params) {
        return parse(transport.call(HttpMethod.GET, path, params), path);
    }

    public JsonNode get(String path) {
        return get(path, Map.of());
    }

    public JsonNode post(String path, Map<String, String> params) {
        return parse(transport.call(HttpMethod.POST, path, params), path);
    }

    /**
     * Collects every element of {@code arrayField} across all result pages of a
     * search API using {@code p}/{@code ps} paging.
     */
    public List<JsonNode> searchAll(String path, Map<String, String> params, String arrayField) {
        return searchAll(path, params, arrayField, PAGE_SIZE);
    }

    public List<JsonNode> searchAll(String path, Map<String, String> params, String arrayField, int pageSize) {
        var results = new ArrayList<JsonNode>();
        int page = 1;
        while (true) {
            var pageParams = new LinkedHashMap<>(params);
            pageParams.put("p", String.valueOf(page));
            pageParams.put("ps", String.valueOf(pageSize));
            var json = get(path, pageParams);
            var items = json.path(arrayField);
            items.forEach(results::add);
            int total = json.path("paging").path("total").asInt(json.path("total").asInt(results.size()));
            if (items.size() < pageSize || results.size() >= total) {
                break;
            }
            page++;
        }
        log.debug("{} returned {} {}", path, results.size(), arrayField);
        return results;
    }

    public synchronized String serverId() {
        if (serverId == null) {
            serverId = get("system/status").path("id").asText("");
        }
        return serverId;
    }

    public synchronized String version() {
        if (version == null) {
            loadNavigation();
        }
        return version;
    }

    public synchronized Edition edition() {
        if (edition == null) {
            loadNavigation();
        }
        return edition;
    }

    /**
     * @throws UnsupportedFeatureException if this platform's edition is below {@code minimum}
     */
    public void requireEdition(Edition minimum, String feature) {
        var current = edition();
        if (!current.atLeast(minimum)) {
            throw new UnsupportedFeatureException(
                    "%s requires %s edition or above, platform is %s".formatted(feature, minimum, current));
        }
    }

    /**
     * Builds a browsable link from a UI path such as {@code /dashboard?id=key}.
     */
    public String link(String uiPath) {
        return url + uiPath;
    }

    public ObjectNode describe() {
        var node = objectMapper.createObjectNode();
        node.put("url", url);
        node.put("version", version());
        node.put("edition", edition().name().toLowerCase());
        node.put("serverId", serverId());
        return node;
    }

    private void loadNavigation() {
        var json = get("navigation/global");
        version = json.path("version").asText("");
        edition = Edition.fromString(json.path("edition").asText(null));
        log.info("Connected to {} version {} ({} edition)", url, version, edition);
    }

    private JsonNode parse(ApiResponse response, String path) {
        if (!response.hasBody()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new SqConfigException(ErrorCode.API, "Invalid JSON returned by " + path, e);
        }
    }
}
