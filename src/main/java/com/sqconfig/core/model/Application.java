package com.sqconfig.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.cache.CacheKey;
import com.sqconfig.core.client.Edition;
import com.sqconfig.core.client.Params;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ObjectNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An application (aggregation of projects), identified by its key. Requires the
 * developer edition or above.
 */
public class Application extends RemoteObject {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    private final String applicationKey;
    private ObjectNode permissions;

    private Application(Platform platform, String key, JsonNode data) {
        super(platform, cacheKey(platform, key), data);
        this.applicationKey = key;
    }

    public static CacheKey cacheKey(Platform platform, String key) {
        return CacheKey.of(platform.endpointId(), ObjectType.APPLICATION, key);
    }

    public static Application get(Platform platform, String key) {
        platform.requireEdition(Edition.DEVELOPER, "Applications");
        return platform.cache().getOrCreate(cacheKey(platform, key),
                () -> new Application(platform, key, show(platform, key)));
    }

    public static boolean exists(Platform platform, String key) {
        try {
            get(platform, key);
            return true;
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }

    public static Map<String, Application> search(Platform platform) {
        platform.requireEdition(Edition.DEVELOPER, "Applications");
        var result = new LinkedHashMap<String, Application>();
        for (JsonNode node : platform.searchAll("components/search", Params.of("qualifiers", "APP"), "components")) {
            var key = node.path("key").asText();
            result.put(key, get(platform, key));
        }
        return result;
    }

    public static Application create(Platform platform, String key, String name, String description, String visibility) {
        platform.requireEdition(Edition.DEVELOPER, "Applications");
        platform.post("applications/create", Params.of("key", key, "name", name,
                "description", description, "visibility", visibility));
        log.info("Created application '{}'", key);
        return get(platform, key);
    }

    @Override
    public ObjectType type() {
        return ObjectType.APPLICATION;
    }

    @Override
    public String key() {
        return applicationKey;
    }

    @Override
    public String url() {
        return platform.link("/dashboard?id=" + URLEncoder.encode(applicationKey, StandardCharsets.UTF_8));
    }

    public List<String> projects() {
        var keys = new ArrayList<String>();
        payload().path("projects").forEach(p -> keys.add(p.path("key").asText()));
        return keys;
    }

    public List<String> branches() {
        var names = new ArrayList<String>();
        payload().path("branches").forEach(b -> names.add(b.path("name").asText()));
        return names;
    }

    public void addProject(String projectKey) {
        platform.post("applications/add_project", Params.of("application", applicationKey, "project", projectKey));
    }

    public synchronized ObjectNode permissions() {
        if (permissions == null) {
            permissions = Permissions.fetch(platform, applicationKey);
        }
        return permissions;
    }

    public void setPermissions(JsonNode wanted) {
        Permissions.apply(platform, applicationKey, wanted);
        synchronized (this) {
            permissions = null;
        }
    }

    @Override
    protected JsonNode fetch() {
        return show(platform, applicationKey);
    }

    @Override
    protected void resetDerived() {
        permissions = null;
    }

    @Override
    public ObjectNode export(ExportSettings settings) {
        var node = newNode();
        node.put("key", applicationKey);
        node.put("name", name());
        var description = payload().path("description").asText("");
        if (!description.isEmpty()) {
            node.put("description", description);
        }
        node.put("visibility", payload().path("visibility").asText("public"));
        var projectsNode = node.putArray("projects");
        projects().forEach(projectsNode::add);
        var branchesNode = node.putArray("branches");
        branches().forEach(branchesNode::add);
        node.set("permissions", permissions().deepCopy());
        return node;
    }

    private static JsonNode show(Platform platform, String key) {
        return platform.get("applications/show", Params.of("application", key)).path("application");
    }
}
