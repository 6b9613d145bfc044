package com.sqconfig.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.cache.CacheKey;
import com.sqconfig.core.client.Params;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ObjectNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A project, identified by its key.
 */
public class Project extends RemoteObject {

    private static final Logger log = LoggerFactory.getLogger(Project.class);

    private final String projectKey;
    private ObjectNode permissions;
    private List<JsonNode> branches;
    private Integer ncloc;

    private Project(Platform platform, String key, JsonNode data) {
        super(platform, cacheKey(platform, key), data);
        this.projectKey = key;
    }

    public static CacheKey cacheKey(Platform platform, String key) {
        return CacheKey.of(platform.endpointId(), ObjectType.PROJECT, key);
    }

    public static Project get(Platform platform, String key) {
        return platform.cache().getOrCreate(cacheKey(platform, key),
                () -> new Project(platform, key, show(platform, key)));
    }

    public static boolean exists(Platform platform, String key) {
        try {
            get(platform, key);
            return true;
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }

    public static Map<String, Project> search(Platform platform) {
        var result = new LinkedHashMap<String, Project>();
        for (JsonNode node : platform.searchAll("projects/search", Params.of("qualifiers", "TRK"), "components")) {
            var key = node.path("key").asText();
            result.put(key, platform.cache().put(new Project(platform, key, node)));
        }
        return result;
    }

    public static Project create(Platform platform, String key, String name, String visibility) {
        platform.post("projects/create", Params.of("project", key, "name", name, "visibility", visibility));
        log.info("Created project '{}'", key);
        return get(platform, key);
    }

    @Override
    public ObjectType type() {
        return ObjectType.PROJECT;
    }

    @Override
    public String key() {
        return projectKey;
    }

    @Override
    public String url() {
        return platform.link("/dashboard?id=" + URLEncoder.encode(projectKey, StandardCharsets.UTF_8));
    }

    public String visibility() {
        return payload().path("visibility").asText("public");
    }

    public Optional<OffsetDateTime> lastAnalysis() {
        return QualityProfile.parseDate(payload().path("lastAnalysisDate").asText(null));
    }

    public List<String> tags() {
        var tags = new ArrayList<String>();
        payload().path("tags").forEach(t -> tags.add(t.asText()));
        return tags;
    }

    public synchronized ObjectNode permissions() {
        if (permissions == null) {
            permissions = Permissions.fetch(platform, projectKey);
        }
        return permissions;
    }

    public synchronized List<JsonNode> branches() {
        if (branches == null) {
            var loaded = new ArrayList<JsonNode>();
            platform.get("project_branches/list", Params.of("project", projectKey)).path("branches").forEach(loaded::add);
            branches = List.copyOf(loaded);
        }
        return branches;
    }

    public synchronized int ncloc() {
        if (ncloc == null) {
            var measures = platform.get("measures/component",
                    Params.of("component", projectKey, "metricKeys", "ncloc")).path("component").path("measures");
            int value = 0;
            for (JsonNode m : measures) {
                if ("ncloc".equals(m.path("metric").asText())) {
                    value = m.path("value").asInt(0);
                }
            }
            ncloc = value;
        }
        return ncloc;
    }

    public Optional<String> qualityGate() {
        try {
            var gate = platform.get("qualitygates/get_by_project", Params.of("project", projectKey)).path("qualityGate");
            if (gate.path("default").asBoolean(false)) {
                return Optional.empty();
            }
            return Optional.ofNullable(gate.path("name").asText(null));
        } catch (ObjectNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Profiles explicitly assigned to the project, keyed by language.
     */
    public Map<String, String> qualityProfiles() {
        var result = new TreeMap<String, String>();
        for (JsonNode p : platform.get("qualityprofiles/search", Params.of("project", projectKey)).path("profiles")) {
            if (!p.path("isDefault").asBoolean(false)) {
                result.put(p.path("language").asText(), p.path("name").asText());
            }
        }
        return result;
    }

    public void setVisibility(String visibility) {
        platform.post("projects/update_visibility", Params.of("project", projectKey, "visibility", visibility));
        synchronized (this) {
            payload().put("visibility", visibility);
        }
    }

    public void setTags(List<String> tags) {
        platform.post("project_tags/set", Params.of("project", projectKey, "tags", String.join(",", tags)));
    }

    public void setQualityGate(String gateName) {
        platform.post("qualitygates/select", Params.of("projectKey", projectKey, "gateName", gateName));
    }

    public void setQualityProfile(String language, String profileName) {
        platform.post("qualityprofiles/add_project",
                Params.of("language", language, "qualityProfile", profileName, "project", projectKey));
    }

    public void setPermissions(JsonNode wanted) {
        Permissions.apply(platform, projectKey, wanted);
        synchronized (this) {
            permissions = null;
        }
    }

    /**
     * Last {@code count} background tasks of the project, most recent first.
     */
    public List<JsonNode> backgroundTasks(int count) {
        var tasks = new ArrayList<JsonNode>();
        platform.get("ce/activity", Params.of("component", projectKey, "ps", String.valueOf(count)))
                .path("tasks").forEach(tasks::add);
        return tasks;
    }

    public Optional<String> scannerContext(String taskId) {
        var task = platform.get("ce/task", Params.of("id", taskId, "additionalFields", "scannerContext")).path("task");
        return Optional.ofNullable(task.path("scannerContext").asText(null));
    }

    @Override
    protected JsonNode fetch() {
        return show(platform, projectKey);
    }

    @Override
    protected void resetDerived() {
        permissions = null;
        branches = null;
        ncloc = null;
    }

    @Override
    public ObjectNode export(ExportSettings settings) {
        var node = newNode();
        node.put("key", projectKey);
        node.put("name", name());
        node.put("visibility", visibility());
        var tags = tags();
        if (!tags.isEmpty()) {
            ArrayNode array = node.putArray("tags");
            tags.forEach(array::add);
        }
        qualityGate().ifPresent(g -> node.put("qualityGate", g));
        var profiles = qualityProfiles();
        if (!profiles.isEmpty()) {
            var profilesNode = node.putObject("qualityProfiles");
            profiles.forEach(profilesNode::put);
        }
        var branchNames = node.putArray("branches");
        for (JsonNode branch : branches()) {
            branchNames.add(branch.path("name").asText());
        }
        node.set("permissions", permissions().deepCopy());
        if (settings.full()) {
            lastAnalysis().ifPresent(d -> node.put("lastAnalysis", d.format(QualityProfile.PLATFORM_DATE)));
            node.put("ncloc", ncloc());
        }
        if (settings.isMigration()) {
            addMigrationData(node, settings.taskHistory());
        }
        return node;
    }

    private void addMigrationData(ObjectNode node, int taskHistory) {
        var tasks = backgroundTasks(Math.max(1, taskHistory));
        var tasksNode = node.putArray("backgroundTasks");
        tasks.forEach(t -> tasksNode.add(t.deepCopy()));
        if (!tasks.isEmpty()) {
            var lastTaskId = tasks.get(0).path("id").asText(null);
            if (lastTaskId != null) {
                scannerContext(lastTaskId).ifPresent(ctx -> node.put("lastTaskScannerContext", ctx));
            }
        }
    }

    private static JsonNode show(Platform platform, String key) {
        return platform.get("components/show", Params.of("component", key)).path("component");
    }
}
