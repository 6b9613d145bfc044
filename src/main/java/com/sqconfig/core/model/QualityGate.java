package com.sqconfig.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.cache.CacheKey;
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
 * A quality gate, identified by its name.
 */
public class QualityGate extends RemoteObject {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    private final String gateName;
    private List<QualityGateCondition> conditions;
    private Integer projectCount;

    private QualityGate(Platform platform, String name, JsonNode data) {
        super(platform, cacheKey(platform, name), data);
        this.gateName = name;
    }

    public static CacheKey cacheKey(Platform platform, String name) {
        return CacheKey.of(platform.endpointId(), ObjectType.QUALITY_GATE, name);
    }

    public static QualityGate get(Platform platform, String name) {
        return platform.cache().getOrCreate(cacheKey(platform, name),
                () -> new QualityGate(platform, name, show(platform, name)));
    }

    public static boolean exists(Platform platform, String name) {
        try {
            get(platform, name);
            return true;
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }

    /**
     * Lists all quality gates, registering each in the cache.
     */
    public static Map<String, QualityGate> search(Platform platform) {
        var result = new LinkedHashMap<String, QualityGate>();
        for (JsonNode node : platform.get("qualitygates/list").path("qualitygates")) {
            var name = node.path("name").asText();
            result.put(name, platform.cache().put(new QualityGate(platform, name, node)));
        }
        return result;
    }

    public static QualityGate create(Platform platform, String name) {
        platform.post("qualitygates/create", Params.of("name", name));
        log.info("Created quality gate '{}'", name);
        return get(platform, name);
    }

    @Override
    public ObjectType type() {
        return ObjectType.QUALITY_GATE;
    }

    @Override
    public String key() {
        return gateName;
    }

    @Override
    public String name() {
        return gateName;
    }

    @Override
    public String url() {
        return platform.link("/quality_gates/show/" + URLEncoder.encode(gateName, StandardCharsets.UTF_8));
    }

    public boolean isBuiltIn() {
        return payload().path("isBuiltIn").asBoolean(false);
    }

    public boolean isDefault() {
        return payload().path("isDefault").asBoolean(false);
    }

    public synchronized List<QualityGateCondition> conditions() {
        if (conditions == null) {
            var loaded = new ArrayList<QualityGateCondition>();
            for (JsonNode c : show(platform, gateName).path("conditions")) {
                loaded.add(new QualityGateCondition(c.path("id").asText(null), c.path("metric").asText(),
                        c.path("op").asText("GT"), c.path("error").asText()));
            }
            conditions = List.copyOf(loaded);
        }
        return conditions;
    }

    public synchronized int projectCount() {
        if (projectCount == null) {
            var json = platform.get("qualitygates/search",
                    Params.of("gateName", gateName, "selected", "selected", "ps", "1"));
            projectCount = json.path("paging").path("total").asInt(json.path("results").size());
        }
        return projectCount;
    }

    /**
     * Makes the gate's conditions equal to {@code wanted}: conditions not wanted are
     * deleted, missing ones created, identical ones left alone.
     */
    public void setConditions(List<QualityGateCondition> wanted) {
        var current = conditions();
        for (var existing : current) {
            if (wanted.stream().noneMatch(existing::sameAs)) {
                platform.post("qualitygates/delete_condition", Params.of("id", existing.id()));
            }
        }
        for (var condition : wanted) {
            if (current.stream().noneMatch(condition::sameAs)) {
                platform.post("qualitygates/create_condition", Params.of("gateName", gateName,
                        "metric", condition.metric(), "op", condition.op(), "error", condition.error()));
            }
        }
        synchronized (this) {
            conditions = null;
        }
    }

    public void setAsDefault() {
        platform.post("qualitygates/set_as_default", Params.of("name", gateName));
        synchronized (this) {
            payload().put("isDefault", true);
        }
    }

    @Override
    protected JsonNode fetch() {
        return show(platform, gateName);
    }

    @Override
    protected void resetDerived() {
        conditions = null;
        projectCount = null;
    }

    @Override
    public ObjectNode export(ExportSettings settings) {
        var node = newNode();
        node.put("name", gateName);
        if (isDefault()) {
            node.put("isDefault", true);
        }
        if (isBuiltIn()) {
            node.put("isBuiltIn", true);
        }
        var array = node.putArray("conditions");
        conditions().forEach(c -> array.add(c.encode()));
        return node;
    }

    private static JsonNode show(Platform platform, String name) {
        return platform.get("qualitygates/show", Params.of("name", name));
    }
}
