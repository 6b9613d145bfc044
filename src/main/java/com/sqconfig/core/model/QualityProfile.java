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
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * A quality profile, identified by its language and name.
 *
 * <p>Active rules are exported as a map {@code ruleKey -> {severity, params}} which
 * is the content the hierarchy reconciler diffs between a profile and its parent.
 */
public class QualityProfile extends RemoteObject {

    private static final Logger log = LoggerFactory.getLogger(QualityProfile.class);

    /**
     * Platform timestamps look like {@code 2024-01-31T10:20:30+0100}.
     */
    public static final DateTimeFormatter PLATFORM_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final String language;
    private final String profileName;
    private Map<String, JsonNode> rules;
    private Integer projectCount;

    private QualityProfile(Platform platform, String language, String name, JsonNode data) {
        super(platform, cacheKey(platform, language, name), data);
        this.language = language;
        this.profileName = name;
    }

    public static CacheKey cacheKey(Platform platform, String language, String name) {
        return CacheKey.of(platform.endpointId(), ObjectType.QUALITY_PROFILE, language, name);
    }

    /**
     * Key used in export documents and import filters: {@code language:name}.
     */
    public static String qualifiedKey(String language, String name) {
        return language + ":" + name;
    }

    public static QualityProfile get(Platform platform, String language, String name) {
        return platform.cache().getOrCreate(cacheKey(platform, language, name),
                () -> new QualityProfile(platform, language, name, lookup(platform, language, name)));
    }

    public static boolean exists(Platform platform, String language, String name) {
        try {
            get(platform, language, name);
            return true;
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }

    public static List<QualityProfile> search(Platform platform) {
        var result = new ArrayList<QualityProfile>();
        for (JsonNode node : platform.get("qualityprofiles/search").path("profiles")) {
            var profile = new QualityProfile(platform, node.path("language").asText(), node.path("name").asText(), node);
            result.add(platform.cache().put(profile));
        }
        return result;
    }

    public static QualityProfile create(Platform platform, String language, String name) {
        platform.post("qualityprofiles/create", Params.of("language", language, "name", name));
        log.info("Created quality profile '{}' for language {}", name, language);
        return get(platform, language, name);
    }

    @Override
    public ObjectType type() {
        return ObjectType.QUALITY_PROFILE;
    }

    @Override
    public String key() {
        return qualifiedKey(language, profileName);
    }

    @Override
    public String name() {
        return profileName;
    }

    public String language() {
        return language;
    }

    /**
     * The platform's internal profile key, needed by rule activation APIs.
     */
    public String profileKey() {
        return payload().path("key").asText();
    }

    @Override
    public String url() {
        return platform.link("/profiles/show?language=" + language + "&name="
                + URLEncoder.encode(profileName, StandardCharsets.UTF_8));
    }

    public Optional<String> parentName() {
        var parent = payload().path("parentName");
        return parent.isTextual() && !parent.asText().isEmpty() ? Optional.of(parent.asText()) : Optional.empty();
    }

    public boolean isBuiltIn() {
        return payload().path("isBuiltIn").asBoolean(false);
    }

    public boolean isDefault() {
        return payload().path("isDefault").asBoolean(false);
    }

    public int deprecatedRuleCount() {
        return payload().path("activeDeprecatedRuleCount").asInt(0);
    }

    public Optional<OffsetDateTime> lastUsed() {
        return parseDate(payload().path("lastUsed").asText(null));
    }

    /**
     * Most recent of the rule-set and user updates.
     */
    public Optional<OffsetDateTime> lastUpdated() {
        var rulesUpdate = parseDate(payload().path("rulesUpdatedAt").asText(null));
        var userUpdate = parseDate(payload().path("userUpdatedAt").asText(null));
        if (rulesUpdate.isEmpty()) return userUpdate;
        if (userUpdate.isEmpty()) return rulesUpdate;
        return rulesUpdate.get().isAfter(userUpdate.get()) ? rulesUpdate : userUpdate;
    }

    public synchronized int projectCount() {
        if (projectCount == null) {
            var json = platform.get("qualityprofiles/projects",
                    Params.of("key", profileKey(), "selected", "selected", "ps", "1"));
            projectCount = json.path("paging").path("total").asInt(json.path("results").size());
        }
        return projectCount;
    }

    /**
     * Active rules keyed by rule key, each as {@code {"severity": ..., "params": {...}}}.
     */
    public synchronized Map<String, JsonNode> rules() {
        if (rules == null) {
            rules = Collections.unmodifiableMap(loadRules());
        }
        return rules;
    }

    public void setParent(String parentName) {
        platform.post("qualityprofiles/change_parent", Params.of("qualityProfile", profileName,
                "language", language, "parentQualityProfile", parentName));
        synchronized (this) {
            payload().put("parentName", parentName);
        }
    }

    public void activateRule(String ruleKey, JsonNode activation) {
        var params = new StringJoiner(";");
        activation.path("params").fields().forEachRemaining(e -> params.add(e.getKey() + "=" + e.getValue().asText()));
        platform.post("qualityprofiles/activate_rule", Params.of("key", profileKey(), "rule", ruleKey,
                "severity", activation.path("severity").asText(null),
                "params", params.length() == 0 ? null : params.toString()));
    }

    public void deactivateRule(String ruleKey) {
        platform.post("qualityprofiles/deactivate_rule", Params.of("key", profileKey(), "rule", ruleKey));
    }

    /**
     * Applies rule activations and removals, then drops the cached rule set.
     */
    public void applyRuleChanges(Map<String, JsonNode> activate, Iterable<String> deactivate) {
        activate.forEach(this::activateRule);
        deactivate.forEach(this::deactivateRule);
        synchronized (this) {
            rules = null;
        }
    }

    @Override
    protected JsonNode fetch() {
        return lookup(platform, language, profileName);
    }

    @Override
    protected void resetDerived() {
        rules = null;
        projectCount = null;
    }

    @Override
    public ObjectNode export(ExportSettings settings) {
        var node = newNode();
        node.put("name", profileName);
        node.put("language", language);
        parentName().ifPresent(p -> node.put("parent", p));
        if (isDefault()) {
            node.put("isDefault", true);
        }
        if (isBuiltIn()) {
            node.put("isBuiltIn", true);
        }
        if (settings.full()) {
            lastUsed().ifPresent(d -> node.put("lastUsed", d.format(PLATFORM_DATE)));
            lastUpdated().ifPresent(d -> node.put("lastUpdated", d.format(PLATFORM_DATE)));
        }
        var rulesNode = node.putObject("rules");
        new TreeMap<>(rules()).forEach(rulesNode::set);
        return node;
    }

    private Map<String, JsonNode> loadRules() {
        var loaded = new LinkedHashMap<String, JsonNode>();
        int page = 1;
        while (true) {
            var json = platform.get("rules/search", Params.of("qprofile", profileKey(), "activation", "true",
                    "f", "actives", "p", String.valueOf(page), "ps", String.valueOf(Platform.PAGE_SIZE)));
            var actives = json.path("actives");
            for (JsonNode rule : json.path("rules")) {
                var ruleKey = rule.path("key").asText();
                loaded.put(ruleKey, activation(actives.path(ruleKey)));
            }
            int total = json.path("total").asInt(json.path("paging").path("total").asInt(0));
            if (json.path("rules").size() < Platform.PAGE_SIZE || loaded.size() >= total) {
                break;
            }
            page++;
        }
        log.debug("{} has {} active rules", this, loaded.size());
        return loaded;
    }

    private JsonNode activation(JsonNode activeList) {
        var node = newNode();
        for (JsonNode active : activeList) {
            if (!active.path("qProfile").asText().equals(profileKey())) {
                continue;
            }
            node.put("severity", active.path("severity").asText());
            var params = node.putObject("params");
            for (JsonNode p : active.path("params")) {
                params.put(p.path("key").asText(), p.path("value").asText());
            }
        }
        return node;
    }

    private static JsonNode lookup(Platform platform, String language, String name) {
        var profiles = platform.get("qualityprofiles/search",
                Params.of("language", language, "qualityProfile", name)).path("profiles");
        for (JsonNode p : profiles) {
            if (name.equals(p.path("name").asText())) {
                return p;
            }
        }
        throw new ObjectNotFoundException("Quality profile '%s' of language %s not found".formatted(name, language));
    }

    static Optional<OffsetDateTime> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value, PLATFORM_DATE));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date '{}'", value);
            return Optional.empty();
        }
    }
}
