package com.sqconfig.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.cache.CacheKey;
import com.sqconfig.core.client.Params;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ObjectNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A user group, identified by its name.
 */
public class Group extends RemoteObject {

    private static final Logger log = LoggerFactory.getLogger(Group.class);

    private final String groupName;

    private Group(Platform platform, String name, JsonNode data) {
        super(platform, cacheKey(platform, name), data);
        this.groupName = name;
    }

    public static CacheKey cacheKey(Platform platform, String name) {
        return CacheKey.of(platform.endpointId(), ObjectType.GROUP, name);
    }

    public static Group get(Platform platform, String name) {
        return platform.cache().getOrCreate(cacheKey(platform, name),
                () -> new Group(platform, name, lookup(platform, name)));
    }

    public static boolean exists(Platform platform, String name) {
        try {
            get(platform, name);
            return true;
        } catch (ObjectNotFoundException e) {
            return false;
        }
    }

    public static Map<String, Group> search(Platform platform) {
        var result = new LinkedHashMap<String, Group>();
        for (JsonNode node : platform.searchAll("user_groups/search", Params.of(), "groups")) {
            var name = node.path("name").asText();
            result.put(name, platform.cache().put(new Group(platform, name, node)));
        }
        return result;
    }

    public static Group create(Platform platform, String name, String description) {
        platform.post("user_groups/create", Params.of("name", name, "description", description));
        log.info("Created group '{}'", name);
        return get(platform, name);
    }

    @Override
    public ObjectType type() {
        return ObjectType.GROUP;
    }

    @Override
    public String key() {
        return groupName;
    }

    @Override
    public String name() {
        return groupName;
    }

    @Override
    public String url() {
        return platform.link("/admin/groups");
    }

    public String description() {
        return payload().path("description").asText("");
    }

    public int memberCount() {
        return payload().path("membersCount").asInt(0);
    }

    public boolean isDefault() {
        return payload().path("default").asBoolean(false);
    }

    public void setDescription(String description) {
        if (description == null || description.equals(description())) {
            return;
        }
        platform.post("user_groups/update", Params.of("currentName", groupName, "description", description));
        synchronized (this) {
            payload().put("description", description);
        }
    }

    @Override
    protected JsonNode fetch() {
        return lookup(platform, groupName);
    }

    @Override
    public ObjectNode export(ExportSettings settings) {
        var node = newNode();
        node.put("name", groupName);
        if (!description().isEmpty()) {
            node.put("description", description());
        }
        if (isDefault()) {
            node.put("default", true);
        }
        if (settings.full()) {
            node.put("membersCount", memberCount());
        }
        return node;
    }

    private static JsonNode lookup(Platform platform, String name) {
        for (JsonNode node : platform.get("user_groups/search", Params.of("q", name)).path("groups")) {
            if (name.equals(node.path("name").asText())) {
                return node;
            }
        }
        throw new ObjectNotFoundException("Group '" + name + "' not found");
    }
}
