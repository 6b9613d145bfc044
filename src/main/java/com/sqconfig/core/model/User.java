package com.sqconfig.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.cache.CacheKey;
import com.sqconfig.core.client.Params;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ObjectNotFoundException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A user account, identified by its login. Users are exported and audited only.
 */
public class User extends RemoteObject {

    private final String login;

    private User(Platform platform, String login, JsonNode data) {
        super(platform, cacheKey(platform, login), data);
        this.login = login;
    }

    public static CacheKey cacheKey(Platform platform, String login) {
        return CacheKey.of(platform.endpointId(), ObjectType.USER, login);
    }

    public static Map<String, User> search(Platform platform) {
        var result = new LinkedHashMap<String, User>();
        for (JsonNode node : platform.searchAll("users/search", Params.of(), "users")) {
            var login = node.path("login").asText();
            result.put(login, platform.cache().put(new User(platform, login, node)));
        }
        return result;
    }

    @Override
    public ObjectType type() {
        return ObjectType.USER;
    }

    @Override
    public String key() {
        return login;
    }

    @Override
    public String url() {
        return platform.link("/admin/users");
    }

    public Optional<OffsetDateTime> lastConnection() {
        return QualityProfile.parseDate(payload().path("lastConnectionDate").asText(null));
    }

    public List<String> groups() {
        var groups = new ArrayList<String>();
        payload().path("groups").forEach(g -> groups.add(g.asText()));
        return groups;
    }

    @Override
    protected JsonNode fetch() {
        for (JsonNode node : platform.get("users/search", Params.of("q", login)).path("users")) {
            if (login.equals(node.path("login").asText())) {
                return node;
            }
        }
        throw new ObjectNotFoundException("User '" + login + "' not found");
    }

    @Override
    public ObjectNode export(ExportSettings settings) {
        var node = newNode();
        node.put("login", login);
        node.put("name", payload().path("name").asText(login));
        var email = payload().path("email").asText("");
        if (!email.isEmpty()) {
            node.put("email", email);
        }
        node.put("local", payload().path("local").asBoolean(true));
        var groupsNode = node.putArray("groups");
        groups().forEach(groupsNode::add);
        if (settings.full()) {
            lastConnection().ifPresent(d -> node.put("lastConnectionDate", d.format(QualityProfile.PLATFORM_DATE)));
        }
        return node;
    }
}
