package com.sqconfig.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.client.Params;
import com.sqconfig.core.client.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads and applies the user and group permissions of a project, application or
 * portfolio. The exported shape is {@code {"users": {login: [perm]}, "groups": {name: [perm]}}}.
 */
public final class Permissions {

    private static final Logger log = LoggerFactory.getLogger(Permissions.class);

    public static final String ADMIN = "admin";
    private static final int PAGE_SIZE = 100;

    private Permissions() {}

    public static ObjectNode fetch(Platform platform, String componentKey) {
        var node = platform.mapper().createObjectNode();
        var users = node.putObject("users");
        for (JsonNode user : platform.searchAll("permissions/users",
                Params.of("projectKey", componentKey), "users", PAGE_SIZE)) {
            if (user.path("permissions").size() > 0) {
                users.set(user.path("login").asText(), user.path("permissions").deepCopy());
            }
        }
        var groups = node.putObject("groups");
        for (JsonNode group : platform.searchAll("permissions/groups",
                Params.of("projectKey", componentKey), "groups", PAGE_SIZE)) {
            if (group.path("permissions").size() > 0) {
                groups.set(group.path("name").asText(), group.path("permissions").deepCopy());
            }
        }
        return node;
    }

    /**
     * Grants every permission listed in {@code permissions} that the component does
     * not already have. Nothing is revoked.
     */
    public static void apply(Platform platform, String componentKey, JsonNode permissions) {
        if (permissions == null || permissions.isMissingNode() || permissions.isNull()) {
            return;
        }
        var current = fetch(platform, componentKey);
        grant(platform, componentKey, permissions.path("users"), current.path("users"), "permissions/add_user", "login");
        grant(platform, componentKey, permissions.path("groups"), current.path("groups"), "permissions/add_group", "groupName");
    }

    public static boolean hasAdmin(JsonNode permissions) {
        return contains(permissions.path("users"), ADMIN) || contains(permissions.path("groups"), ADMIN);
    }

    private static void grant(Platform platform, String componentKey, JsonNode wanted, JsonNode current,
                              String api, String principalParam) {
        var fields = wanted.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            Set<String> existing = new HashSet<>();
            current.path(entry.getKey()).forEach(p -> existing.add(p.asText()));
            for (JsonNode perm : entry.getValue()) {
                if (existing.contains(perm.asText())) {
                    continue;
                }
                platform.post(api, Params.of(principalParam, entry.getKey(),
                        "permission", perm.asText(), "projectKey", componentKey));
                log.debug("Granted {} to {} on {}", perm.asText(), entry.getKey(), componentKey);
            }
        }
    }

    private static boolean contains(JsonNode principals, String permission) {
        var values = principals.elements();
        while (values.hasNext()) {
            var perms = values.next();
            if (perms instanceof ArrayNode array) {
                for (JsonNode p : array) {
                    if (permission.equals(p.asText())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
