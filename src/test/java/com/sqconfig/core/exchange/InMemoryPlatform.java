package com.sqconfig.core.exchange;

import com.sqconfig.core.client.FakeApiTransport;
import com.sqconfig.core.client.HttpMethod;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ObjectAlreadyExistsException;
import com.sqconfig.core.error.ObjectNotFoundException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal stateful platform holding groups, quality gates and quality profiles,
 * enough for import and export round trips. Changing a profile's parent makes it
 * inherit the parent's active rules, as the real platform does.
 */
class InMemoryPlatform {

    record Gate(String name, List<Map<String, String>> conditions, boolean[] isDefault) {
    }

    record Profile(String key, String language, String name, String[] parent, Map<String, String> rules) {
    }

    final FakeApiTransport transport;
    final Map<String, String> groups = new LinkedHashMap<>();
    final Map<String, Gate> gates = new LinkedHashMap<>();
    final Map<String, Profile> profiles = new LinkedHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();

    InMemoryPlatform(String edition) {
        transport = FakeApiTransport.withEdition(edition);
        routeGroups();
        routeGates();
        routeProfiles();
    }

    /**
     * A new client with an empty object cache, as a fresh run would have.
     */
    Platform platform() {
        return transport.platform();
    }

    synchronized void addGroup(String name, String description) {
        groups.put(name, description);
    }

    synchronized Gate addGate(String name, String... metricOpError) {
        var conditions = new ArrayList<Map<String, String>>();
        for (int i = 0; i < metricOpError.length; i += 3) {
            conditions.add(Map.of("id", "c" + ids.incrementAndGet(), "metric", metricOpError[i],
                    "op", metricOpError[i + 1], "error", metricOpError[i + 2]));
        }
        var gate = new Gate(name, conditions, new boolean[1]);
        gates.put(name, gate);
        return gate;
    }

    synchronized Profile addProfile(String language, String name, String parent, String... ruleSeverity) {
        var rules = new TreeMap<String, String>();
        if (parent != null) {
            rules.putAll(profile(language, parent).rules());
        }
        for (int i = 0; i < ruleSeverity.length; i += 2) {
            rules.put(ruleSeverity[i], ruleSeverity[i + 1]);
        }
        var profile = new Profile("qp" + ids.incrementAndGet(), language, name, new String[]{parent}, rules);
        profiles.put(profile.key(), profile);
        return profile;
    }

    synchronized Profile profile(String language, String name) {
        return profiles.values().stream()
                .filter(p -> p.language().equals(language) && p.name().equals(name))
                .findFirst()
                .orElse(null);
    }

    private void routeGroups() {
        transport.on(HttpMethod.GET, "user_groups/search", params -> {
            synchronized (this) {
                var list = new ArrayList<Map<String, Object>>();
                groups.forEach((name, description) -> {
                    if (params.get("q") == null || name.contains(params.get("q"))) {
                        list.add(Map.of("name", name, "description", description == null ? "" : description,
                                "membersCount", 1));
                    }
                });
                return Map.of("groups", list);
            }
        });
        transport.onPost("user_groups/create", params -> {
            synchronized (this) {
                if (groups.containsKey(params.get("name"))) {
                    throw new ObjectAlreadyExistsException("Group already exists");
                }
                groups.put(params.get("name"), params.get("description"));
                return "";
            }
        });
        transport.onPost("user_groups/update", params -> {
            synchronized (this) {
                groups.put(params.get("currentName"), params.get("description"));
                return "";
            }
        });
    }

    private void routeGates() {
        transport.on(HttpMethod.GET, "qualitygates/list", params -> {
            synchronized (this) {
                var list = new ArrayList<Map<String, Object>>();
                gates.values().forEach(g -> list.add(Map.of("name", g.name(), "isDefault", g.isDefault()[0],
                        "isBuiltIn", false)));
                return Map.of("qualitygates", list);
            }
        });
        transport.on(HttpMethod.GET, "qualitygates/show", params -> {
            synchronized (this) {
                var gate = gates.get(params.get("name"));
                if (gate == null) {
                    throw new ObjectNotFoundException("No gate " + params.get("name"));
                }
                return Map.of("name", gate.name(), "isDefault", gate.isDefault()[0],
                        "conditions", List.copyOf(gate.conditions()));
            }
        });
        transport.on(HttpMethod.GET, "qualitygates/search", params -> Map.of("paging", Map.of("total", 0)));
        transport.onPost("qualitygates/create", params -> {
            addGate(params.get("name"));
            return "";
        });
        transport.onPost("qualitygates/create_condition", params -> {
            synchronized (this) {
                gates.get(params.get("gateName")).conditions().add(Map.of("id", "c" + ids.incrementAndGet(),
                        "metric", params.get("metric"), "op", params.get("op"), "error", params.get("error")));
                return "";
            }
        });
        transport.onPost("qualitygates/delete_condition", params -> {
            synchronized (this) {
                gates.values().forEach(g -> g.conditions().removeIf(c -> c.get("id").equals(params.get("id"))));
                return "";
            }
        });
        transport.onPost("qualitygates/set_as_default", params -> {
            synchronized (this) {
                gates.values().forEach(g -> g.isDefault()[0] = g.name().equals(params.get("name")));
                return "";
            }
        });
    }

    private void routeProfiles() {
        transport.on(HttpMethod.GET, "qualityprofiles/search", params -> {
            synchronized (this) {
                var list = new ArrayList<Map<String, Object>>();
                for (var p : profiles.values()) {
                    if (params.containsKey("language") && !p.language().equals(params.get("language"))) continue;
                    if (params.containsKey("qualityProfile") && !p.name().equals(params.get("qualityProfile"))) continue;
                    var json = new LinkedHashMap<String, Object>(Map.of("key", p.key(), "name", p.name(),
                            "language", p.language()));
                    if (p.parent()[0] != null) {
                        json.put("parentName", p.parent()[0]);
                    }
                    list.add(json);
                }
                return Map.of("profiles", list);
            }
        });
        transport.onPost("qualityprofiles/create", params -> {
            addProfile(params.get("language"), params.get("name"), null);
            return "";
        });
        transport.onPost("qualityprofiles/change_parent", params -> {
            synchronized (this) {
                var child = profile(params.get("language"), params.get("qualityProfile"));
                var parent = profile(params.get("language"), params.get("parentQualityProfile"));
                child.parent()[0] = parent.name();
                parent.rules().forEach(child.rules()::putIfAbsent);
                return "";
            }
        });
        transport.on(HttpMethod.GET, "rules/search", params -> {
            synchronized (this) {
                var profile = profiles.get(params.get("qprofile"));
                var rules = new ArrayList<Map<String, Object>>();
                var actives = new LinkedHashMap<String, Object>();
                profile.rules().forEach((rule, severity) -> {
                    rules.add(Map.of("key", rule));
                    actives.put(rule, List.of(Map.of("qProfile", profile.key(), "severity", severity,
                            "params", List.of())));
                });
                return Map.of("rules", rules, "actives", actives, "total", rules.size());
            }
        });
        transport.onPost("qualityprofiles/activate_rule", params -> {
            synchronized (this) {
                profiles.get(params.get("key")).rules().put(params.get("rule"), params.get("severity"));
                return "";
            }
        });
        transport.onPost("qualityprofiles/deactivate_rule", params -> {
            synchronized (this) {
                profiles.get(params.get("key")).rules().remove(params.get("rule"));
                return "";
            }
        });
        transport.on(HttpMethod.GET, "qualityprofiles/projects", params -> Map.of("paging", Map.of("total", 0)));
    }
}
