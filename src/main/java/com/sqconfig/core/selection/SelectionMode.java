package com.sqconfig.core.selection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.error.ErrorCode;
import com.sqconfig.core.error.SqConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * How a portfolio selects its projects. Exactly one mode is active at a time.
 *
 * <p>Export form: {@code {"mode": "MANUAL", "projects": {key: [branch...]}}},
 * {@code {"mode": "REGEXP", "regexp": ..., "branch": ...}},
 * {@code {"mode": "TAGS", "tags": [...], "branch": ...}},
 * {@code {"mode": "REST", "branch": ...}} or {@code {"mode": "NONE"}}.
 * An empty branch list in manual mode means the project's main branch.
 */
public sealed interface SelectionMode {

    String modeName();

    record Manual(Map<String, Set<String>> projects) implements SelectionMode {
        public Manual {
            var copy = new TreeMap<String, Set<String>>();
            projects.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
            projects = Collections.unmodifiableMap(copy);
        }

        public static Manual empty() {
            return new Manual(Map.of());
        }

        public Manual with(String project, String branch) {
            var copy = new TreeMap<String, Set<String>>(projects);
            var branches = new LinkedHashSet<>(copy.getOrDefault(project, Set.of()));
            if (branch != null) {
                branches.add(branch);
            }
            copy.put(project, branches);
            return new Manual(copy);
        }

        @Override
        public String modeName() {
            return "MANUAL";
        }
    }

    record Regexp(String pattern, String branch) implements SelectionMode {
        @Override
        public String modeName() {
            return "REGEXP";
        }
    }

    record Tags(List<String> tags, String branch) implements SelectionMode {
        public Tags {
            tags = List.copyOf(tags);
        }

        @Override
        public String modeName() {
            return "TAGS";
        }
    }

    record Rest(String branch) implements SelectionMode {
        @Override
        public String modeName() {
            return "REST";
        }
    }

    record None() implements SelectionMode {
        @Override
        public String modeName() {
            return "NONE";
        }
    }

    default ObjectNode toJson(ObjectMapper mapper) {
        var node = mapper.createObjectNode();
        node.put("mode", modeName());
        if (this instanceof Manual manual) {
            var projects = node.putObject("projects");
            manual.projects().forEach((project, branches) -> {
                var array = projects.putArray(project);
                branches.forEach(array::add);
            });
        } else if (this instanceof Regexp regexp) {
            node.put("regexp", regexp.pattern());
            putBranch(node, regexp.branch());
        } else if (this instanceof Tags tags) {
            var array = node.putArray("tags");
            tags.tags().forEach(array::add);
            putBranch(node, tags.branch());
        } else if (this instanceof Rest rest) {
            putBranch(node, rest.branch());
        }
        return node;
    }

    /**
     * Parses the export form written by {@link #toJson}.
     */
    static SelectionMode fromJson(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return new None();
        }
        var branch = node.path("branch").asText(null);
        return switch (node.path("mode").asText("NONE")) {
            case "MANUAL" -> {
                var projects = new TreeMap<String, Set<String>>();
                node.path("projects").fields().forEachRemaining(e -> {
                    var branches = new LinkedHashSet<String>();
                    e.getValue().forEach(b -> branches.add(b.asText()));
                    projects.put(e.getKey(), branches);
                });
                yield new Manual(projects);
            }
            case "REGEXP" -> new Regexp(node.path("regexp").asText(), branch);
            case "TAGS" -> new Tags(textList(node.path("tags")), branch);
            case "REST" -> new Rest(branch);
            case "NONE" -> new None();
            default -> throw new SqConfigException(ErrorCode.ARGS_ERROR,
                    "Unknown portfolio selection mode: " + node.path("mode").asText());
        };
    }

    /**
     * Parses the selection of a portfolio as returned by {@code views/show}.
     */
    static SelectionMode fromPortfolio(JsonNode show) {
        var branch = show.path("branch").asText(null);
        return switch (show.path("selectionMode").asText("NONE")) {
            case "MANUAL" -> {
                var projects = new TreeMap<String, Set<String>>();
                for (JsonNode p : show.path("selectedProjects")) {
                    var branches = new LinkedHashSet<String>();
                    p.path("selectedBranches").forEach(b -> branches.add(b.asText()));
                    projects.put(p.path("projectKey").asText(), branches);
                }
                yield new Manual(projects);
            }
            case "REGEXP" -> new Regexp(show.path("regexp").asText(), branch);
            case "TAGS" -> new Tags(textList(show.path("tags")), branch);
            case "REST" -> new Rest(branch);
            default -> new None();
        };
    }

    private static void putBranch(ObjectNode node, String branch) {
        if (branch != null) {
            node.put("branch", branch);
        }
    }

    private static List<String> textList(JsonNode array) {
        var values = new ArrayList<String>();
        array.forEach(v -> values.add(v.asText()));
        return values;
    }
}
