package com.sqconfig.core.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Converts between a flat keyed collection (each entry naming its parent) and a
 * hierarchy in which every child is expressed as a diff against its parent.
 *
 * <p>Round trip guarantees: {@code flatten(hierarchize(flat))} yields the same
 * entries as {@code flat} when every parent resolves and no cycle exists, and
 * {@code apply(parent, diff(child, parent))} equals {@code child}.
 */
public final class HierarchyReconciler {

    private static final Logger log = LoggerFactory.getLogger(HierarchyReconciler.class);

    private HierarchyReconciler() {}

    public static ContentDiff diff(Map<String, JsonNode> child, Map<String, JsonNode> parent) {
        var added = new LinkedHashMap<String, JsonNode>();
        var modified = new LinkedHashMap<String, JsonNode>();
        var removed = new LinkedHashSet<String>();
        child.forEach((key, value) -> {
            var inherited = parent.get(key);
            if (inherited == null) {
                added.put(key, value);
            } else if (!inherited.equals(value)) {
                modified.put(key, value);
            }
        });
        for (var key : parent.keySet()) {
            if (!child.containsKey(key)) {
                removed.add(key);
            }
        }
        return new ContentDiff(added, modified, removed);
    }

    public static Map<String, JsonNode> apply(Map<String, JsonNode> parent, ContentDiff diff) {
        var result = new LinkedHashMap<>(parent);
        diff.removed().forEach(result::remove);
        result.putAll(diff.modified());
        result.putAll(diff.added());
        return result;
    }

    /**
     * Builds the hierarchy of a flat collection. An entry whose parent is missing,
     * or whose parent link would close a cycle, is logged and kept as a root.
     */
    public static Hierarchy hierarchize(Collection<HierarchyNode> flat) {
        var hierarchy = new Hierarchy();
        flat.forEach(hierarchy::add);
        for (var node : flat) {
            var parentKey = node.parentKey();
            if (parentKey == null) {
                continue;
            }
            if (!hierarchy.contains(parentKey)) {
                log.error("Parent '{}' of '{}' not found, keeping '{}' as a root", parentKey, node.key(), node.key());
            } else if (!hierarchy.link(parentKey, node.key(), EdgeKind.OWNED)) {
                log.error("Parent '{}' of '{}' would create an inheritance cycle, keeping '{}' as a root",
                        parentKey, node.key(), node.key());
            }
        }
        return hierarchy;
    }

    /**
     * Flattens a hierarchy, parents first, with each entry's parent key restored
     * from its owning edge.
     */
    public static List<HierarchyNode> flatten(Hierarchy hierarchy) {
        var flat = new ArrayList<HierarchyNode>(hierarchy.size());
        for (var key : hierarchy.parentFirstOrder()) {
            flat.add(hierarchy.node(key).withParent(hierarchy.parentOf(key).orElse(null)));
        }
        return flat;
    }

    /**
     * Nested tree form: roots keyed by node key with their full content, owned
     * children nested under their parent with their diff only, referenced
     * children as {@code {"byReference": true}}.
     */
    public static ObjectNode toTree(Hierarchy hierarchy, TreeFields fields, ObjectMapper mapper) {
        var tree = mapper.createObjectNode();
        for (var root : hierarchy.roots()) {
            tree.set(root, treeNode(hierarchy, root, null, fields, mapper));
        }
        return tree;
    }

    /**
     * Inverse of {@link #toTree}: rebuilds every node's full content by applying
     * each diff to the reconstructed parent content.
     */
    public static Hierarchy fromTree(JsonNode tree, TreeFields fields) {
        var hierarchy = new Hierarchy();
        var references = new ArrayList<String[]>();
        tree.fields().forEachRemaining(e -> readNode(hierarchy, e.getKey(), e.getValue(), null, fields, references));
        for (var ref : references) {
            if (!hierarchy.contains(ref[1])) {
                log.error("Referenced node '{}' of '{}' not found", ref[1], ref[0]);
            } else if (!hierarchy.link(ref[0], ref[1], EdgeKind.REFERENCE)) {
                log.error("Reference '{}' -> '{}' would create a cycle, ignored", ref[0], ref[1]);
            }
        }
        return hierarchy;
    }

    private static ObjectNode treeNode(Hierarchy hierarchy, String key, Map<String, JsonNode> parentContent,
                                       TreeFields fields, ObjectMapper mapper) {
        var node = hierarchy.node(key);
        var json = node.attributes().deepCopy();
        if (fields.hasContent()) {
            writeContent(json, node.content(), parentContent, fields, mapper);
        }
        var children = hierarchy.children(key);
        if (!children.isEmpty()) {
            var childrenJson = json.putObject(fields.children());
            children.forEach((child, kind) -> {
                if (kind == EdgeKind.OWNED) {
                    childrenJson.set(child, treeNode(hierarchy, child, node.content(), fields, mapper));
                } else {
                    childrenJson.putObject(child).put("byReference", true);
                }
            });
        }
        return json;
    }

    private static void writeContent(ObjectNode json, Map<String, JsonNode> content, Map<String, JsonNode> parentContent,
                                     TreeFields fields, ObjectMapper mapper) {
        if (parentContent == null) {
            json.set(fields.content(), toObject(content, mapper));
            return;
        }
        var diff = diff(content, parentContent);
        if (!diff.added().isEmpty()) {
            json.set(fields.added(), toObject(diff.added(), mapper));
        }
        if (!diff.modified().isEmpty()) {
            json.set(fields.modified(), toObject(diff.modified(), mapper));
        }
        if (!diff.removed().isEmpty()) {
            var removed = json.putArray(fields.removed());
            diff.removed().forEach(removed::add);
        }
    }

    private static void readNode(Hierarchy hierarchy, String key, JsonNode json, HierarchyNode parent,
                                 TreeFields fields, List<String[]> references) {
        if (!json.isObject()) {
            log.warn("Ignoring '{}': expected an object, found {}", key, json.getNodeType());
            return;
        }
        var attributes = ((ObjectNode) json).deepCopy();
        attributes.remove(fields.children());
        Map<String, JsonNode> content;
        if (!fields.hasContent()) {
            content = Map.of();
        } else if (parent == null) {
            attributes.remove(List.of(fields.content(), fields.added(), fields.modified(), fields.removed()));
            content = toMap(json.path(fields.content()));
        } else {
            attributes.remove(List.of(fields.content(), fields.added(), fields.modified(), fields.removed()));
            var removed = new LinkedHashSet<String>();
            json.path(fields.removed()).forEach(r -> removed.add(r.asText()));
            content = apply(parent.content(),
                    new ContentDiff(toMap(json.path(fields.added())), toMap(json.path(fields.modified())), removed));
        }
        var node = new HierarchyNode(key, parent == null ? null : parent.key(), attributes, content);
        hierarchy.add(node);
        if (parent != null) {
            hierarchy.link(parent.key(), key, EdgeKind.OWNED);
        }
        json.path(fields.children()).fields().forEachRemaining(e -> {
            if (e.getValue().path("byReference").asBoolean(false)) {
                references.add(new String[]{key, e.getKey()});
            } else {
                readNode(hierarchy, e.getKey(), e.getValue(), node, fields, references);
            }
        });
    }

    private static ObjectNode toObject(Map<String, JsonNode> content, ObjectMapper mapper) {
        var object = mapper.createObjectNode();
        content.forEach(object::set);
        return object;
    }

    private static Map<String, JsonNode> toMap(JsonNode object) {
        var map = new LinkedHashMap<String, JsonNode>();
        object.fields().forEachRemaining(e -> map.put(e.getKey(), e.getValue()));
        return map;
    }
}
