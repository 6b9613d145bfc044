package com.sqconfig.core.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a flat hierarchical collection.
 *
 * @param key        unique key within the collection
 * @param parentKey  key of the owning parent, null for a root
 * @param attributes scalar attributes carried unchanged
 * @param content    keyed content diffed against the parent (e.g. active rules)
 */
public record HierarchyNode(String key, String parentKey, ObjectNode attributes, Map<String, JsonNode> content) {

    public HierarchyNode {
        content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    public HierarchyNode withParent(String newParent) {
        return new HierarchyNode(key, newParent, attributes, content);
    }
}
