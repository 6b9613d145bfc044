package com.sqconfig.core.hierarchy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Arena of nodes addressed by key, with an owned-parent index and a children index.
 * Each node has at most one owning parent. No node can become its own ancestor:
 * {@link #link} refuses any edge that would close a cycle.
 */
public class Hierarchy {

    private final Map<String, HierarchyNode> nodes = new LinkedHashMap<>();
    private final Map<String, String> parents = new HashMap<>();
    private final Map<String, Map<String, EdgeKind>> children = new HashMap<>();

    public void add(HierarchyNode node) {
        if (nodes.putIfAbsent(node.key(), node) != null) {
            throw new IllegalArgumentException("Duplicate hierarchy key: " + node.key());
        }
    }

    public boolean contains(String key) {
        return nodes.containsKey(key);
    }

    public HierarchyNode node(String key) {
        return nodes.get(key);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Adds an edge from {@code parentKey} to {@code childKey}.
     *
     * @return false, leaving the hierarchy unchanged, if the edge would make a node its own ancestor
     * @throws IllegalArgumentException if a key is unknown, or an owned child already has an owner
     */
    public boolean link(String parentKey, String childKey, EdgeKind kind) {
        if (!nodes.containsKey(parentKey) || !nodes.containsKey(childKey)) {
            throw new IllegalArgumentException("Unknown node in edge " + parentKey + " -> " + childKey);
        }
        if (kind == EdgeKind.OWNED && parents.containsKey(childKey)) {
            throw new IllegalArgumentException("Node " + childKey + " already owned by " + parents.get(childKey));
        }
        if (reachable(childKey, parentKey)) {
            return false;
        }
        children.computeIfAbsent(parentKey, k -> new LinkedHashMap<>()).put(childKey, kind);
        if (kind == EdgeKind.OWNED) {
            parents.put(childKey, parentKey);
        }
        return true;
    }

    public Optional<String> parentOf(String key) {
        return Optional.ofNullable(parents.get(key));
    }

    public Map<String, EdgeKind> children(String key) {
        return Collections.unmodifiableMap(children.getOrDefault(key, Map.of()));
    }

    /**
     * Nodes without an owning parent, in insertion order.
     */
    public List<String> roots() {
        var roots = new ArrayList<String>();
        for (var key : nodes.keySet()) {
            if (!parents.containsKey(key)) {
                roots.add(key);
            }
        }
        return roots;
    }

    /**
     * Every key, each owning parent before its owned children.
     */
    public List<String> parentFirstOrder() {
        var order = new ArrayList<String>(nodes.size());
        var queue = new ArrayDeque<>(roots());
        while (!queue.isEmpty()) {
            var key = queue.poll();
            order.add(key);
            children(key).forEach((child, kind) -> {
                if (kind == EdgeKind.OWNED) {
                    queue.add(child);
                }
            });
        }
        return order;
    }

    /**
     * A node followed by its owned descendants, each owning parent before its children.
     */
    public List<String> subtree(String key) {
        var order = new ArrayList<String>();
        var queue = new ArrayDeque<String>();
        queue.add(key);
        while (!queue.isEmpty()) {
            var current = queue.poll();
            order.add(current);
            children(current).forEach((child, kind) -> {
                if (kind == EdgeKind.OWNED) {
                    queue.add(child);
                }
            });
        }
        return order;
    }

    /**
     * Owning chain of a node, nearest first.
     */
    public List<String> ancestors(String key) {
        var chain = new ArrayList<String>();
        var current = parents.get(key);
        while (current != null) {
            chain.add(current);
            current = parents.get(current);
        }
        return chain;
    }

    /**
     * Removes a node together with its owned descendants. Referenced children
     * only lose the edge; edges pointing to removed nodes are dropped.
     */
    public void remove(String key) {
        if (!nodes.containsKey(key)) {
            return;
        }
        for (var entry : new ArrayList<>(children(key).entrySet())) {
            if (entry.getValue() == EdgeKind.OWNED) {
                remove(entry.getKey());
            }
        }
        nodes.remove(key);
        children.remove(key);
        var owner = parents.remove(key);
        if (owner != null && children.containsKey(owner)) {
            children.get(owner).remove(key);
        }
        children.values().forEach(edges -> edges.remove(key));
    }

    private boolean reachable(String from, String to) {
        var seen = new HashSet<String>();
        var stack = new ArrayDeque<String>();
        stack.push(from);
        while (!stack.isEmpty()) {
            var key = stack.pop();
            if (key.equals(to)) {
                return true;
            }
            if (seen.add(key)) {
                children(key).keySet().forEach(stack::push);
            }
        }
        return false;
    }

    Set<String> keys() {
        return Collections.unmodifiableSet(nodes.keySet());
    }
}
