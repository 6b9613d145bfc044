package com.sqconfig.core.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Difference of a child's content against its parent's.
 *
 * @param added    entries absent from the parent
 * @param modified entries present in both with a different value (child's value)
 * @param removed  keys present in the parent only
 */
public record ContentDiff(Map<String, JsonNode> added, Map<String, JsonNode> modified, Set<String> removed) {

    public ContentDiff {
        added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
        modified = Collections.unmodifiableMap(new LinkedHashMap<>(modified));
        removed = Collections.unmodifiableSet(new LinkedHashSet<>(removed));
    }

    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && removed.isEmpty();
    }
}
