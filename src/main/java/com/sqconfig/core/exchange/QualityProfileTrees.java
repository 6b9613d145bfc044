package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.hierarchy.HierarchyNode;
import com.sqconfig.core.hierarchy.HierarchyReconciler;
import com.sqconfig.core.hierarchy.TreeFields;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.QualityProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Quality profile section of an export document: one tree per language, each
 * child profile carrying only its rule differences with its parent.
 *
 * <pre>
 * "java": {
 *   "Base": {"name": "Base", "rules": {...}, "children": {
 *     "Strict": {"name": "Strict", "addedRules": {...}, "removedRules": [...]}}}}
 * </pre>
 */
final class QualityProfileTrees {

    static final TreeFields FIELDS = TreeFields.of("rules");

    private QualityProfileTrees() {}

    /**
     * @param exported profile exports as produced by {@link QualityProfile#export}
     * @return language to profile tree, languages sorted
     */
    static Map<String, ObjectNode> toSection(List<ObjectNode> exported, ObjectMapper mapper) {
        var byLanguage = new TreeMap<String, List<HierarchyNode>>();
        exported.stream()
                .sorted(Comparator.comparing((ObjectNode p) -> p.path("name").asText()))
                .forEach(p -> byLanguage.computeIfAbsent(p.path("language").asText(), l -> new ArrayList<>())
                        .add(toNode(p)));
        var section = new LinkedHashMap<String, ObjectNode>();
        byLanguage.forEach((language, nodes) -> section.put(language,
                HierarchyReconciler.toTree(HierarchyReconciler.hierarchize(nodes), FIELDS, mapper)));
        return section;
    }

    /**
     * Flattens every language tree, parents before children, each profile with
     * its full rule set rebuilt.
     */
    static List<ImportItem> fromSection(JsonNode section) {
        var items = new ArrayList<ImportItem>();
        section.fields().forEachRemaining(language -> {
            var hierarchy = HierarchyReconciler.fromTree(language.getValue(), FIELDS);
            for (var node : HierarchyReconciler.flatten(hierarchy)) {
                var data = node.attributes().deepCopy();
                data.put("name", node.key());
                data.put("language", language.getKey());
                if (node.parentKey() != null) {
                    data.put("parent", node.parentKey());
                }
                var rules = data.putObject("rules");
                node.content().forEach(rules::set);
                items.add(new ImportItem(ObjectType.QUALITY_PROFILE,
                        QualityProfile.qualifiedKey(language.getKey(), node.key()), data));
            }
        });
        return items;
    }

    private static HierarchyNode toNode(ObjectNode profile) {
        var attributes = profile.deepCopy();
        attributes.remove(List.of("rules", "parent", "language"));
        var rules = new LinkedHashMap<String, JsonNode>();
        profile.path("rules").fields().forEachRemaining(e -> rules.put(e.getKey(), e.getValue()));
        var parent = profile.path("parent").asText(null);
        return new HierarchyNode(profile.path("name").asText(), parent, attributes, rules);
    }
}
