package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.model.ObjectType;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One top-level object of an import document.
 *
 * @param key  the key the object is filtered and reported by
 * @param data the object's definition as exported
 */
public record ImportItem(ObjectType type, String key, ObjectNode data) {

    /**
     * Items of a section keyed by object key, in document order.
     */
    public static List<ImportItem> fromSection(ObjectType type, JsonNode section) {
        var items = new ArrayList<ImportItem>();
        section.fields().forEachRemaining(e -> {
            if (e.getValue().isObject()) {
                items.add(new ImportItem(type, e.getKey(), (ObjectNode) e.getValue()));
            } else {
                LoggerFactory.getLogger(ImportItem.class)
                        .warn("Ignoring {} '{}': not an object definition", type.label(), e.getKey());
            }
        });
        return items;
    }

    public String text(String field) {
        var value = data.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    @Override
    public String toString() {
        return type.label() + " '" + key + "'";
    }
}
