package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.QualityProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Profiles are composed in document order, parents first, so that a child's
 * inherited rules are final before its own differences are applied.
 */
class QualityProfileImportStrategy implements ImportStrategy {

    private static final Logger log = LoggerFactory.getLogger(QualityProfileImportStrategy.class);

    @Override
    public ObjectType type() {
        return ObjectType.QUALITY_PROFILE;
    }

    @Override
    public List<ImportItem> items(JsonNode section) {
        return QualityProfileTrees.fromSection(section);
    }

    @Override
    public Optional<String> skipReason(ImportItem item) {
        return item.data().path("isBuiltIn").asBoolean(false) ? Optional.of("built-in") : Optional.empty();
    }

    @Override
    public boolean exists(Platform platform, ImportItem item) {
        return QualityProfile.exists(platform, item.text("language"), item.text("name"));
    }

    @Override
    public void create(Platform platform, ImportItem item) {
        QualityProfile.create(platform, item.text("language"), item.text("name"));
    }

    @Override
    public boolean composeInOrder() {
        return true;
    }

    @Override
    public void compose(Platform platform, ImportItem item) {
        var profile = QualityProfile.get(platform, item.text("language"), item.text("name"));
        if (profile.isBuiltIn()) {
            return;
        }
        var parent = item.text("parent");
        if (parent != null && !parent.equals(profile.parentName().orElse(null))) {
            profile.setParent(parent);
            profile.refresh();
        }

        var current = profile.rules();
        var activate = new LinkedHashMap<String, JsonNode>();
        item.data().path("rules").fields().forEachRemaining(rule -> {
            if (!rule.getValue().equals(current.get(rule.getKey()))) {
                activate.put(rule.getKey(), rule.getValue());
            }
        });
        var deactivate = current.keySet().stream()
                .filter(rule -> !item.data().path("rules").has(rule))
                .toList();
        log.debug("{}: {} rules to activate, {} to deactivate", item, activate.size(), deactivate.size());
        profile.applyRuleChanges(activate, deactivate);
    }
}
