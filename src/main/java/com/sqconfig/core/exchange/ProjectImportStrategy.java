package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.Project;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects are created empty; branches only come into existence through analysis
 * and are not imported.
 */
class ProjectImportStrategy implements ImportStrategy {

    @Override
    public ObjectType type() {
        return ObjectType.PROJECT;
    }

    @Override
    public List<ImportItem> items(JsonNode section) {
        return ImportItem.fromSection(type(), section);
    }

    @Override
    public boolean exists(Platform platform, ImportItem item) {
        return Project.exists(platform, item.key());
    }

    @Override
    public void create(Platform platform, ImportItem item) {
        var name = item.text("name");
        Project.create(platform, item.key(), name != null ? name : item.key(), item.text("visibility"));
    }

    @Override
    public void compose(Platform platform, ImportItem item) {
        var project = Project.get(platform, item.key());
        var data = item.data();

        var visibility = item.text("visibility");
        if (visibility != null && !visibility.equals(project.visibility())) {
            project.setVisibility(visibility);
        }
        if (data.has("tags")) {
            var tags = new ArrayList<String>();
            data.path("tags").forEach(t -> tags.add(t.asText()));
            if (!tags.equals(project.tags())) {
                project.setTags(tags);
            }
        }
        var gate = item.text("qualityGate");
        if (gate != null && !gate.equals(project.qualityGate().orElse(null))) {
            project.setQualityGate(gate);
        }
        if (data.has("qualityProfiles")) {
            var current = project.qualityProfiles();
            data.path("qualityProfiles").fields().forEachRemaining(e -> {
                if (!e.getValue().asText().equals(current.get(e.getKey()))) {
                    project.setQualityProfile(e.getKey(), e.getValue().asText());
                }
            });
        }
        if (data.has("permissions")) {
            project.setPermissions(data.path("permissions"));
        }
    }
}
