package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Edition;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.Application;
import com.sqconfig.core.model.ObjectType;

import java.util.List;

/**
 * Applications get their projects added in the second pass, once every project
 * of the document exists. Application branches are not imported.
 */
class ApplicationImportStrategy implements ImportStrategy {

    @Override
    public ObjectType type() {
        return ObjectType.APPLICATION;
    }

    @Override
    public void checkSupported(Platform platform) {
        platform.requireEdition(Edition.DEVELOPER, "Applications");
    }

    @Override
    public List<ImportItem> items(JsonNode section) {
        return ImportItem.fromSection(type(), section);
    }

    @Override
    public boolean exists(Platform platform, ImportItem item) {
        return Application.exists(platform, item.key());
    }

    @Override
    public void create(Platform platform, ImportItem item) {
        var name = item.text("name");
        Application.create(platform, item.key(), name != null ? name : item.key(),
                item.text("description"), item.text("visibility"));
    }

    @Override
    public void compose(Platform platform, ImportItem item) {
        var application = Application.get(platform, item.key());
        var current = application.projects();
        boolean changed = false;
        for (JsonNode project : item.data().path("projects")) {
            if (!current.contains(project.asText())) {
                application.addProject(project.asText());
                changed = true;
            }
        }
        if (item.data().has("permissions")) {
            application.setPermissions(item.data().path("permissions"));
        }
        if (changed) {
            application.refresh();
        }
    }
}
