package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.Group;
import com.sqconfig.core.model.ObjectType;

import java.util.List;

class GroupImportStrategy implements ImportStrategy {

    @Override
    public ObjectType type() {
        return ObjectType.GROUP;
    }

    @Override
    public List<ImportItem> items(JsonNode section) {
        return ImportItem.fromSection(type(), section);
    }

    @Override
    public boolean exists(Platform platform, ImportItem item) {
        return Group.exists(platform, item.key());
    }

    @Override
    public void create(Platform platform, ImportItem item) {
        Group.create(platform, item.key(), item.text("description"));
    }

    @Override
    public void compose(Platform platform, ImportItem item) {
        var group = Group.get(platform, item.key());
        var description = item.text("description");
        if (description != null && !description.equals(group.description())) {
            group.setDescription(description);
        }
    }
}
