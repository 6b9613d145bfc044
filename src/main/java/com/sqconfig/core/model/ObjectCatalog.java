package com.sqconfig.core.model;

import com.sqconfig.core.client.Platform;

import java.util.List;

/**
 * Lists every object of a given type on a platform.
 */
public final class ObjectCatalog {

    private ObjectCatalog() {}

    public static List<? extends RemoteObject> list(Platform platform, ObjectType type) {
        return switch (type) {
            case QUALITY_GATE -> List.copyOf(QualityGate.search(platform).values());
            case QUALITY_PROFILE -> QualityProfile.search(platform);
            case GROUP -> List.copyOf(Group.search(platform).values());
            case USER -> List.copyOf(User.search(platform).values());
            case PROJECT -> List.copyOf(Project.search(platform).values());
            case APPLICATION -> List.copyOf(Application.search(platform).values());
            case PORTFOLIO -> List.copyOf(Portfolio.search(platform).values());
        };
    }
}
