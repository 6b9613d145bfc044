package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.ObjectType;

import java.util.List;
import java.util.Optional;

/**
 * How one object type is imported in two passes: {@link #create} with scalar
 * attributes only, then {@link #compose} for everything that may refer to other
 * objects (children, references, rules, conditions, permissions).
 */
public interface ImportStrategy {

    ObjectType type();

    /**
     * @throws com.sqconfig.core.error.UnsupportedFeatureException if the platform
     *         cannot hold objects of this type
     */
    default void checkSupported(Platform platform) {
    }

    /**
     * Top-level objects of the type's document section, in creation order.
     */
    List<ImportItem> items(JsonNode section);

    /**
     * Reason why an item is left untouched, if any.
     */
    default Optional<String> skipReason(ImportItem item) {
        return Optional.empty();
    }

    boolean exists(Platform platform, ImportItem item);

    void create(Platform platform, ImportItem item);

    /**
     * Creates objects owned by the item that do not exist yet. Runs in the first
     * pass, whether the item was just created or already existed.
     */
    default void createOwned(Platform platform, ImportItem item) {
    }

    void compose(Platform platform, ImportItem item);

    /**
     * Whether the second pass must follow item order instead of running concurrently.
     */
    default boolean composeInOrder() {
        return false;
    }
}
