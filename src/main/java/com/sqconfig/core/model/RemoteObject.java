package com.sqconfig.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqconfig.core.cache.CacheKey;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.error.ObjectNotFoundException;

/**
 * In-memory representative of one configuration object on a platform.
 *
 * <p>The payload mirrors the latest state fetched from the platform. Derived data
 * (rules, conditions, permissions, members...) is loaded lazily by subclasses under
 * the object's own monitor. Instances are only ever obtained through the
 * platform's {@link com.sqconfig.core.cache.RemoteObjectCache}.
 */
public abstract class RemoteObject {

    protected final Platform platform;
    private final CacheKey cacheKey;
    private ObjectNode payload;

    protected RemoteObject(Platform platform, CacheKey cacheKey, JsonNode payload) {
        this.platform = platform;
        this.cacheKey = cacheKey;
        this.payload = payload != null && payload.isObject()
                ? ((ObjectNode) payload).deepCopy()
                : platform.mapper().createObjectNode();
    }

    public abstract ObjectType type();

    public abstract String key();

    public String name() {
        return payload().path("name").asText(key());
    }

    /**
     * Link to the object in the platform UI.
     */
    public abstract String url();

    public CacheKey cacheKey() {
        return cacheKey;
    }

    public Platform platform() {
        return platform;
    }

    public synchronized ObjectNode payload() {
        return payload;
    }

    /**
     * Re-reads the object from the platform, bypassing the cache. If the object no
     * longer exists its cache entry is dropped and the not-found error rethrown.
     */
    public final void refresh() {
        JsonNode fresh;
        try {
            fresh = fetch();
        } catch (ObjectNotFoundException e) {
            platform.cache().invalidate(this);
            throw e;
        }
        synchronized (this) {
            payload = fresh.isObject() ? ((ObjectNode) fresh).deepCopy() : platform.mapper().createObjectNode();
            resetDerived();
        }
    }

    /**
     * Reads the current remote state of this object.
     */
    protected abstract JsonNode fetch();

    /**
     * Clears lazily loaded data after a refresh. Called with the object's monitor held.
     */
    protected void resetDerived() {
    }

    public abstract ObjectNode export(ExportSettings settings);

    protected ObjectNode newNode() {
        return platform.mapper().createObjectNode();
    }

    @Override
    public String toString() {
        return type().label() + " '" + key() + "'";
    }
}
