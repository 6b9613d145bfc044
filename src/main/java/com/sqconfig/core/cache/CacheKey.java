package com.sqconfig.core.cache;

import com.sqconfig.core.model.ObjectType;

import java.util.List;

/**
 * Identity of a remote object: the endpoint it lives on, its type and the
 * ordered fields that make it unique for that type (a project key, a gate name,
 * a profile's language and name...).
 */
public record CacheKey(String endpoint, ObjectType type, List<String> fields) {

    public CacheKey {
        fields = List.copyOf(fields);
    }

    public static CacheKey of(String endpoint, ObjectType type, String... fields) {
        return new CacheKey(endpoint, type, List.of(fields));
    }

    @Override
    public String toString() {
        return type.section() + ":" + String.join(":", fields) + "@" + endpoint;
    }
}
