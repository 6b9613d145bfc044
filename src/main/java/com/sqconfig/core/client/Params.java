package com.sqconfig.core.client;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds request parameter maps from key/value pairs, dropping pairs whose value is null.
 */
public final class Params {

    private Params() {}

    public static Map<String, String> of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Parameters must be key/value pairs");
        }
        var params = new LinkedHashMap<String, String>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                params.put(keyValues[i], keyValues[i + 1]);
            }
        }
        return params;
    }
}
