package com.sqconfig.core.writer;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a sectioned JSON document: {@code value} is written under
 * {@code document[section][key]}, or directly as {@code document[section]} when
 * {@code key} is null.
 */
public record SectionEntry(String section, String key, JsonNode value) {

    public static SectionEntry of(String section, String key, JsonNode value) {
        return new SectionEntry(section, key, value);
    }

    public static SectionEntry whole(String section, JsonNode value) {
        return new SectionEntry(section, null, value);
    }
}
