package com.sqconfig.core.hierarchy;

/**
 * Field names of the nested tree form. A root carries its full content under
 * {@code content}; a child carries only its diff under {@code added},
 * {@code modified} and {@code removed}.
 */
public record TreeFields(String content, String added, String modified, String removed, String children) {

    /**
     * Derives the diff field names from the content name: {@code rules} gives
     * {@code addedRules}, {@code modifiedRules}, {@code removedRules}.
     */
    public static TreeFields of(String content) {
        var suffix = Character.toUpperCase(content.charAt(0)) + content.substring(1);
        return new TreeFields(content, "added" + suffix, "modified" + suffix, "removed" + suffix, "children");
    }

    /**
     * Tree carrying structure only: nodes keep all their fields as attributes.
     */
    public static TreeFields childrenOnly(String children) {
        return new TreeFields(null, null, null, null, children);
    }

    public boolean hasContent() {
        return content != null;
    }
}
