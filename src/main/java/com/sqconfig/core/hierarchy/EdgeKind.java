package com.sqconfig.core.hierarchy;

/**
 * Kind of a parent/child edge. An owned child lives and dies with its parent; a
 * referenced child is an independent node that survives removal of the referrer.
 */
public enum EdgeKind {
    OWNED,
    REFERENCE
}
