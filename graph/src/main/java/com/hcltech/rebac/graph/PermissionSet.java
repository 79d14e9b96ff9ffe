package com.hcltech.rebac.graph;

import java.util.Objects;

/** A named permission on an object, e.g. {@code files:foo.pdf#read}. Edges always point at one of these. */
public record PermissionSet(String namespace, String id, String relation) implements Node {
    public PermissionSet {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(relation, "relation");
    }

    public static PermissionSet wildcard(String namespace, String relation) {
        return new PermissionSet(namespace, WILDCARD_ID, relation);
    }

    @Override
    public PermissionSet wildcardSibling() {
        return isWildcard() ? this : wildcard(namespace, relation);
    }

    @Override
    public String toString() {
        return namespace + ":" + id + "#" + relation;
    }
}
