package com.hcltech.rebac.graph;

import java.util.Objects;

/** A concrete actor or object, e.g. {@code users:alice}. */
public record Entity(String namespace, String id) implements Node {
    public Entity {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(id, "id");
    }

    public static Entity wildcard(String namespace) {
        return new Entity(namespace, WILDCARD_ID);
    }

    @Override
    public Entity wildcardSibling() {
        return isWildcard() ? this : wildcard(namespace);
    }

    @Override
    public String toString() {
        return namespace + ":" + id;
    }
}
