package com.hcltech.rebac.graph;

import java.util.Objects;

/** Directed relation: {@code source} is granted {@code destination}. */
public record Edge(Node source, PermissionSet destination) {
    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}
