package com.hcltech.rebac.graph;

import java.util.List;
import java.util.Objects;

/**
 * An entity that holds the expanded permission, with one shortest witness path: the permission
 * sets crossed going from the entity to the expanded set. The last element is always the
 * expanded set.
 */
public record ExpandResult(Entity entity, List<PermissionSet> path) {
    public ExpandResult {
        Objects.requireNonNull(entity, "entity");
        path = List.copyOf(path);
        if (path.isEmpty()) throw new IllegalArgumentException("Witness path for " + entity + " is empty");
    }
}
