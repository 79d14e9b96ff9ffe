package com.hcltech.rebac.graph;

/**
 * A vertex of the relation graph: either a concrete {@link Entity} or a {@link PermissionSet}.
 * Equality is structural, so two nodes with the same fields are the same vertex.
 * <p>
 * The id {@value #WILDCARD_ID} is reserved. A node with that id stands for every id of its
 * namespace (and relation, for a permission set).
 */
public sealed interface Node permits Entity, PermissionSet {

    String WILDCARD_ID = "*";

    String namespace();

    String id();

    default boolean isWildcard() {
        return WILDCARD_ID.equals(id());
    }

    /** Same namespace (and relation), id replaced by {@value #WILDCARD_ID}. A wildcard is its own sibling. */
    Node wildcardSibling();
}
