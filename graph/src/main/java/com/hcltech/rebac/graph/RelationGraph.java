package com.hcltech.rebac.graph;

import java.util.List;

/**
 * Relationship-based access control store: a set of granted edges plus the queries over it.
 * <p>
 * All methods are safe to call concurrently. Malformed nodes are rejected with
 * {@link InvalidArgumentException} before the graph is touched. Unknown nodes are never an error:
 * revoking an absent edge is a no-op and queries about unknown nodes answer {@code false} or an
 * empty list.
 */
public interface RelationGraph {

    /** Adds the edge if absent. @return true if the graph changed */
    boolean grant(Node src, PermissionSet dst);

    /** Removes the edge if present. @return true if the graph changed */
    boolean revoke(Node src, PermissionSet dst);

    /** True iff exactly this edge is stored. No wildcard matching, no transitivity. */
    boolean exists(Node src, PermissionSet dst);

    /** True iff {@code dst} is reachable from {@code src}, with wildcard matching at every step. */
    boolean isPermitted(Node src, PermissionSet dst);

    /**
     * As {@link #isPermitted(Node, PermissionSet)}, giving up after {@code maxDepth} edges.
     * {@code maxDepth <= 0} means unlimited.
     */
    boolean isPermitted(Node src, PermissionSet dst, int maxDepth);

    /** Every entity that can reach {@code dst}, once each, with a shortest witness path. */
    List<ExpandResult> expand(PermissionSet dst);

    int edgeCount();

    int nodeCount();
}
