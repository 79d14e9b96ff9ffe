package com.hcltech.rebac.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Forward breadth-first search answering "is {@code dst} reachable from {@code src}".
 * Edges are followed with wildcard matching on both the node being expanded and the target.
 * <p>
 * Terminates on cyclic graphs: every node is expanded at most once, and only nodes that appear in
 * stored edges can ever be discovered.
 */
public final class Reachability {
    /** Passed as {@code maxDepth} for an unbounded search. */
    public static final int UNLIMITED = 0;

    private Reachability() {}

    public static boolean isPermitted(TupleStore store, Node src, PermissionSet dst) {
        return isPermitted(store, src, dst, UNLIMITED);
    }

    /**
     * @param maxDepth maximum number of edges on the path; {@code <= 0} means unlimited
     */
    public static boolean isPermitted(TupleStore store, Node src, PermissionSet dst, int maxDepth) {
        Set<Node> visited = new LinkedHashSet<>();
        visited.add(src);
        List<Node> frontier = List.of(src);
        int depth = 0;
        while (!frontier.isEmpty()) {
            depth++;
            if (maxDepth > 0 && depth > maxDepth) return false;
            List<Node> next = new ArrayList<>();
            for (Node node : frontier) {
                for (PermissionSet successor : store.successors(node)) {
                    if (Wildcards.matches(successor, dst)) return true;
                    if (visited.add(successor)) next.add(successor);
                }
            }
            frontier = next;
        }
        return false;
    }
}
