package com.hcltech.rebac.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reverse breadth-first search from a permission set to every entity that can reach it.
 * <p>
 * Each discovered node remembers the node that discovered it. The first discovery wins, so each
 * entity gets a shortest path and appears once.
 */
public final class Expansion {
    private Expansion() {}

    /** Entities in discovery order (nearest first). */
    public static List<ExpandResult> expand(TupleStore store, PermissionSet dst) {
        Map<Node, PermissionSet> discoveredBy = new HashMap<>();
        Set<Node> visited = new LinkedHashSet<>();
        visited.add(dst);
        Deque<PermissionSet> queue = new ArrayDeque<>();
        queue.add(dst);
        List<ExpandResult> results = new ArrayList<>();

        while (!queue.isEmpty()) {
            PermissionSet node = queue.poll();
            for (Node predecessor : store.predecessors(node)) {
                if (!visited.add(predecessor)) continue;
                discoveredBy.put(predecessor, node);
                if (predecessor instanceof Entity entity)
                    results.add(new ExpandResult(entity, witnessPath(entity, discoveredBy)));
                else if (predecessor instanceof PermissionSet set)
                    queue.add(set);
            }
        }
        return results;
    }

    // dst has no entry in discoveredBy, which ends the walk
    static List<PermissionSet> witnessPath(Entity entity, Map<Node, PermissionSet> discoveredBy) {
        List<PermissionSet> path = new ArrayList<>();
        for (PermissionSet at = discoveredBy.get(entity); at != null; at = discoveredBy.get(at))
            path.add(at);
        return path;
    }
}
