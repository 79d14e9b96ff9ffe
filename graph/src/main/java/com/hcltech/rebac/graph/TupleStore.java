package com.hcltech.rebac.graph;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Edge set indexed by source (forward), by destination (reverse) and by wildcard group, so a
 * node's wildcard sibling or a wildcard's members are found without a scan.
 * <p>
 * Not thread safe. {@link MemoryRelationGraph} owns one and guards it.
 */
public final class TupleStore {
    private final Map<Node, Set<PermissionSet>> out = new LinkedHashMap<>();
    private final Map<PermissionSet, Set<Node>> in = new LinkedHashMap<>();
    /** wildcard sibling -> sources in that group that have outgoing edges */
    private final Map<Node, Set<Node>> sourcesByGroup = new LinkedHashMap<>();
    /** wildcard sibling -> destinations in that group that have incoming edges */
    private final Map<PermissionSet, Set<PermissionSet>> destinationsByGroup = new LinkedHashMap<>();
    private int edgeCount;

    /** @return true if the edge was added, false if it was already present */
    public boolean grant(Node src, PermissionSet dst) {
        if (!out.computeIfAbsent(src, k -> new LinkedHashSet<>()).add(dst)) return false;
        in.computeIfAbsent(dst, k -> new LinkedHashSet<>()).add(src);
        sourcesByGroup.computeIfAbsent(src.wildcardSibling(), k -> new LinkedHashSet<>()).add(src);
        destinationsByGroup.computeIfAbsent(dst.wildcardSibling(), k -> new LinkedHashSet<>()).add(dst);
        edgeCount++;
        return true;
    }

    /** @return true if the edge was removed, false if it was not present */
    public boolean revoke(Node src, PermissionSet dst) {
        Set<PermissionSet> dsts = out.get(src);
        if (dsts == null || !dsts.remove(dst)) return false;
        if (dsts.isEmpty()) {
            out.remove(src);
            removeFromGroup(sourcesByGroup, src.wildcardSibling(), src);
        }
        Set<Node> srcs = in.get(dst);
        srcs.remove(src);
        if (srcs.isEmpty()) {
            in.remove(dst);
            removeFromGroup(destinationsByGroup, dst.wildcardSibling(), dst);
        }
        edgeCount--;
        return true;
    }

    /** Literal membership: no wildcard matching, no transitivity. */
    public boolean exists(Node src, PermissionSet dst) {
        Set<PermissionSet> dsts = out.get(src);
        return dsts != null && dsts.contains(dst);
    }

    /** Destinations of every stored edge whose source matches {@code node}. */
    public Set<PermissionSet> successors(Node node) {
        Set<PermissionSet> result = new LinkedHashSet<>();
        for (Node source : Wildcards.storedMatches(node, sourcesByGroup))
            result.addAll(out.get(source));
        return result;
    }

    /** Sources of every stored edge whose destination matches {@code node}. */
    public Set<Node> predecessors(PermissionSet node) {
        Set<Node> result = new LinkedHashSet<>();
        for (PermissionSet destination : Wildcards.storedMatches(node, destinationsByGroup))
            result.addAll(in.get(destination));
        return result;
    }

    public int edgeCount() {
        return edgeCount;
    }

    /** Distinct nodes that appear in at least one edge. */
    public int nodeCount() {
        Set<Node> nodes = new LinkedHashSet<>(out.keySet());
        nodes.addAll(in.keySet());
        return nodes.size();
    }

    private static <N extends Node> void removeFromGroup(Map<N, Set<N>> byGroup, N group, N member) {
        Set<N> members = byGroup.get(group);
        if (members == null) return;
        members.remove(member);
        if (members.isEmpty()) byGroup.remove(group);
    }
}
