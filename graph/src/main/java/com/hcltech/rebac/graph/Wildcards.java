package com.hcltech.rebac.graph;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The one place wildcard semantics live. Two nodes match when they are the same kind, have the
 * same namespace and (for permission sets) the same relation, and either their ids are equal or
 * at least one id is {@value Node#WILDCARD_ID}. The relation is never generalised.
 */
public final class Wildcards {
    private Wildcards() {}

    public static boolean matches(Node a, Node b) {
        if (a instanceof Entity ea && b instanceof Entity eb)
            return ea.namespace().equals(eb.namespace()) && idsMatch(ea.id(), eb.id());
        if (a instanceof PermissionSet pa && b instanceof PermissionSet pb)
            return pa.namespace().equals(pb.namespace())
                    && pa.relation().equals(pb.relation())
                    && idsMatch(pa.id(), pb.id());
        return false;
    }

    static boolean idsMatch(String a, String b) {
        return a.equals(b) || Node.WILDCARD_ID.equals(a) || Node.WILDCARD_ID.equals(b);
    }

    /**
     * Stored nodes matching {@code node}. A concrete node only needs itself and its wildcard
     * sibling. A wildcard matches every stored member of its group, found through
     * {@code byGroup} (keyed by wildcard sibling) without scanning the graph.
     */
    static <N extends Node> Set<N> storedMatches(N node, Map<N, Set<N>> byGroup) {
        @SuppressWarnings("unchecked")
        N sibling = (N) node.wildcardSibling();
        Set<N> group = byGroup.getOrDefault(sibling, Set.of());
        Collection<N> candidates = node.isWildcard() ? group : List.of(node, sibling);
        Set<N> result = new LinkedHashSet<>();
        for (N candidate : candidates)
            if (group.contains(candidate) && matches(node, candidate)) result.add(candidate);
        return result;
    }
}
