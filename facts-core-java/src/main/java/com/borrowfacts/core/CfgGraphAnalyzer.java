package com.borrowfacts.core;

import com.borrowfacts.core.FactModel.CfgEdge;

import java.util.*;

/**
 * Finds the straight-line parts of a control-flow graph.
 *
 * An edge {@code p -> q} is isolated when it is the only edge leaving p and the only edge
 * entering q. A chain is a maximal run of points joined end to end by isolated edges.
 */
public class CfgGraphAnalyzer {

    /**
     * Maps each point with a unique successor to that successor, keeping only the pairs where
     * the successor's unique predecessor is the point itself.
     *
     * Counts are taken over the full edge multiset: a duplicated edge {@code p -> q} gives p two
     * successors and q two predecessors, so neither side is unique.
     *
     * @param edges the control-flow edges, possibly with cycles, forks, joins and duplicates
     * @return source to unique successor, ordered by source point
     */
    public SortedMap<Point, Point> isolatedEdges(Collection<CfgEdge> edges) {
        Map<Point, Point> successor = new HashMap<>();
        Map<Point, Point> predecessor = new HashMap<>();
        Set<Point> branching = new HashSet<>();
        Set<Point> joining = new HashSet<>();

        for (CfgEdge edge : edges) {
            // A second candidate makes the slot ambiguous for good.
            if (successor.putIfAbsent(edge.from(), edge.to()) != null) {
                branching.add(edge.from());
            }
            if (predecessor.putIfAbsent(edge.to(), edge.from()) != null) {
                joining.add(edge.to());
            }
        }

        SortedMap<Point, Point> isolated = new TreeMap<>();
        for (Map.Entry<Point, Point> entry : successor.entrySet()) {
            Point p = entry.getKey();
            Point q = entry.getValue();
            if (!branching.contains(p) && !joining.contains(q)) {
                isolated.put(p, q);
            }
        }
        return isolated;
    }

    /**
     * Splits the isolated edges into maximal chains.
     *
     * A chain starts at a head (the source of an isolated edge that is not itself the target of
     * one) and follows unique successors, consuming each edge as it goes. Heads are visited in
     * index order. Cycles made only of isolated edges have no head and yield no chain.
     *
     * @return vertex-disjoint chains, each with at least two points
     */
    public List<List<Point>> isolatedChains(Collection<CfgEdge> edges) {
        SortedMap<Point, Point> isolated = isolatedEdges(edges);

        SortedSet<Point> heads = new TreeSet<>(isolated.keySet());
        heads.removeAll(isolated.values());

        List<List<Point>> chains = new ArrayList<>();
        for (Point head : heads) {
            List<Point> chain = new ArrayList<>();
            chain.add(head);

            Point current = head;
            Point next;
            while ((next = isolated.remove(current)) != null) {
                chain.add(next);
                current = next;
            }
            chains.add(chain);
        }
        return chains;
    }
}
