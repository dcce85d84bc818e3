package com.borrowfacts.core;

import com.borrowfacts.core.FactModel.CfgEdge;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class CfgGraphAnalyzerTest {

    private final CfgGraphAnalyzer analyzer = new CfgGraphAnalyzer();

    private static List<CfgEdge> edges(int... pairs) {
        List<CfgEdge> edges = new ArrayList<>();
        for (int i = 0; i < pairs.length; i += 2) {
            edges.add(CfgEdge.of(pairs[i], pairs[i + 1]));
        }
        return edges;
    }

    private static List<Point> chain(int... points) {
        List<Point> chain = new ArrayList<>();
        for (int p : points) chain.add(Point.of(p));
        return chain;
    }

    @Test
    void straightLineIsOneChain() {
        List<List<Point>> chains = analyzer.isolatedChains(edges(0, 1, 1, 2, 2, 3));
        assertEquals(List.of(chain(0, 1, 2, 3)), chains);
    }

    @Test
    void forkDisqualifiesEveryEdgeFromTheBranchingPoint() {
        Map<Point, Point> isolated = analyzer.isolatedEdges(edges(0, 1, 1, 2, 2, 3, 3, 4, 2, 5, 5, 6));

        assertFalse(isolated.containsKey(Point.of(2)));
        assertEquals(Point.of(1), isolated.get(Point.of(0)));
        assertEquals(Point.of(2), isolated.get(Point.of(1)));
        assertEquals(Point.of(4), isolated.get(Point.of(3)));
        assertEquals(Point.of(6), isolated.get(Point.of(5)));
        assertEquals(4, isolated.size());
    }

    @Test
    void joinDisqualifiesEveryEdgeIntoTheJoiningPoint() {
        Map<Point, Point> isolated = analyzer.isolatedEdges(edges(0, 2, 1, 2, 2, 3));
        assertEquals(Map.of(Point.of(2), Point.of(3)), isolated);
    }

    @Test
    void duplicatedEdgeIsNotIsolated() {
        assertTrue(analyzer.isolatedEdges(edges(0, 1, 0, 1)).isEmpty());
    }

    @Test
    void chainsAreOrderedByHead() {
        List<List<Point>> chains = analyzer.isolatedChains(edges(7, 8, 8, 9, 0, 1, 1, 2, 2, 3));
        assertEquals(List.of(chain(0, 1, 2, 3), chain(7, 8, 9)), chains);
    }

    @Test
    void loopGraphYieldsFourChains() {
        List<List<Point>> chains = analyzer.isolatedChains(
                edges(0, 1, 1, 2, 2, 3, 3, 4, 4, 5, 5, 6, 6, 7, 7, 8, 8, 9, 3, 10, 10, 11, 11, 8));
        assertEquals(
                List.of(chain(0, 1, 2, 3), chain(4, 5, 6, 7), chain(8, 9), chain(10, 11)),
                chains);
    }

    @Test
    void chainsAreVertexDisjoint() {
        List<List<Point>> chains = analyzer.isolatedChains(
                edges(0, 1, 1, 2, 2, 3, 3, 4, 2, 5, 5, 6, 6, 7, 9, 10, 10, 11, 11, 9, 12, 12));

        Set<Point> seen = new HashSet<>();
        for (List<Point> c : chains) {
            assertTrue(c.size() >= 2);
            for (Point p : c) {
                assertTrue(seen.add(p), p + " appears in two chains");
            }
        }
    }

    @Test
    void pureCycleHasNoChain() {
        assertTrue(analyzer.isolatedChains(edges(0, 1, 1, 2, 2, 0)).isEmpty());
    }

    @Test
    void emptyGraphHasNoChain() {
        assertTrue(analyzer.isolatedChains(Collections.emptyList()).isEmpty());
    }
}
