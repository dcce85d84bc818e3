package com.borrowfacts.core;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * Collapses the isolated chains of a fact set's control-flow graph.
 *
 * Each chain is walked left to right with an anchor point, initially the chain head. A link
 * {@code anchor -> next} is collapsed when no fact tells the two points apart; the anchor then
 * stays put so consecutive collapsible links fold into it. A link that cannot be collapsed
 * moves the anchor to {@code next}.
 *
 * The pass rewrites the {@link AllFacts} in place and runs once per chain; chains are
 * vertex-disjoint so their order does not affect the result. Running it again on its own
 * output changes nothing.
 */
public class CfgSimplifier {

    private final CfgGraphAnalyzer analyzer;

    public CfgSimplifier() {
        this(new CfgGraphAnalyzer());
    }

    public CfgSimplifier(CfgGraphAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public SimplificationReport simplify(AllFacts facts) {
        SimplificationReport report = new SimplificationReport();
        report.edgesBefore = facts.cfgEdges().size();

        List<List<Point>> chains = analyzer.isolatedChains(facts.cfgEdges());
        report.chainCount = chains.size();
        for (List<Point> chain : chains) {
            simplifyChain(facts, chain, report);
        }

        report.edgesAfter = facts.cfgEdges().size();
        Collections.sort(report.removedPoints);
        return report;
    }

    void simplifyChain(AllFacts facts, List<Point> chain, SimplificationReport report) {
        Point anchor = chain.get(0);
        for (Point next : chain.subList(1, chain.size())) {
            if (!isEdgeCollapsible(facts, anchor, next)) {
                report.breakPoints++;
                anchor = next;
                continue;
            }
            Point removed = collapseEdge(facts, anchor, next);
            if (removed == null) {
                report.skippedEdges++;
            } else {
                report.collapsedEdges++;
                report.removedPoints.add(removed.index());
            }
        }
    }

    /**
     * Two points may be merged only if they see the same live regions and neither carries a
     * kill, an outlives constraint or an invalidation. {@code borrow_region} and
     * {@code universal_region} do not take part in the decision.
     */
    boolean isEdgeCollapsible(AllFacts facts, Point first, Point second) {
        return new HashSet<>(facts.liveRegionsAt(first)).equals(new HashSet<>(facts.liveRegionsAt(second)))
                && facts.killedAt(first).isEmpty()
                && facts.killedAt(second).isEmpty()
                && facts.outlivesAt(first).isEmpty()
                && facts.outlivesAt(second).isEmpty()
                && facts.invalidatesAt(first).isEmpty()
                && facts.invalidatesAt(second).isEmpty();
    }

    /**
     * Merges {@code second} into {@code first} when {@code second} still has successors,
     * otherwise {@code first} into {@code second} when {@code first} still has predecessors.
     * When neither holds the edge is left alone.
     *
     * @return the point that was merged away, or null if nothing changed
     */
    Point collapseEdge(AllFacts facts, Point first, Point second) {
        if (!facts.isEndpoint(second)) {
            facts.removeFactsAt(second);
            facts.removeCfgEdge(first, second);
            facts.redirectSources(second, first);
            return second;
        }
        if (!facts.isStartpoint(first)) {
            facts.removeFactsAt(first);
            facts.removeCfgEdge(first, second);
            facts.redirectTargets(first, second);
            return first;
        }
        return null;
    }
}
