package com.borrowfacts.core;

import com.borrowfacts.core.FactModel.BorrowRegion;
import com.borrowfacts.core.FactModel.CfgEdge;
import com.borrowfacts.core.FactModel.Invalidates;
import com.borrowfacts.core.FactModel.Killed;
import com.borrowfacts.core.FactModel.Outlives;
import com.borrowfacts.core.FactModel.RegionLiveAt;

import java.util.*;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * The facts which are the basis of the borrow analysis.
 *
 * Point-indexed relations are kept as insertion-ordered maps from the point column to the
 * tuples recorded at that point. Nothing is deduplicated: inserting a tuple twice stores it twice.
 *
 * The store is filled once, simplified at most once via {@link #simplifyCfg()}, and then only
 * read. It is not thread-safe.
 */
public class AllFacts {

    private final Map<Point, List<BorrowRegion>> borrowRegion = new LinkedHashMap<>();
    private final List<Region> universalRegion = new ArrayList<>();
    private final List<CfgEdge> cfgEdge = new ArrayList<>();
    private final Map<Point, List<Killed>> killed = new LinkedHashMap<>();
    private final Map<Point, List<Outlives>> outlives = new LinkedHashMap<>();
    private final Map<Point, List<RegionLiveAt>> regionLiveAt = new LinkedHashMap<>();
    private final Map<Point, List<Invalidates>> invalidates = new LinkedHashMap<>();

    // -----------------------------------------------------------------------
    // Insertion
    // -----------------------------------------------------------------------

    public void addBorrowRegion(Region region, Loan loan, Point point) {
        addBorrowRegion(new BorrowRegion(region, loan, point));
    }

    public void addBorrowRegion(BorrowRegion fact) {
        index(borrowRegion, fact.point(), fact);
    }

    public void addUniversalRegion(Region region) {
        universalRegion.add(Objects.requireNonNull(region, "region"));
    }

    public void addCfgEdge(Point from, Point to) {
        cfgEdge.add(new CfgEdge(from, to));
    }

    public void addCfgEdge(CfgEdge edge) {
        cfgEdge.add(Objects.requireNonNull(edge, "edge"));
    }

    public void addCfgEdges(Collection<CfgEdge> edges) {
        for (CfgEdge edge : edges) {
            addCfgEdge(edge);
        }
    }

    public void addKilled(Loan loan, Point point) {
        addKilled(new Killed(loan, point));
    }

    public void addKilled(Killed fact) {
        index(killed, fact.point(), fact);
    }

    public void addOutlives(Region longer, Region shorter, Point point) {
        addOutlives(new Outlives(longer, shorter, point));
    }

    public void addOutlives(Outlives fact) {
        index(outlives, fact.point(), fact);
    }

    public void addRegionLiveAt(Region region, Point point) {
        addRegionLiveAt(new RegionLiveAt(region, point));
    }

    public void addRegionLiveAt(RegionLiveAt fact) {
        index(regionLiveAt, fact.point(), fact);
    }

    public void addInvalidates(Point point, Loan loan) {
        addInvalidates(new Invalidates(point, loan));
    }

    public void addInvalidates(Invalidates fact) {
        index(invalidates, fact.point(), fact);
    }

    private static <T> void index(Map<Point, List<T>> relation, Point point, T fact) {
        relation.computeIfAbsent(point, k -> new ArrayList<>()).add(fact);
    }

    // -----------------------------------------------------------------------
    // Whole-relation views (flattened, in insertion order)
    // -----------------------------------------------------------------------

    public List<BorrowRegion> borrowRegions()  { return flatten(borrowRegion); }
    public List<Region> universalRegions()     { return Collections.unmodifiableList(universalRegion); }
    public List<CfgEdge> cfgEdges()            { return Collections.unmodifiableList(cfgEdge); }
    public List<Killed> killed()               { return flatten(killed); }
    public List<Outlives> outlives()           { return flatten(outlives); }
    public List<RegionLiveAt> regionLiveAt()   { return flatten(regionLiveAt); }
    public List<Invalidates> invalidates()     { return flatten(invalidates); }

    private static <T> List<T> flatten(Map<Point, List<T>> relation) {
        List<T> all = new ArrayList<>();
        for (List<T> facts : relation.values()) {
            all.addAll(facts);
        }
        return Collections.unmodifiableList(all);
    }

    /**
     * Tuple count per relation, keyed by relation name in schema order.
     */
    public Map<String, Integer> relationSizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (Relation relation : Relation.values()) {
            sizes.put(relation.relationName(), size(relation));
        }
        return sizes;
    }

    public int size(Relation relation) {
        return switch (relation) {
            case BORROW_REGION    -> count(borrowRegion);
            case UNIVERSAL_REGION -> universalRegion.size();
            case CFG_EDGE         -> cfgEdge.size();
            case KILLED           -> count(killed);
            case OUTLIVES         -> count(outlives);
            case REGION_LIVE_AT   -> count(regionLiveAt);
            case INVALIDATES      -> count(invalidates);
        };
    }

    private static int count(Map<Point, ? extends List<?>> relation) {
        int n = 0;
        for (List<?> facts : relation.values()) {
            n += facts.size();
        }
        return n;
    }

    // -----------------------------------------------------------------------
    // Point-keyed lookups
    // -----------------------------------------------------------------------

    public List<BorrowRegion> borrowRegionsAt(Point point) {
        return at(borrowRegion, point, Function.identity());
    }

    public List<Region> liveRegionsAt(Point point) {
        return at(regionLiveAt, point, RegionLiveAt::region);
    }

    public List<Loan> killedAt(Point point) {
        return at(killed, point, Killed::loan);
    }

    public List<Outlives> outlivesAt(Point point) {
        return at(outlives, point, Function.identity());
    }

    public List<Loan> invalidatesAt(Point point) {
        return at(invalidates, point, Invalidates::loan);
    }

    private static <T, R> List<R> at(Map<Point, List<T>> relation, Point point, Function<T, R> column) {
        List<T> facts = relation.get(point);
        if (facts == null) {
            return Collections.emptyList();
        }
        List<R> values = new ArrayList<>(facts.size());
        for (T fact : facts) {
            values.add(column.apply(fact));
        }
        return Collections.unmodifiableList(values);
    }

    /** True if no remaining edge leaves {@code point}. */
    public boolean isEndpoint(Point point) {
        for (CfgEdge edge : cfgEdge) {
            if (edge.from().equals(point)) return false;
        }
        return true;
    }

    /** True if no remaining edge enters {@code point}. */
    public boolean isStartpoint(Point point) {
        for (CfgEdge edge : cfgEdge) {
            if (edge.to().equals(point)) return false;
        }
        return true;
    }

    // -----------------------------------------------------------------------
    // Simplification
    // -----------------------------------------------------------------------

    /**
     * Shrinks the control-flow graph in place by collapsing isolated chains.
     * See {@link CfgSimplifier}.
     */
    public SimplificationReport simplifyCfg() {
        return new CfgSimplifier().simplify(this);
    }

    /** Drops every point-indexed fact recorded at {@code point}. */
    void removeFactsAt(Point point) {
        borrowRegion.remove(point);
        killed.remove(point);
        outlives.remove(point);
        regionLiveAt.remove(point);
        invalidates.remove(point);
    }

    /** Drops every copy of the edge {@code from -> to}. */
    void removeCfgEdge(Point from, Point to) {
        CfgEdge doomed = new CfgEdge(from, to);
        cfgEdge.removeIf(doomed::equals);
    }

    /** Rewrites edges leaving {@code replaced} so they leave {@code survivor} instead. */
    void redirectSources(Point replaced, Point survivor) {
        rewriteEdges(e -> e.from().equals(replaced) ? new CfgEdge(survivor, e.to()) : e);
    }

    /** Rewrites edges entering {@code replaced} so they enter {@code survivor} instead. */
    void redirectTargets(Point replaced, Point survivor) {
        rewriteEdges(e -> e.to().equals(replaced) ? new CfgEdge(e.from(), survivor) : e);
    }

    private void rewriteEdges(UnaryOperator<CfgEdge> rule) {
        cfgEdge.replaceAll(rule);
    }
}
