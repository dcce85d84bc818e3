package com.borrowfacts.core;

import java.util.Objects;

/**
 * Tuple types for the seven fact relations.
 * Component order matches the column order of the relation.
 */
public final class FactModel {

    private FactModel() {}

    /** {@code borrow_region(R, L, P)}: region R may hold data from loan L starting at point P. */
    public record BorrowRegion(Region region, Loan loan, Point point) {
        public BorrowRegion {
            Objects.requireNonNull(region, "region");
            Objects.requireNonNull(loan, "loan");
            Objects.requireNonNull(point, "point");
        }
    }

    /** {@code cfg_edge(P, Q)}: a directed control-flow edge from P to Q. */
    public record CfgEdge(Point from, Point to) {
        public CfgEdge {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
        }

        public static CfgEdge of(int from, int to) {
            return new CfgEdge(Point.of(from), Point.of(to));
        }
    }

    /** {@code killed(L, P)}: the path borrowed by L is overwritten at P. */
    public record Killed(Loan loan, Point point) {
        public Killed {
            Objects.requireNonNull(loan, "loan");
            Objects.requireNonNull(point, "point");
        }
    }

    /** {@code outlives(R1, R2, P)}: R1 must outlive R2 at P. */
    public record Outlives(Region longer, Region shorter, Point point) {
        public Outlives {
            Objects.requireNonNull(longer, "longer");
            Objects.requireNonNull(shorter, "shorter");
            Objects.requireNonNull(point, "point");
        }
    }

    /** {@code region_live_at(R, P)}: R appears in a variable live at P. */
    public record RegionLiveAt(Region region, Point point) {
        public RegionLiveAt {
            Objects.requireNonNull(region, "region");
            Objects.requireNonNull(point, "point");
        }
    }

    /** {@code invalidates(P, L)}: L is invalidated by a conflicting access at P. */
    public record Invalidates(Point point, Loan loan) {
        public Invalidates {
            Objects.requireNonNull(point, "point");
            Objects.requireNonNull(loan, "loan");
        }
    }
}
