package com.borrowfacts.loader.intern;

import com.borrowfacts.core.Loan;
import com.borrowfacts.core.Point;
import com.borrowfacts.core.Region;

/**
 * One interner per atom kind, shared by every relation file of a facts directory so that the
 * same token always denotes the same atom.
 */
public class InternerTables {

    public final Interner<Region> regions = new Interner<>(Region::of);
    public final Interner<Loan> loans = new Interner<>(Loan::of);
    public final Interner<Point> points = new Interner<>(Point::of);
}
