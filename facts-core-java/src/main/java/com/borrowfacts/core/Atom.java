package com.borrowfacts.core;

/**
 * A dense, integer-backed identifier handed out by the interning tables.
 *
 * Each kind of atom (region, loan, point) is its own type so the kinds can never be mixed
 * up; the plain index is only reachable through {@link #index()} and the kind's
 * {@code of(int)} factory.
 */
public interface Atom {

    /** The non-negative dense index backing this atom. */
    int index();
}
