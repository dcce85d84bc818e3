package com.borrowfacts.core;

/**
 * A region (lifetime): a symbolic name for the set of points over which borrowed data may be read.
 */
public record Region(int index) implements Atom, Comparable<Region> {

    public Region {
        if (index < 0) {
            throw new IllegalArgumentException("region index must be non-negative: " + index);
        }
    }

    public static Region of(int index) {
        return new Region(index);
    }

    @Override
    public int compareTo(Region other) {
        return Integer.compare(index, other.index);
    }
}
