package com.borrowfacts.core;

/**
 * A point in the control-flow graph.
 */
public record Point(int index) implements Atom, Comparable<Point> {

    public Point {
        if (index < 0) {
            throw new IllegalArgumentException("point index must be non-negative: " + index);
        }
    }

    public static Point of(int index) {
        return new Point(index);
    }

    @Override
    public int compareTo(Point other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return "Point(" + index + ")";
    }
}
