package com.borrowfacts.core;

/**
 * A loan: one borrow event, identified by the point where it happens.
 */
public record Loan(int index) implements Atom, Comparable<Loan> {

    public Loan {
        if (index < 0) {
            throw new IllegalArgumentException("loan index must be non-negative: " + index);
        }
    }

    public static Loan of(int index) {
        return new Loan(index);
    }

    @Override
    public int compareTo(Loan other) {
        return Integer.compare(index, other.index);
    }
}
