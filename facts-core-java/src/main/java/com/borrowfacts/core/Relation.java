package com.borrowfacts.core;

/**
 * The fact relations, in schema order, with their column count.
 */
public enum Relation {
    BORROW_REGION("borrow_region", 3),
    UNIVERSAL_REGION("universal_region", 1),
    CFG_EDGE("cfg_edge", 2),
    KILLED("killed", 2),
    OUTLIVES("outlives", 3),
    REGION_LIVE_AT("region_live_at", 2),
    INVALIDATES("invalidates", 2);

    private final String relationName;
    private final int arity;

    Relation(String relationName, int arity) {
        this.relationName = relationName;
        this.arity = arity;
    }

    public String relationName() { return relationName; }
    public int arity()            { return arity; }

    /** File holding this relation in a facts directory, e.g. {@code cfg_edge.facts}. */
    public String factsFileName() {
        return relationName + ".facts";
    }
}
