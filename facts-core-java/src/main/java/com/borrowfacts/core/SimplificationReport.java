package com.borrowfacts.core;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one {@link CfgSimplifier} pass.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public class SimplificationReport {

    @SerializedName("edges_before")    public int edgesBefore;
    @SerializedName("edges_after")     public int edgesAfter;
    @SerializedName("chain_count")     public int chainCount;
    @SerializedName("collapsed_edges") public int collapsedEdges;
    @SerializedName("break_points")    public int breakPoints;   // links whose facts differ
    @SerializedName("skipped_edges")   public int skippedEdges;  // collapsible, but no side can go
    @SerializedName("removed_points")  public List<Integer> removedPoints = new ArrayList<>();

    /** True if the pass changed the graph. */
    public boolean changed() {
        return collapsedEdges > 0;
    }
}
