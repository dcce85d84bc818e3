package com.borrowfacts.loader.report;

import com.borrowfacts.core.SimplificationReport;
import com.google.gson.annotations.SerializedName;

import java.util.Map;

/**
 * POJO written to the report file after a run.
 */
public class FactsReport {

    @SerializedName("facts_dir")        public String factsDir;
    @SerializedName("timestamp")        public String timestamp;
    @SerializedName("relations_before") public Map<String, Integer> relationsBefore;
    @SerializedName("relations_after")  public Map<String, Integer> relationsAfter;
    @SerializedName("simplification")   public SimplificationReport simplification;  // null when skipped
}
