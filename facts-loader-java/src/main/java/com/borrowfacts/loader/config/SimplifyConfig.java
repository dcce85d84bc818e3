package com.borrowfacts.loader.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of borrowfacts.json. Every field is optional.
 */
public class SimplifyConfig {

    /** Whether to run CFG simplification before writing (default: true). */
    @SerializedName("simplify_cfg")
    private Boolean simplifyCfg;

    /** Whether to write the resulting .facts files (default: true). */
    @SerializedName("write_facts")
    private Boolean writeFacts;

    /** Whether to write the JSON report (default: true). */
    @SerializedName("write_report")
    private Boolean writeReport;

    /** Report file name inside the output directory (default: simplify_report.json). */
    @SerializedName("report_file")
    private String reportFile;

    public static SimplifyConfig defaults() {
        return new SimplifyConfig();
    }

    public boolean isSimplifyCfg()  { return simplifyCfg == null || simplifyCfg; }
    public boolean isWriteFacts()   { return writeFacts == null || writeFacts; }
    public boolean isWriteReport()  { return writeReport == null || writeReport; }
    public String getReportFile()   { return reportFile != null ? reportFile : "simplify_report.json"; }
}
