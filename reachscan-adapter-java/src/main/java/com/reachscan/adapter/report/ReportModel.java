package com.reachscan.adapter.report;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs of reachability report v0.1.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class ReportModel {

    private ReportModel() {}

    public static final String REPORT_VERSION = "0.1";
    public static final String UNANALYZED = "UNANALYZED";

    public static class ReportRoot {
        @SerializedName("report_version")   public String reportVersion;
        @SerializedName("language")         public String language;
        @SerializedName("repo_root")        public String repoRoot;
        @SerializedName("project_name")     public String projectName;
        @SerializedName("entry_points")     public List<ReportEntryPoint> entryPoints;
        @SerializedName("units")            public List<ReportUnit> units;
        @SerializedName("functions")        public List<ReportFunction> functions;
        @SerializedName("blocks")           public List<ReportBlock> blocks;
        @SerializedName("unresolved_calls") public List<ReportCall> unresolvedCalls;
        @SerializedName("summary")          public ReportSummary summary;
    }

    public static class ReportEntryPoint {
        @SerializedName("function") public String function;
        @SerializedName("reason")   public String reason;
    }

    public static class ReportUnit {
        @SerializedName("path")           public String path;
        @SerializedName("function_count") public int functionCount;
        @SerializedName("dead_lines")     public List<Integer> deadLines;
    }

    public static class ReportFunction {
        @SerializedName("id")                public String id;
        @SerializedName("name")              public String name;
        @SerializedName("unit")              public String unit;
        @SerializedName("line_start")        public int lineStart;
        @SerializedName("visibility")        public String visibility;
        @SerializedName("classification")    public String classification;  // LIVE, DEAD, EXCLUDED, UNANALYZED
        @SerializedName("unanalyzed_reason") public String unanalyzedReason;  // nullable
        @SerializedName("is_entry_point")    public boolean isEntryPoint;
        @SerializedName("witness")           public List<String> witness;    // entry point first
    }

    public static class ReportBlock {
        @SerializedName("function")       public String function;
        @SerializedName("block")          public String block;
        @SerializedName("unit")           public String unit;
        @SerializedName("line_start")     public int lineStart;
        @SerializedName("line_end")       public int lineEnd;
        @SerializedName("lines")          public List<Integer> lines;
        @SerializedName("terminator")     public String terminator;
        @SerializedName("classification") public String classification;
        @SerializedName("synthetic")      public boolean synthetic;
    }

    public static class ReportCall {
        @SerializedName("caller") public String caller;
        @SerializedName("block")  public String block;
        @SerializedName("target") public String target;
        @SerializedName("kind")   public String kind;
        @SerializedName("state")  public String state;    // UNKNOWN_TARGET or EXCLUDED
    }

    public static class ReportSummary {
        @SerializedName("functions")                public int functions;
        @SerializedName("live_functions")           public int liveFunctions;
        @SerializedName("dead_functions")           public int deadFunctions;
        @SerializedName("excluded_functions")       public int excludedFunctions;
        @SerializedName("unanalyzed_functions")     public int unanalyzedFunctions;
        @SerializedName("blocks")                   public int blocks;
        @SerializedName("dead_blocks")              public int deadBlocks;
        @SerializedName("unreachable_local_blocks") public int unreachableLocalBlocks;
        @SerializedName("findings")                 public int findings;
    }
}
