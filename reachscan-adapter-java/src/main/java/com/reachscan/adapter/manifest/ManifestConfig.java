package com.reachscan.adapter.manifest;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of a project's reachscan.json.
 */
public class ManifestConfig {

    @SerializedName("project_name")
    private String projectName;

    /** Function ids, {@code Type::method} pairs or bare method names to treat as roots. */
    @SerializedName("entry_points")
    private List<String> entryPoints;

    /** Exclusion rules: {@code symbol:<glob>}, {@code path:<glob>} or a bare glob. */
    @SerializedName("exclude")
    private List<String> exclude;

    /** Whether public functions of public types are roots (default: true). */
    @SerializedName("exported_entry_points")
    private Boolean exportedEntryPoints;

    /** Whether test methods are roots (default: true). */
    @SerializedName("include_tests")
    private Boolean includeTests;

    /** Whether overrides of methods declared outside the project are roots (default: true). */
    @SerializedName("external_overrides_are_entry_points")
    private Boolean externalOverridesAreEntryPoints;

    /** Optional source directories relative to the project root, replacing build-file detection. */
    @SerializedName("source_dirs")
    private List<String> sourceDirs;

    /** Worker threads for CFG construction and linking (default: available processors). */
    @SerializedName("threads")
    private Integer threads;

    public String getProjectName()       { return projectName; }
    public List<String> getEntryPoints() { return entryPoints != null ? entryPoints : Collections.emptyList(); }
    public List<String> getExclude()     { return exclude     != null ? exclude     : Collections.emptyList(); }
    public List<String> getSourceDirs()  { return sourceDirs  != null ? sourceDirs  : Collections.emptyList(); }
    public boolean isExportedEntryPoints() { return exportedEntryPoints == null || exportedEntryPoints; }
    public boolean isIncludeTests()      { return includeTests == null || includeTests; }
    public boolean isExternalOverridesAreEntryPoints() {
        return externalOverridesAreEntryPoints == null || externalOverridesAreEntryPoints;
    }
    public int getThreads()              { return threads != null ? threads : 0; }
}
