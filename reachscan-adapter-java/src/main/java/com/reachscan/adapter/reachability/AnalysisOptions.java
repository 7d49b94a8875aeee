package com.reachscan.adapter.reachability;

import java.util.List;

/**
 * Knobs of one analysis run. {@link #defaults()} roots exported functions, main routines, tests,
 * static initializers and overrides of library methods, and builds on all available processors.
 */
public record AnalysisOptions(
        List<String> entryPoints,
        List<String> excludePatterns,
        boolean exportedEntryPoints,
        boolean includeTests,
        boolean externalOverridesAreEntryPoints,
        int threads,
        CancellationToken cancellation) {

    public AnalysisOptions {
        entryPoints = List.copyOf(entryPoints);
        excludePatterns = List.copyOf(excludePatterns);
        if (threads < 1) {
            threads = Runtime.getRuntime().availableProcessors();
        }
        if (cancellation == null) {
            cancellation = CancellationToken.none();
        }
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(List.of(), List.of(), true, true, true, 0, null);
    }

    public AnalysisOptions withEntryPoints(List<String> entryPoints) {
        return new AnalysisOptions(entryPoints, excludePatterns, exportedEntryPoints, includeTests,
                externalOverridesAreEntryPoints, threads, cancellation);
    }

    public AnalysisOptions withExcludePatterns(List<String> excludePatterns) {
        return new AnalysisOptions(entryPoints, excludePatterns, exportedEntryPoints, includeTests,
                externalOverridesAreEntryPoints, threads, cancellation);
    }

    /** Turns off the exported, test and library-override root classes. */
    public AnalysisOptions declaredOnly() {
        return new AnalysisOptions(entryPoints, excludePatterns, false, false, false, threads, cancellation);
    }

    public AnalysisOptions withThreads(int threads) {
        return new AnalysisOptions(entryPoints, excludePatterns, exportedEntryPoints, includeTests,
                externalOverridesAreEntryPoints, threads, cancellation);
    }

    public AnalysisOptions withCancellation(CancellationToken cancellation) {
        return new AnalysisOptions(entryPoints, excludePatterns, exportedEntryPoints, includeTests,
                externalOverridesAreEntryPoints, threads, cancellation);
    }
}
