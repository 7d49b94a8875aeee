package com.reachscan.adapter.static_analysis;

import java.util.List;

/**
 * Result of source root resolution: the source directories to analyze and classpath JARs.
 */
public record SourceRoots(
    List<String> sourceRoots,   // absolute paths to src/main/java, src/test/java (or equivalents) that exist
    List<String> classpathJars  // absolute paths to dependency JARs
) {}
