package com.reachscan.adapter.static_analysis;

import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves source roots and classpath from a Maven or Gradle project.
 */
public class SourceRootResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceRootResolver.class);

    public static class UnsupportedBuildToolException extends RuntimeException {
        public UnsupportedBuildToolException(String message) { super(message); }
    }

    public SourceRoots resolve(Path projectRoot) {
        return resolve(projectRoot, List.of(), true);
    }

    /**
     * Detect build tool and resolve source roots.
     *
     * @param projectRoot  absolute path to the project root directory
     * @param overrideDirs source directories relative to the root; when non-empty no build file is needed
     * @param includeTests whether the test source directory is analyzed too
     */
    public SourceRoots resolve(Path projectRoot, List<String> overrideDirs, boolean includeTests) {
        if (!overrideDirs.isEmpty()) {
            return new SourceRoots(existing(projectRoot, overrideDirs), collectDependencyJars(projectRoot));
        }

        Path pomFile = projectRoot.resolve("pom.xml");
        Path gradleFile = projectRoot.resolve("build.gradle");
        Path gradleKts = projectRoot.resolve("build.gradle.kts");

        if (pomFile.toFile().exists()) {
            return resolveMaven(projectRoot, pomFile, includeTests);
        } else if (gradleFile.toFile().exists() || gradleKts.toFile().exists()) {
            return resolveGradle(projectRoot, includeTests);
        } else {
            throw new UnsupportedBuildToolException(
                "No pom.xml or build.gradle found in: " + projectRoot +
                ". Supported build tools: Maven, Gradle."
            );
        }
    }

    private SourceRoots resolveMaven(Path projectRoot, Path pomFile, boolean includeTests) {
        // Parse pom.xml for custom source directories
        String sourceDir = "src/main/java";
        String testSourceDir = "src/test/java";
        try (Reader reader = Files.newBufferedReader(pomFile, StandardCharsets.UTF_8)) {
            MavenXpp3Reader pomReader = new MavenXpp3Reader();
            Model model = pomReader.read(reader);
            Build build = model.getBuild();
            if (build != null && build.getSourceDirectory() != null) {
                sourceDir = build.getSourceDirectory();
            }
            if (build != null && build.getTestSourceDirectory() != null) {
                testSourceDir = build.getTestSourceDirectory();
            }
        } catch (IOException | XmlPullParserException e) {
            LOGGER.warn("Could not parse pom.xml, using default source roots: {}", e.getMessage());
        }

        List<String> dirs = includeTests ? List.of(sourceDir, testSourceDir) : List.of(sourceDir);
        return new SourceRoots(existing(projectRoot, dirs), collectDependencyJars(projectRoot));
    }

    private SourceRoots resolveGradle(Path projectRoot, boolean includeTests) {
        // Gradle: use standard convention; no build script to parse
        List<String> dirs = includeTests ? List.of("src/main/java", "src/test/java") : List.of("src/main/java");
        return new SourceRoots(existing(projectRoot, dirs), collectDependencyJars(projectRoot));
    }

    private List<String> existing(Path projectRoot, List<String> dirs) {
        List<String> roots = new ArrayList<>();
        for (String dir : dirs) {
            Path absolute = projectRoot.resolve(dir).toAbsolutePath().normalize();
            if (absolute.toFile().isDirectory()) {
                roots.add(absolute.toString());
            } else {
                LOGGER.debug("Source directory {} does not exist, skipping", absolute);
            }
        }
        return roots;
    }

    /**
     * JARs in target/dependency (Maven, populated by mvn dependency:copy-dependencies) or
     * build/dependency (Gradle). Without them bindings to library types only partially resolve.
     */
    private List<String> collectDependencyJars(Path projectRoot) {
        for (String candidate : List.of("target/dependency", "build/dependency")) {
            Path depDir = projectRoot.resolve(candidate);
            if (depDir.toFile().isDirectory()) {
                return collectJarsInDir(depDir);
            }
        }
        return Collections.emptyList();
    }

    private List<String> collectJarsInDir(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk
                .filter(p -> p.toString().endsWith(".jar"))
                .filter(p -> !p.toString().contains("-sources"))
                .filter(p -> !p.toString().contains("-tests"))
                .map(Path::toString)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            LOGGER.warn("Could not scan dependency dir {}: {}", dir, e.getMessage());
            return Collections.emptyList();
        }
    }
}
