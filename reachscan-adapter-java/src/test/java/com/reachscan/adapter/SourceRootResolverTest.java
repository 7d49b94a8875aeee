package com.reachscan.adapter;

import com.reachscan.adapter.static_analysis.SourceRootResolver;
import com.reachscan.adapter.static_analysis.SourceRoots;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceRootResolverTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/inventory-service");

    private final SourceRootResolver resolver = new SourceRootResolver();

    @Test
    void mavenProjectResolvesCorrectSourceRoot() {
        SourceRoots roots = resolver.resolve(FIXTURE_ROOT);
        assertEquals(1, roots.sourceRoots().size(), "Missing test directory should be skipped");
        String sourceRoot = roots.sourceRoots().get(0);
        assertTrue(sourceRoot.endsWith("src/main/java"),
            "Expected source root to end with src/main/java but got: " + sourceRoot);
        assertTrue(Path.of(sourceRoot).toFile().exists(),
            "Source root directory must exist: " + sourceRoot);
    }

    @Test
    void mavenProjectWithoutCopiedDependenciesHasEmptyClasspath() {
        assertTrue(resolver.resolve(FIXTURE_ROOT).classpathJars().isEmpty());
    }

    @Test
    void customSourceDirectoryFromPom(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), """
            <project>
              <modelVersion>4.0.0</modelVersion>
              <build>
                <sourceDirectory>src/java</sourceDirectory>
                <testSourceDirectory>test/java</testSourceDirectory>
              </build>
            </project>
            """);
        Files.createDirectories(tmp.resolve("src/java"));
        Files.createDirectories(tmp.resolve("test/java"));

        SourceRoots withTests = resolver.resolve(tmp, List.of(), true);
        assertEquals(2, withTests.sourceRoots().size());
        assertTrue(withTests.sourceRoots().get(0).endsWith("src/java"));
        assertTrue(withTests.sourceRoots().get(1).endsWith("test/java"));

        SourceRoots mainOnly = resolver.resolve(tmp, List.of(), false);
        assertEquals(1, mainOnly.sourceRoots().size());
    }

    @Test
    void gradleProjectUsesConventions(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("build.gradle.kts"), "plugins { java }\n");
        Files.createDirectories(tmp.resolve("src/main/java"));
        Path jars = Files.createDirectories(tmp.resolve("build/dependency"));
        Files.writeString(jars.resolve("lib-1.0.jar"), "");
        Files.writeString(jars.resolve("lib-1.0-sources.jar"), "");

        SourceRoots roots = resolver.resolve(tmp);
        assertEquals(1, roots.sourceRoots().size());
        assertEquals(1, roots.classpathJars().size());
        assertTrue(roots.classpathJars().get(0).endsWith("lib-1.0.jar"));
    }

    @Test
    void overrideDirsNeedNoBuildFile(@TempDir Path tmp) throws IOException {
        Files.createDirectories(tmp.resolve("code"));
        SourceRoots roots = resolver.resolve(tmp, List.of("code", "missing"), true);
        assertEquals(1, roots.sourceRoots().size());
        assertTrue(roots.sourceRoots().get(0).endsWith("code"));
    }

    @Test
    void noBuildFileThrows(@TempDir Path emptyDir) {
        assertThrows(SourceRootResolver.UnsupportedBuildToolException.class,
            () -> resolver.resolve(emptyDir));
    }
}
