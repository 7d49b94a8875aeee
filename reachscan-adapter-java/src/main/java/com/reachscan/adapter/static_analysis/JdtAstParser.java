package com.reachscan.adapter.static_analysis;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.dom.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Wrapper around Eclipse JDT's ASTParser.
 * Parses a set of Java source files with type binding resolution enabled.
 */
public class JdtAstParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdtAstParser.class);

    private final SourceRoots sourceRoots;

    public JdtAstParser(SourceRoots sourceRoots) {
        this.sourceRoots = sourceRoots;
    }

    /**
     * Parse all .java files under the source roots.
     * Returns a map of absolute file path -> CompilationUnit, in path order.
     */
    public Map<String, CompilationUnit> parseAll() {
        List<String> sourceFiles = new ArrayList<>();
        for (String root : sourceRoots.sourceRoots()) {
            sourceFiles.addAll(collectSourceFiles(root));
        }
        return parseFiles(sourceFiles);
    }

    /**
     * Parse a specific list of source files.
     */
    public Map<String, CompilationUnit> parseFiles(List<String> absoluteFilePaths) {
        if (absoluteFilePaths.isEmpty()) return Collections.emptyMap();

        ASTParser parser = ASTParser.newParser(AST.JLS21);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(true);
        parser.setBindingsRecovery(true);
        parser.setStatementsRecovery(true);
        Map<String, String> options = JavaCore.getOptions();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        parser.setCompilerOptions(options);

        String[] encodings = new String[absoluteFilePaths.size()];
        Arrays.fill(encodings, "UTF-8");

        String[] sourcepathEntries = sourceRoots.sourceRoots().toArray(new String[0]);
        String[] sourcepathEncodings = new String[sourcepathEntries.length];
        Arrays.fill(sourcepathEncodings, "UTF-8");
        String[] classpathEntries = sourceRoots.classpathJars().toArray(new String[0]);

        parser.setEnvironment(classpathEntries, sourcepathEntries, sourcepathEncodings, true);

        Map<String, CompilationUnit> result = new TreeMap<>();

        parser.createASTs(
            absoluteFilePaths.toArray(new String[0]),
            encodings,
            new String[0],
            new FileASTRequestor() {
                @Override
                public void acceptAST(String sourceFilePath, CompilationUnit ast) {
                    result.put(sourceFilePath, ast);
                }
            },
            null
        );

        LOGGER.debug("Parsed {} compilation units", result.size());
        return result;
    }

    private List<String> collectSourceFiles(String sourceRoot) {
        Path root = Paths.get(sourceRoot);
        if (!root.toFile().exists()) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(p -> p.toString().endsWith(".java"))
                .map(Path::toAbsolutePath)
                .map(Path::toString)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not walk source tree " + root, e);
        }
    }
}
