package com.reachscan.adapter.static_analysis;

import com.reachscan.adapter.ast.SourceUnit;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.*;
import java.util.*;

/**
 * Orchestrates the front-end pass: resolves source roots, parses every file with JDT and lowers
 * each compilation unit into a SourceUnit. Paths are relative to the project root.
 */
public class StaticAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(StaticAnalyzer.class);

    public static class SourceParseException extends RuntimeException {
        public SourceParseException(String message) { super(message); }
    }

    private final SourceRootResolver resolver = new SourceRootResolver();

    public List<SourceUnit> analyze(Path projectRoot) {
        return analyze(projectRoot, List.of(), true);
    }

    /**
     * @throws SourceParseException if any file has syntax errors
     * @throws SourceRootResolver.UnsupportedBuildToolException if the project has no recognised build file
     */
    public List<SourceUnit> analyze(Path projectRoot, List<String> sourceDirs, boolean includeTests) {
        Path root = projectRoot.toAbsolutePath().normalize();

        // 1. Resolve source roots and classpath
        SourceRoots sourceRoots = resolver.resolve(root, sourceDirs, includeTests);
        LOGGER.info("Source roots: {} ({} classpath jars)", sourceRoots.sourceRoots(), sourceRoots.classpathJars().size());

        // 2. Parse AST with type bindings
        JdtAstParser parser = new JdtAstParser(sourceRoots);
        Map<String, CompilationUnit> compilationUnits = parser.parseAll();

        // 3. Lower functions of each compilation unit
        List<SourceUnit> units = new ArrayList<>();
        List<String> syntaxErrors = new ArrayList<>();
        for (Map.Entry<String, CompilationUnit> entry : compilationUnits.entrySet()) {
            String relativePath = makeRelative(root.toString(), entry.getKey());
            CompilationUnit cu = entry.getValue();
            for (IProblem problem : cu.getProblems()) {
                if (problem.isError() && (problem.getID() & IProblem.Syntax) != 0) {
                    syntaxErrors.add(relativePath + ":" + problem.getSourceLineNumber() + ": " + problem.getMessage());
                }
            }

            FunctionExtractor extractor = new FunctionExtractor(relativePath, cu);
            cu.accept(extractor);
            units.add(new SourceUnit(relativePath, extractor.getFunctions()));
            LOGGER.debug("{}: {} functions", relativePath, extractor.getFunctions().size());
        }

        if (!syntaxErrors.isEmpty()) {
            syntaxErrors.forEach(e -> LOGGER.error("Syntax error: {}", e));
            throw new SourceParseException(syntaxErrors.size() + " syntax error(s), first: " + syntaxErrors.get(0));
        }
        LOGGER.info("Parsed {} source units", units.size());
        return units;
    }

    private String makeRelative(String projectRoot, String absolutePath) {
        if (absolutePath.startsWith(projectRoot)) {
            String rel = absolutePath.substring(projectRoot.length());
            return rel.startsWith("/") ? rel.substring(1) : rel;
        }
        return absolutePath;
    }
}
