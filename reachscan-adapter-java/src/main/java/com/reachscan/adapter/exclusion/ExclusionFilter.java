package com.reachscan.adapter.exclusion;

import com.reachscan.adapter.ast.FunctionDecl;
import com.reachscan.adapter.callgraph.CallGraph;
import com.reachscan.adapter.cfg.CallSite;
import com.reachscan.adapter.cfg.ControlFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Flags functions and call sites matched by the exclusion rules. Nothing is removed from the
 * graph: traversal still flows through excluded code, only its reported classification changes.
 */
public class ExclusionFilter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExclusionFilter.class);

    private final List<ExclusionPattern> patterns;

    private ExclusionFilter(List<ExclusionPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static ExclusionFilter none() {
        return new ExclusionFilter(List.of());
    }

    /**
     * Compiles every rule up front so a bad one fails the run before any analysis happens.
     *
     * @throws InvalidExclusionPatternException on the first malformed rule
     */
    public static ExclusionFilter compile(Collection<String> rules) {
        List<ExclusionPattern> compiled = new ArrayList<>();
        for (String rule : rules) {
            compiled.add(ExclusionPattern.parse(rule));
        }
        return new ExclusionFilter(compiled);
    }

    public List<ExclusionPattern> patterns() {
        return patterns;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public boolean excludesFunction(FunctionDecl function) {
        for (ExclusionPattern p : patterns) {
            if (p.matchesSymbol(function.id()) || p.matchesPath(function.unitPath())) {
                return true;
            }
        }
        return false;
    }

    public boolean excludesCallTarget(String target) {
        for (ExclusionPattern p : patterns) {
            if (p.matchesSymbol(target)) {
                return true;
            }
        }
        return false;
    }

    /** Marks matching functions and call sites of {@code graph}; returns the number of functions excluded. */
    public int apply(CallGraph graph) {
        if (patterns.isEmpty()) {
            return 0;
        }
        int functions = 0;
        int sites = 0;
        for (ControlFlowGraph cfg : graph.functions()) {
            if (excludesFunction(cfg.function())) {
                cfg.markExcluded();
                functions++;
                LOGGER.debug("Excluded function {}", cfg.function().id());
            }
            for (CallSite site : cfg.callSites()) {
                if (excludesCallTarget(site.displayName())) {
                    site.markExcluded();
                    sites++;
                }
            }
        }
        LOGGER.info("Exclusion rules matched {} functions and {} call sites", functions, sites);
        return functions;
    }
}
