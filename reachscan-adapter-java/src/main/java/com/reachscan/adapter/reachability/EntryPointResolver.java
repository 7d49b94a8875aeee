package com.reachscan.adapter.reachability;

import com.reachscan.adapter.ast.FunctionDecl;
import com.reachscan.adapter.ast.FunctionTrait;
import com.reachscan.adapter.callgraph.CallGraph;
import com.reachscan.adapter.cfg.ControlFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the traversal roots: explicitly declared functions plus, depending on the options,
 * exported functions, main routines, tests, static initializers and overrides of library methods.
 */
public class EntryPointResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(EntryPointResolver.class);

    private final AnalysisOptions options;

    public EntryPointResolver(AnalysisOptions options) {
        this.options = options;
    }

    /** Entry points sorted by function id, one per function. */
    public List<EntryPoint> resolve(CallGraph graph) {
        Map<ControlFlowGraph, EntryReason> roots = new LinkedHashMap<>();

        for (String declared : options.entryPoints()) {
            int matched = 0;
            for (ControlFlowGraph cfg : graph.functions()) {
                if (matchesDeclared(cfg.function(), declared)) {
                    roots.putIfAbsent(cfg, EntryReason.DECLARED);
                    matched++;
                }
            }
            if (matched == 0) {
                LOGGER.warn("Declared entry point '{}' matches no function", declared);
            }
        }

        for (ControlFlowGraph cfg : graph.functions()) {
            EntryReason reason = automaticReason(cfg.function());
            if (reason != null) {
                roots.putIfAbsent(cfg, reason);
            }
        }

        List<EntryPoint> result = new ArrayList<>();
        roots.forEach((cfg, reason) -> result.add(new EntryPoint(cfg, reason)));
        Collections.sort(result);
        LOGGER.info("Resolved {} entry points", result.size());
        return result;
    }

    EntryReason automaticReason(FunctionDecl fn) {
        if (fn.has(FunctionTrait.MAIN)) return EntryReason.MAIN;
        if (options.includeTests() && fn.has(FunctionTrait.TEST)) return EntryReason.TEST;
        if (fn.has(FunctionTrait.STATIC_INITIALIZER)) return EntryReason.STATIC_INITIALIZER;
        if (options.exportedEntryPoints() && fn.isExported()) return EntryReason.EXPORTED;
        if (options.externalOverridesAreEntryPoints() && fn.has(FunctionTrait.OVERRIDES_EXTERNAL)) {
            return EntryReason.EXTERNAL_OVERRIDE;
        }
        return null;
    }

    /**
     * A declared root names a function by full id, id without the {@code java::} prefix,
     * {@code Type::method} with the type simple or qualified, or bare method name.
     */
    static boolean matchesDeclared(FunctionDecl fn, String declared) {
        String id = fn.id();
        if (id.equals(declared) || id.equals("java::" + declared)) {
            return true;
        }
        String bare = id.startsWith("java::") ? id.substring("java::".length()) : id;
        if (bare.equals(declared)) {
            return true;
        }
        int paren = bare.indexOf('(');
        String signature = paren < 0 ? bare : bare.substring(0, paren);
        return signature.equals(declared)
                || signature.endsWith("." + declared)
                || fn.name().equals(declared);
    }
}
