package com.reachscan.adapter.reachability;

import com.reachscan.adapter.callgraph.CallGraph;
import com.reachscan.adapter.cfg.BasicBlock;
import com.reachscan.adapter.cfg.ControlFlowGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Converged reachability of one run. Classifications are derived from the final live set, so
 * they do not depend on the order the worklist happened to visit blocks in.
 */
public final class ReachabilityResult {

    private final CallGraph graph;
    private final List<EntryPoint> entryPoints;
    private final Map<BasicBlock, ReachabilityEngine.Reason> live;
    private final Map<ControlFlowGraph, FunctionState> states;

    ReachabilityResult(CallGraph graph, List<EntryPoint> entryPoints,
                       Map<BasicBlock, ReachabilityEngine.Reason> live,
                       Map<ControlFlowGraph, FunctionState> states) {
        this.graph = graph;
        this.entryPoints = List.copyOf(entryPoints);
        this.live = Collections.unmodifiableMap(live);
        this.states = Collections.unmodifiableMap(states);
    }

    public CallGraph graph() { return graph; }
    public List<EntryPoint> entryPoints() { return entryPoints; }

    public boolean isLive(BasicBlock block) {
        return live.containsKey(block);
    }

    public boolean isLive(ControlFlowGraph function) {
        return live.containsKey(function.entry());
    }

    public FunctionState state(ControlFlowGraph function) {
        return states.getOrDefault(function, FunctionState.UNVISITED);
    }

    public Classification classify(BasicBlock block) {
        if (block.owner().isExcluded()) return Classification.EXCLUDED;
        if (isLive(block)) return Classification.LIVE;
        return isLive(block.owner()) ? Classification.UNREACHABLE_LOCAL : Classification.DEAD;
    }

    public Classification classify(ControlFlowGraph function) {
        if (function.isExcluded()) return Classification.EXCLUDED;
        return isLive(function) ? Classification.LIVE : Classification.DEAD;
    }

    /**
     * Function ids from the entry point that first reached {@code function} down to the function
     * itself; empty when the function was never reached.
     */
    public List<String> witness(ControlFlowGraph function) {
        List<String> chain = new ArrayList<>();
        Set<ControlFlowGraph> seen = new HashSet<>();
        ControlFlowGraph current = function;
        while (current != null && seen.add(current)) {
            ReachabilityEngine.Reason reason = live.get(current.entry());
            if (reason == null) {
                return List.of();
            }
            chain.add(current.function().id());
            current = reason.isSeed() ? null : reason.predecessor().owner();
        }
        Collections.reverse(chain);
        return chain;
    }

    public EntryPoint seedOf(ControlFlowGraph function) {
        ReachabilityEngine.Reason reason = live.get(function.entry());
        return reason != null && reason.isSeed() ? reason.seed() : null;
    }

    /** Classification of every program block keyed by {@code functionId#blockId}. */
    public SortedMap<String, Classification> snapshot() {
        SortedMap<String, Classification> snapshot = new TreeMap<>();
        for (ControlFlowGraph cfg : graph.functions()) {
            for (BasicBlock block : cfg.blocks()) {
                snapshot.put(block.toString(), classify(block));
            }
        }
        return snapshot;
    }

    /** Blocks with source statements that can never run. */
    public List<BasicBlock> findings() {
        List<BasicBlock> findings = new ArrayList<>();
        for (ControlFlowGraph cfg : graph.functions()) {
            for (BasicBlock block : cfg.blocks()) {
                if (!block.isSynthetic() && classify(block).isFinding()) {
                    findings.add(block);
                }
            }
        }
        return findings;
    }

    public int liveBlockCount() {
        return live.size();
    }
}
