package com.reachscan.adapter.callgraph;

import com.reachscan.adapter.cfg.ControlFlowGraph;

import java.util.List;

/**
 * The linked program: every function CFG in declaration order, the symbol table they were
 * resolved against and the run's single unknown-target sink.
 */
public record CallGraph(
        List<ControlFlowGraph> functions,
        SymbolTable symbols,
        ControlFlowGraph unknownTarget,
        LinkStats stats) {

    public CallGraph {
        functions = List.copyOf(functions);
    }

    public record LinkStats(int resolved, int unknown, int callEdges) {}
}
