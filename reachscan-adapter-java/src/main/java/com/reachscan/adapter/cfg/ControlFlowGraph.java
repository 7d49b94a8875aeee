package com.reachscan.adapter.cfg;

import com.reachscan.adapter.ast.Ast;
import com.reachscan.adapter.ast.FunctionDecl;
import com.reachscan.adapter.ast.FunctionTrait;
import com.reachscan.adapter.ast.SourceLocation;
import com.reachscan.adapter.ast.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Control-flow graph of one function: its blocks (the first one is the entry) and call sites.
 */
public final class ControlFlowGraph {

    public static final String UNKNOWN_TARGET_ID = "<unknown-target>";

    private final FunctionDecl function;
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final List<CallSite> callSites = new ArrayList<>();
    private String failure;
    private boolean excluded;

    ControlFlowGraph(FunctionDecl function) {
        this.function = function;
    }

    /**
     * The synthetic sink every unresolved call links to. It may return to its callers and has no
     * outgoing edges.
     */
    public static ControlFlowGraph unknownTarget() {
        FunctionDecl decl = new FunctionDecl(
                UNKNOWN_TARGET_ID, UNKNOWN_TARGET_ID, "", null, Visibility.INTERNAL, -1,
                SourceLocation.UNKNOWN, List.of(), Set.of(FunctionTrait.SYNTHETIC), List.of());
        ControlFlowGraph cfg = new ControlFlowGraph(decl);
        BasicBlock block = cfg.newBlock();
        block.terminate(TerminatorKind.UNKNOWN_EXIT);
        block.markExits();
        return cfg;
    }

    public FunctionDecl function() { return function; }
    public List<BasicBlock> blocks() { return Collections.unmodifiableList(blocks); }
    public List<CallSite> callSites() { return Collections.unmodifiableList(callSites); }

    public BasicBlock entry() {
        return blocks.get(0);
    }

    public boolean isUnknownTarget() {
        return UNKNOWN_TARGET_ID.equals(function.id());
    }

    /** True when the builder could not model the function and produced a single-block stand-in. */
    public boolean isFallback() {
        return failure != null;
    }

    /** Reason the function could not be modeled; null for regular graphs. */
    public String failure() { return failure; }

    public boolean isExcluded() { return excluded; }

    public void markExcluded() {
        this.excluded = true;
    }

    BasicBlock newBlock() {
        BasicBlock block = new BasicBlock(this, "b" + blocks.size());
        blocks.add(block);
        return block;
    }

    CallSite addCallSite(BasicBlock block, Ast.Expr node, String target, String name, int arity, CallSiteKind kind) {
        CallSite site = new CallSite("c" + callSites.size(), block, node, target, name, arity, kind);
        callSites.add(site);
        block.addCallSite(site);
        return site;
    }

    void markFallback(String reason) {
        this.failure = reason;
    }

    @Override
    public String toString() {
        return function.id();
    }
}
