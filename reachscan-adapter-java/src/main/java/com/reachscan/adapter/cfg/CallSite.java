package com.reachscan.adapter.cfg;

import com.reachscan.adapter.ast.Ast;

import java.util.List;

/**
 * A call or function reference inside a block. Resolution is filled in by the linker and may be
 * overridden to {@link ResolutionState#EXCLUDED} by the exclusion filter.
 */
public final class CallSite {

    private final String id;
    private final BasicBlock block;
    private final Ast.Expr node;
    private final String target;        // qualified id when the front end resolved it; nullable
    private final String name;
    private final int arity;            // -1 when unknown (function references)
    private final CallSiteKind kind;

    private ResolutionState resolution = ResolutionState.UNRESOLVED;
    private List<ControlFlowGraph> targets = List.of();
    private boolean excluded;

    CallSite(String id, BasicBlock block, Ast.Expr node, String target, String name, int arity, CallSiteKind kind) {
        this.id = id;
        this.block = block;
        this.node = node;
        this.target = target;
        this.name = name;
        this.arity = arity;
        this.kind = kind;
    }

    public String id() { return id; }
    public BasicBlock block() { return block; }
    public Ast.Expr node() { return node; }
    public String target() { return target; }
    public String name() { return name; }
    public int arity() { return arity; }
    public CallSiteKind kind() { return kind; }
    public List<ControlFlowGraph> targets() { return targets; }
    public boolean isExcluded() { return excluded; }

    public ResolutionState state() {
        return excluded ? ResolutionState.EXCLUDED : resolution;
    }

    /** Resolution ignoring any exclusion flag. */
    public ResolutionState resolution() {
        return resolution;
    }

    /** The symbolic name the call was written with. */
    public String displayName() {
        return target != null ? target : name;
    }

    public boolean gatesContinuation() {
        return kind != CallSiteKind.REFERENCE;
    }

    public void resolveTo(List<ControlFlowGraph> functions) {
        this.targets = List.copyOf(functions);
        this.resolution = ResolutionState.RESOLVED;
    }

    public void routeToUnknown(ControlFlowGraph unknownTarget) {
        this.targets = List.of(unknownTarget);
        this.resolution = ResolutionState.UNKNOWN_TARGET;
    }

    public void markExcluded() {
        this.excluded = true;
    }

    @Override
    public String toString() {
        return block + "@" + id + "(" + displayName() + ")";
    }
}
