package com.reachscan.adapter.cfg;

import com.reachscan.adapter.ast.Ast;
import com.reachscan.adapter.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Maximal straight-line run of statements of one function. Mutated only by the CFG builder and
 * the call-graph linker; read-only once reachability starts.
 */
public final class BasicBlock {

    private final ControlFlowGraph owner;
    private final String id;
    private final List<Ast.Node> elements = new ArrayList<>();
    private final List<Edge> successors = new ArrayList<>();
    private final List<Edge> predecessors = new ArrayList<>();
    private final List<CallSite> callSites = new ArrayList<>();
    private final List<Edge> callEdges = new ArrayList<>();
    private final List<BasicBlock> exitGuards = new ArrayList<>();
    private TerminatorKind terminator;
    private boolean canRaise;
    private boolean exitsFunction;

    BasicBlock(ControlFlowGraph owner, String id) {
        this.owner = owner;
        this.id = id;
    }

    public ControlFlowGraph owner() { return owner; }
    public String id() { return id; }
    public List<Ast.Node> elements() { return Collections.unmodifiableList(elements); }
    public List<Edge> successors() { return Collections.unmodifiableList(successors); }
    public List<Edge> predecessors() { return Collections.unmodifiableList(predecessors); }
    public List<CallSite> callSites() { return Collections.unmodifiableList(callSites); }
    public List<Edge> callEdges() { return Collections.unmodifiableList(callEdges); }
    public TerminatorKind terminator() { return terminator; }
    public boolean canRaise() { return canRaise; }

    /** True when control may leave the function normally from here (subject to {@link #exitGuards()}). */
    public boolean exitsFunction() { return exitsFunction; }

    /** Blocks of which at least one must be live before this block's exit counts; empty when unconditional. */
    public List<BasicBlock> exitGuards() { return Collections.unmodifiableList(exitGuards); }

    public boolean isEntry() {
        return owner.entry() == this;
    }

    /** Synthetic blocks carry no source statements (joins, continuations that stayed empty). */
    public boolean isSynthetic() {
        return elements.isEmpty();
    }

    /** The intra-procedural edge resuming after this block's call, if the block ends in one. */
    public Edge continuation() {
        for (Edge e : successors) {
            if (e.kind() == EdgeKind.RETURN_TO_CALLER) return e;
        }
        return null;
    }

    public int firstLine() {
        int line = 0;
        for (Ast.Node n : elements) {
            SourceLocation loc = n.location();
            if (loc != null && loc.isKnown() && (line == 0 || loc.line() < line)) line = loc.line();
        }
        return line;
    }

    public int lastLine() {
        int line = 0;
        for (Ast.Node n : elements) {
            SourceLocation loc = n.location();
            if (loc != null && loc.isKnown() && loc.line() > line) line = loc.line();
        }
        return line;
    }

    /** Distinct start lines of the statements in this block, in order of appearance. */
    public List<Integer> lines() {
        List<Integer> lines = new ArrayList<>();
        for (Ast.Node n : elements) {
            SourceLocation loc = n.location();
            if (loc != null && loc.isKnown() && !lines.contains(loc.line())) lines.add(loc.line());
        }
        return lines;
    }

    // --- construction ---

    void add(Ast.Node node) {
        elements.add(node);
    }

    void addSuccessor(Edge edge) {
        successors.add(edge);
        edge.to().predecessors.add(edge);
    }

    void addCallSite(CallSite site) {
        callSites.add(site);
    }

    void terminate(TerminatorKind kind) {
        this.terminator = kind;
    }

    boolean isOpen() {
        return terminator == null;
    }

    void markCanRaise() {
        this.canRaise = true;
    }

    void markExits() {
        this.exitsFunction = true;
    }

    void addExitGuard(BasicBlock guard) {
        exitGuards.add(guard);
    }

    /** Inter-procedural edges are owned by the calling block and written by the linker only. */
    public void addCallEdge(Edge edge) {
        if (edge.kind() != EdgeKind.CALL) {
            throw new IllegalArgumentException("Not a call edge: " + edge);
        }
        callEdges.add(edge);
    }

    @Override
    public String toString() {
        return owner.function().id() + "#" + id;
    }
}
