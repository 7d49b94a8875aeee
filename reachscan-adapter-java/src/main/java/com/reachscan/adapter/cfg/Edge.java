package com.reachscan.adapter.cfg;

import java.util.List;

/**
 * Directed edge between two blocks. A guarded edge may only be followed once at least one of its
 * guard blocks is live; an empty guard list means the edge is unconditional.
 */
public record Edge(
    BasicBlock from,
    BasicBlock to,
    EdgeKind kind,
    List<BasicBlock> guards
) {
    public Edge {
        guards = List.copyOf(guards);
    }

    public Edge(BasicBlock from, BasicBlock to, EdgeKind kind) {
        this(from, to, kind, List.of());
    }

    public boolean isGuarded() {
        return !guards.isEmpty();
    }

    public boolean isInterprocedural() {
        return from.owner() != to.owner();
    }

    @Override
    public String toString() {
        return from + " -" + kind + "-> " + to;
    }
}
