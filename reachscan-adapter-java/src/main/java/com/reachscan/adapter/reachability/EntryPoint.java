package com.reachscan.adapter.reachability;

import com.reachscan.adapter.cfg.ControlFlowGraph;

/** A traversal root and the rule that made it one. */
public record EntryPoint(ControlFlowGraph function, EntryReason reason) implements Comparable<EntryPoint> {

    public String id() {
        return function.function().id();
    }

    @Override
    public int compareTo(EntryPoint other) {
        return id().compareTo(other.id());
    }
}
