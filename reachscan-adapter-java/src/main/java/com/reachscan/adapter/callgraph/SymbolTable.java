package com.reachscan.adapter.callgraph;

import com.reachscan.adapter.cfg.ControlFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only index over every function of the program, built once all CFGs exist.
 * Safe for concurrent lookups.
 */
public final class SymbolTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SymbolTable.class);

    private final Map<String, ControlFlowGraph> byId;
    private final Map<String, List<ControlFlowGraph>> byName;
    private final Map<String, List<ControlFlowGraph>> overriders;

    private SymbolTable(Map<String, ControlFlowGraph> byId,
                        Map<String, List<ControlFlowGraph>> byName,
                        Map<String, List<ControlFlowGraph>> overriders) {
        this.byId = byId;
        this.byName = byName;
        this.overriders = overriders;
    }

    public static SymbolTable of(List<ControlFlowGraph> functions) {
        Map<String, ControlFlowGraph> byId = new LinkedHashMap<>();
        Map<String, List<ControlFlowGraph>> byName = new HashMap<>();
        Map<String, List<ControlFlowGraph>> overriders = new HashMap<>();
        for (ControlFlowGraph cfg : functions) {
            String id = cfg.function().id();
            if (byId.putIfAbsent(id, cfg) != null) {
                LOGGER.warn("Duplicate function id {}; keeping the first declaration", id);
                continue;
            }
            byName.computeIfAbsent(cfg.function().name(), k -> new ArrayList<>()).add(cfg);
            for (String overridden : cfg.function().overrides()) {
                overriders.computeIfAbsent(overridden, k -> new ArrayList<>()).add(cfg);
            }
        }
        return new SymbolTable(Collections.unmodifiableMap(byId), byName, overriders);
    }

    public ControlFlowGraph lookup(String id) {
        return byId.get(id);
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int size() {
        return byId.size();
    }

    public Iterable<ControlFlowGraph> functions() {
        return byId.values();
    }

    /** Functions with the given simple name and arity; an arity of -1 matches any. */
    public List<ControlFlowGraph> named(String name, int arity) {
        List<ControlFlowGraph> all = byName.getOrDefault(name, List.of());
        List<ControlFlowGraph> matches = new ArrayList<>();
        for (ControlFlowGraph cfg : all) {
            if (arity < 0 || cfg.function().arity() < 0 || cfg.function().arity() == arity) {
                matches.add(cfg);
            }
        }
        return matches;
    }

    /** {@code function} and every program function that overrides it, directly or transitively. */
    public List<ControlFlowGraph> withOverriders(ControlFlowGraph function) {
        Set<ControlFlowGraph> result = new LinkedHashSet<>();
        Deque<ControlFlowGraph> pending = new ArrayDeque<>();
        pending.add(function);
        while (!pending.isEmpty()) {
            ControlFlowGraph next = pending.poll();
            if (result.add(next)) {
                pending.addAll(overriders.getOrDefault(next.function().id(), List.of()));
            }
        }
        return new ArrayList<>(result);
    }

    static boolean sameContainer(ControlFlowGraph a, ControlFlowGraph b) {
        return a.function().container() != null
                && Objects.equals(a.function().container(), b.function().container());
    }

    static boolean sameUnit(ControlFlowGraph a, ControlFlowGraph b) {
        return Objects.equals(a.function().unitPath(), b.function().unitPath());
    }
}
