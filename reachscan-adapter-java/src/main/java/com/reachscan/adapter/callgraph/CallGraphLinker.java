package com.reachscan.adapter.callgraph;

import com.reachscan.adapter.cfg.CallSite;
import com.reachscan.adapter.cfg.CallSiteKind;
import com.reachscan.adapter.cfg.ControlFlowGraph;
import com.reachscan.adapter.cfg.Edge;
import com.reachscan.adapter.cfg.EdgeKind;
import com.reachscan.adapter.reachability.AnalysisCancelledException;
import com.reachscan.adapter.reachability.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Resolves every call site against the symbol table and adds the inter-procedural CALL edges.
 *
 * Resolution order: exact qualified id; then, for call sites written without a resolved target,
 * a unique match by name and arity in the caller's type, the caller's file, then the whole
 * program. Dynamic, ambiguous and external calls go to the unknown-target node. A resolved call
 * also links to every program function overriding its target.
 */
public class CallGraphLinker {

    private static final Logger LOGGER = LoggerFactory.getLogger(CallGraphLinker.class);

    private final ExecutorService executor;
    private final CancellationToken cancellation;

    /** @param executor pool to link on; null links on the calling thread */
    public CallGraphLinker(ExecutorService executor, CancellationToken cancellation) {
        this.executor = executor;
        this.cancellation = cancellation;
    }

    public CallGraphLinker() {
        this(null, CancellationToken.none());
    }

    public CallGraph link(List<ControlFlowGraph> functions) {
        SymbolTable symbols = SymbolTable.of(functions);
        ControlFlowGraph unknown = ControlFlowGraph.unknownTarget();
        AtomicInteger resolved = new AtomicInteger();
        AtomicInteger unresolved = new AtomicInteger();
        AtomicInteger edges = new AtomicInteger();

        List<Callable<Void>> tasks = new ArrayList<>();
        for (ControlFlowGraph caller : functions) {
            tasks.add(() -> {
                cancellation.throwIfCancelled();
                for (CallSite site : caller.callSites()) {
                    List<ControlFlowGraph> targets = resolve(site, caller, symbols);
                    if (targets.isEmpty()) {
                        site.routeToUnknown(unknown);
                        unresolved.incrementAndGet();
                        LOGGER.debug("Unresolved call {} in {} routed to {}", site.displayName(),
                                caller.function().id(), ControlFlowGraph.UNKNOWN_TARGET_ID);
                    } else {
                        site.resolveTo(targets);
                        resolved.incrementAndGet();
                    }
                    for (ControlFlowGraph target : site.targets()) {
                        site.block().addCallEdge(new Edge(site.block(), target.entry(), EdgeKind.CALL));
                        edges.incrementAndGet();
                    }
                }
                return null;
            });
        }
        runAll(tasks);

        CallGraph.LinkStats stats = new CallGraph.LinkStats(resolved.get(), unresolved.get(), edges.get());
        LOGGER.info("Linked {} functions: {} call sites resolved, {} routed to unknown target",
                functions.size(), stats.resolved(), stats.unknown());
        return new CallGraph(functions, symbols, unknown, stats);
    }

    /** Targets of {@code site}, or an empty list when it must go to the unknown-target node. */
    List<ControlFlowGraph> resolve(CallSite site, ControlFlowGraph caller, SymbolTable symbols) {
        if (site.kind() == CallSiteKind.DYNAMIC) {
            return List.of();
        }
        if (site.target() != null) {
            ControlFlowGraph exact = symbols.lookup(site.target());
            return exact == null ? List.of() : symbols.withOverriders(exact);
        }
        List<ControlFlowGraph> candidates = symbols.named(site.name(), site.arity());
        List<Predicate<ControlFlowGraph>> scopes = List.of(
                c -> SymbolTable.sameContainer(c, caller),
                c -> SymbolTable.sameUnit(c, caller),
                c -> true);
        for (Predicate<ControlFlowGraph> scope : scopes) {
            List<ControlFlowGraph> visible = candidates.stream().filter(scope).collect(Collectors.toList());
            if (visible.size() == 1) {
                return symbols.withOverriders(visible.get(0));
            }
            if (visible.size() > 1) {
                LOGGER.debug("Call {} in {} is ambiguous between {} candidates", site.name(),
                        caller.function().id(), visible.size());
                return List.of();
            }
        }
        return List.of();
    }

    private void runAll(List<Callable<Void>> tasks) {
        if (executor == null) {
            for (Callable<Void> task : tasks) {
                try {
                    task.call();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }
            return;
        }
        try {
            for (Future<Void> f : executor.invokeAll(tasks)) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while linking");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        }
    }
}
