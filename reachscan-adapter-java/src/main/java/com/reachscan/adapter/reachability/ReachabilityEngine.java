package com.reachscan.adapter.reachability;

import com.reachscan.adapter.callgraph.CallGraph;
import com.reachscan.adapter.cfg.BasicBlock;
import com.reachscan.adapter.cfg.CallSite;
import com.reachscan.adapter.cfg.ControlFlowGraph;
import com.reachscan.adapter.cfg.Edge;
import com.reachscan.adapter.cfg.EdgeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Worklist fixpoint over the linked graph.
 *
 * A block is marked live at most once. Intra-procedural edges are followed as soon as their
 * source is live, unless they are guarded, in which case one of the guards must be live too.
 * The block after a call (its RETURN_TO_CALLER successor) is only reached once some callee of
 * that call has a live exit. The unknown-target node and unanalyzed functions always have one.
 */
public class ReachabilityEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReachabilityEngine.class);

    private final CancellationToken cancellation;

    public ReachabilityEngine(CancellationToken cancellation) {
        this.cancellation = cancellation;
    }

    public ReachabilityEngine() {
        this(CancellationToken.none());
    }

    /**
     * @throws AnalysisCancelledException if the token is cancelled before the worklist drains
     */
    public ReachabilityResult run(CallGraph graph, List<EntryPoint> entryPoints) {
        Traversal traversal = new Traversal();
        List<EntryPoint> seeds = new ArrayList<>(entryPoints);
        seeds.sort(null);
        for (EntryPoint entry : seeds) {
            traversal.mark(entry.function().entry(), Reason.seed(entry));
        }
        int pops = 0;
        while (!traversal.worklist.isEmpty()) {
            cancellation.throwIfCancelled();
            traversal.visit(traversal.worklist.poll());
            pops++;
        }
        traversal.states.replaceAll((cfg, state) -> FunctionState.RESOLVED);
        LOGGER.debug("Fixpoint reached after {} worklist pops", pops);
        return new ReachabilityResult(graph, seeds, traversal.live, traversal.states);
    }

    /** Why a block first became live: the block it was reached from, or the entry point that seeded it. */
    public record Reason(BasicBlock predecessor, EdgeKind via, EntryPoint seed) {
        static Reason seed(EntryPoint entry) {
            return new Reason(null, null, entry);
        }

        public boolean isSeed() {
            return seed != null;
        }
    }

    private static final class Traversal {
        final Map<BasicBlock, Reason> live = new ConcurrentHashMap<>();
        final Map<ControlFlowGraph, FunctionState> states = new HashMap<>();
        final Deque<BasicBlock> worklist = new ArrayDeque<>();
        final Set<ControlFlowGraph> returning = new HashSet<>();
        final Map<ControlFlowGraph, List<BasicBlock>> awaitingReturn = new HashMap<>();
        final Map<BasicBlock, List<Runnable>> awaitingGuard = new HashMap<>();

        void mark(BasicBlock block, Reason reason) {
            if (live.putIfAbsent(block, reason) != null) {
                return;
            }
            worklist.add(block);
            states.putIfAbsent(block.owner(), FunctionState.IN_PROGRESS);
            List<Runnable> released = awaitingGuard.remove(block);
            if (released != null) {
                released.forEach(Runnable::run);
            }
        }

        void visit(BasicBlock block) {
            ControlFlowGraph owner = block.owner();
            if (owner.isFallback()) {
                returns(owner);
            }
            for (Edge edge : block.successors()) {
                if (edge.kind() != EdgeKind.RETURN_TO_CALLER) {
                    follow(edge);
                }
            }
            if (block.exitsFunction()) {
                whenAnyLive(block.exitGuards(), () -> returns(owner));
            }
            for (Edge call : block.callEdges()) {
                mark(call.to(), new Reason(block, EdgeKind.CALL, null));
            }
            Edge continuation = block.continuation();
            if (continuation != null) {
                resumeAfterCall(block, continuation);
            }
        }

        void follow(Edge edge) {
            whenAnyLive(edge.guards(), () -> mark(edge.to(), new Reason(edge.from(), edge.kind(), null)));
        }

        /** Runs {@code action} now if {@code guards} is empty or one of them is live, else once the first one is. */
        void whenAnyLive(List<BasicBlock> guards, Runnable action) {
            if (guards.isEmpty()) {
                action.run();
                return;
            }
            for (BasicBlock guard : guards) {
                if (live.containsKey(guard)) {
                    action.run();
                    return;
                }
            }
            Runnable once = new Runnable() {
                boolean done;

                @Override
                public void run() {
                    if (!done) {
                        done = true;
                        action.run();
                    }
                }
            };
            for (BasicBlock guard : guards) {
                awaitingGuard.computeIfAbsent(guard, g -> new ArrayList<>()).add(once);
            }
        }

        void resumeAfterCall(BasicBlock caller, Edge continuation) {
            CallSite gate = null;
            for (CallSite site : caller.callSites()) {
                if (site.gatesContinuation()) {
                    gate = site;
                }
            }
            if (gate == null || gate.targets().isEmpty()) {
                mark(continuation.to(), new Reason(caller, EdgeKind.RETURN_TO_CALLER, null));
                return;
            }
            for (ControlFlowGraph callee : gate.targets()) {
                if (returning.contains(callee)) {
                    mark(continuation.to(), new Reason(caller, EdgeKind.RETURN_TO_CALLER, null));
                    return;
                }
            }
            for (ControlFlowGraph callee : gate.targets()) {
                awaitingReturn.computeIfAbsent(callee, c -> new ArrayList<>()).add(caller);
            }
        }

        void returns(ControlFlowGraph function) {
            if (!returning.add(function)) {
                return;
            }
            List<BasicBlock> callers = awaitingReturn.remove(function);
            if (callers == null) {
                return;
            }
            for (BasicBlock caller : callers) {
                mark(caller.continuation().to(), new Reason(caller, EdgeKind.RETURN_TO_CALLER, null));
            }
        }
    }
}
