package com.reachscan.adapter.reachability;

import com.reachscan.adapter.ast.FunctionDecl;
import com.reachscan.adapter.ast.SourceUnit;
import com.reachscan.adapter.callgraph.CallGraph;
import com.reachscan.adapter.callgraph.CallGraphLinker;
import com.reachscan.adapter.cfg.CfgBuilder;
import com.reachscan.adapter.cfg.ControlFlowGraph;
import com.reachscan.adapter.exclusion.ExclusionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the whole pipeline on parsed source units: CFG construction on a worker pool, then
 * linking, exclusion marking, entry-point resolution and the reachability fixpoint.
 */
public class ReachabilityAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReachabilityAnalyzer.class);

    private final CfgBuilder cfgBuilder = new CfgBuilder();

    public record AnalysisResult(
            List<SourceUnit> units,
            CallGraph graph,
            List<EntryPoint> entryPoints,
            ReachabilityResult reachability) {}

    /**
     * @throws com.reachscan.adapter.exclusion.InvalidExclusionPatternException before any work
     *         is done if an exclusion rule is malformed
     * @throws AnalysisCancelledException if the run is cancelled
     */
    public AnalysisResult analyze(List<SourceUnit> units, AnalysisOptions options) {
        ExclusionFilter exclusions = ExclusionFilter.compile(options.excludePatterns());
        CancellationToken cancellation = options.cancellation();

        ExecutorService pool = Executors.newFixedThreadPool(options.threads());
        try {
            List<ControlFlowGraph> cfgs = buildAll(units, pool, cancellation);
            CallGraph graph = new CallGraphLinker(pool, cancellation).link(cfgs);
            exclusions.apply(graph);
            List<EntryPoint> entryPoints = new EntryPointResolver(options).resolve(graph);
            cancellation.throwIfCancelled();
            ReachabilityResult reachability = new ReachabilityEngine(cancellation).run(graph, entryPoints);
            LOGGER.info("Reachability converged: {} live blocks, {} findings",
                    reachability.liveBlockCount(), reachability.findings().size());
            return new AnalysisResult(units, graph, entryPoints, reachability);
        } finally {
            pool.shutdownNow();
        }
    }

    private List<ControlFlowGraph> buildAll(List<SourceUnit> units, ExecutorService pool,
                                            CancellationToken cancellation) {
        List<Callable<ControlFlowGraph>> tasks = new ArrayList<>();
        for (SourceUnit unit : units) {
            for (FunctionDecl fn : unit.functions()) {
                tasks.add(() -> {
                    cancellation.throwIfCancelled();
                    return cfgBuilder.buildOrFallback(fn);
                });
            }
        }
        List<ControlFlowGraph> cfgs = new ArrayList<>(tasks.size());
        try {
            for (Future<ControlFlowGraph> f : pool.invokeAll(tasks)) {
                cfgs.add(f.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisCancelledException("Interrupted while building control-flow graphs");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        }
        long unanalyzed = cfgs.stream().filter(ControlFlowGraph::isFallback).count();
        LOGGER.info("Built {} control-flow graphs from {} source units ({} unanalyzed)",
                cfgs.size(), units.size(), unanalyzed);
        return cfgs;
    }
}
