package com.reachscan.adapter.report;

import com.reachscan.adapter.ast.SourceUnit;
import com.reachscan.adapter.cfg.BasicBlock;
import com.reachscan.adapter.cfg.CallSite;
import com.reachscan.adapter.cfg.ControlFlowGraph;
import com.reachscan.adapter.cfg.ResolutionState;
import com.reachscan.adapter.reachability.Classification;
import com.reachscan.adapter.reachability.EntryPoint;
import com.reachscan.adapter.reachability.ReachabilityAnalyzer.AnalysisResult;
import com.reachscan.adapter.reachability.ReachabilityResult;
import com.reachscan.adapter.report.ReportModel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps a converged analysis onto the report model: one entry per unit, function and block, the
 * calls that went to the unknown target or were excluded, and the summary counts.
 */
public class ReportBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportBuilder.class);

    public ReportRoot build(AnalysisResult analysis, String repoRoot, String projectName) {
        ReachabilityResult result = analysis.reachability();
        ReportRoot root = new ReportRoot();
        root.reportVersion = ReportModel.REPORT_VERSION;
        root.language = "java";
        root.repoRoot = repoRoot;
        root.projectName = projectName;
        root.entryPoints = new ArrayList<>();
        root.units = new ArrayList<>();
        root.functions = new ArrayList<>();
        root.blocks = new ArrayList<>();
        root.unresolvedCalls = new ArrayList<>();
        root.summary = new ReportSummary();

        Set<String> entryIds = new HashSet<>();
        for (EntryPoint entry : analysis.entryPoints()) {
            ReportEntryPoint e = new ReportEntryPoint();
            e.function = entry.id();
            e.reason = entry.reason().name();
            root.entryPoints.add(e);
            entryIds.add(entry.id());
        }

        Map<String, TreeSet<Integer>> deadLinesByUnit = new LinkedHashMap<>();
        Map<String, Set<Integer>> liveLinesByUnit = new LinkedHashMap<>();
        Map<String, Integer> functionsByUnit = new LinkedHashMap<>();
        for (SourceUnit unit : analysis.units()) {
            deadLinesByUnit.put(unit.path(), new TreeSet<>());
            functionsByUnit.put(unit.path(), unit.functions().size());
        }

        for (ControlFlowGraph cfg : analysis.graph().functions()) {
            ReportFunction fn = function(cfg, result, entryIds);
            root.functions.add(fn);
            tally(root.summary, fn.classification);

            for (BasicBlock block : cfg.blocks()) {
                ReportBlock rb = block(block, result.classify(block));
                root.blocks.add(rb);
                root.summary.blocks++;
                if (rb.classification.equals(Classification.DEAD.name())) root.summary.deadBlocks++;
                if (rb.classification.equals(Classification.UNREACHABLE_LOCAL.name())) root.summary.unreachableLocalBlocks++;
                if (!rb.synthetic && result.classify(block).isFinding()) {
                    root.summary.findings++;
                    deadLinesByUnit.computeIfAbsent(rb.unit, k -> new TreeSet<>()).addAll(rb.lines);
                } else if (result.isLive(block)) {
                    liveLinesByUnit.computeIfAbsent(rb.unit, k -> new HashSet<>()).addAll(rb.lines);
                }
            }

            for (CallSite site : cfg.callSites()) {
                if (site.state() == ResolutionState.UNKNOWN_TARGET || site.state() == ResolutionState.EXCLUDED) {
                    ReportCall call = new ReportCall();
                    call.caller = cfg.function().id();
                    call.block = site.block().id();
                    call.target = site.displayName();
                    call.kind = site.kind().name();
                    call.state = site.state().name();
                    root.unresolvedCalls.add(call);
                }
            }
        }

        // a line shared with a live block (a catch clause on the try's line) is not dead
        deadLinesByUnit.forEach((path, lines) -> {
            lines.removeAll(liveLinesByUnit.getOrDefault(path, Set.of()));
            ReportUnit unit = new ReportUnit();
            unit.path = path;
            unit.functionCount = functionsByUnit.getOrDefault(path, 0);
            unit.deadLines = new ArrayList<>(lines);
            root.units.add(unit);
        });
        return root;
    }

    /** Logs one line per unit holding findings, in unit order. */
    public void logFindings(ReportRoot root) {
        for (ReportUnit unit : root.units) {
            if (!unit.deadLines.isEmpty()) {
                LOGGER.info("Unreachable code suspected in {} at lines: {}", unit.path, unit.deadLines);
            }
        }
    }

    private ReportFunction function(ControlFlowGraph cfg, ReachabilityResult result, Set<String> entryIds) {
        ReportFunction fn = new ReportFunction();
        fn.id = cfg.function().id();
        fn.name = cfg.function().name();
        fn.unit = cfg.function().unitPath();
        fn.lineStart = cfg.function().location().line();
        fn.visibility = cfg.function().visibility().name();
        Classification classification = result.classify(cfg);
        if (cfg.isFallback() && classification != Classification.EXCLUDED) {
            fn.classification = ReportModel.UNANALYZED;
            fn.unanalyzedReason = cfg.failure();
        } else {
            fn.classification = classification.name();
        }
        fn.isEntryPoint = entryIds.contains(fn.id);
        fn.witness = result.witness(cfg);
        return fn;
    }

    private ReportBlock block(BasicBlock block, Classification classification) {
        ReportBlock rb = new ReportBlock();
        rb.function = block.owner().function().id();
        rb.block = block.id();
        rb.unit = block.owner().function().unitPath();
        rb.lineStart = block.firstLine();
        rb.lineEnd = block.lastLine();
        rb.lines = block.lines();
        rb.terminator = block.terminator() == null ? null : block.terminator().name();
        rb.classification = classification.name();
        rb.synthetic = block.isSynthetic();
        return rb;
    }

    private void tally(ReportSummary summary, String classification) {
        summary.functions++;
        switch (classification) {
            case "LIVE" -> summary.liveFunctions++;
            case "DEAD" -> summary.deadFunctions++;
            case "EXCLUDED" -> summary.excludedFunctions++;
            case ReportModel.UNANALYZED -> summary.unanalyzedFunctions++;
            default -> { }
        }
    }
}
