package com.reachscan.adapter;

import com.reachscan.adapter.ast.FunctionDecl;
import com.reachscan.adapter.ast.FunctionTrait;
import com.reachscan.adapter.callgraph.CallGraph;
import com.reachscan.adapter.cfg.BasicBlock;
import com.reachscan.adapter.cfg.ControlFlowGraph;
import com.reachscan.adapter.cfg.Edge;
import com.reachscan.adapter.cfg.EdgeKind;
import com.reachscan.adapter.reachability.AnalysisCancelledException;
import com.reachscan.adapter.reachability.AnalysisOptions;
import com.reachscan.adapter.reachability.CancellationToken;
import com.reachscan.adapter.reachability.Classification;
import com.reachscan.adapter.reachability.EntryPoint;
import com.reachscan.adapter.reachability.EntryReason;
import com.reachscan.adapter.reachability.FunctionState;
import com.reachscan.adapter.reachability.ReachabilityAnalyzer;
import com.reachscan.adapter.reachability.ReachabilityEngine;
import com.reachscan.adapter.reachability.ReachabilityResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

import static com.reachscan.adapter.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ReachabilityEngineTest {

    private static final String A = "java::demo.App::a()";
    private static final String B = "java::demo.App::b()";
    private static final String C = "java::demo.App::c()";
    private static final String D = "java::demo.App::d()";
    private static final String E = "java::demo.App::e()";
    private static final String EXTERNAL = "java::ext.Lib::call()";

    private static ReachabilityAnalyzer.AnalysisResult analyze(List<String> roots, List<String> excludes,
                                                                FunctionDecl... functions) {
        AnalysisOptions options = AnalysisOptions.defaults()
            .declaredOnly()
            .withEntryPoints(roots)
            .withExcludePatterns(excludes)
            .withThreads(2);
        return new ReachabilityAnalyzer().analyze(List.of(unit(functions)), options);
    }

    private static ReachabilityAnalyzer.AnalysisResult analyze(String root, FunctionDecl... functions) {
        return analyze(List.of(root), List.of(), functions);
    }

    private static ControlFlowGraph cfg(ReachabilityAnalyzer.AnalysisResult result, String id) {
        return result.graph().symbols().lookup(id);
    }

    private static Classification classify(ReachabilityAnalyzer.AnalysisResult result, String id) {
        return result.reachability().classify(cfg(result, id));
    }

    private static Classification classifyLine(ReachabilityAnalyzer.AnalysisResult result, String id, int line) {
        return result.reachability().classify(blockAt(cfg(result, id), line));
    }

    private static FunctionDecl[] workedExample() {
        return new FunctionDecl[] {
            function(A, work(1), ret(2), work(3)),
            function(C, call(10, D), call(11, E)),
            function(D, work(20)),
            function(E, work(30)),
        };
    }

    @Test
    void workedExampleWithoutExclusions() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(List.of(A), List.of(), workedExample());

        assertEquals(Classification.LIVE, classify(result, A));
        assertEquals(Classification.LIVE, classifyLine(result, A, 1));
        assertEquals(Classification.UNREACHABLE_LOCAL, classifyLine(result, A, 3));
        assertEquals(Classification.DEAD, classify(result, C));
        assertEquals(Classification.DEAD, classify(result, D));
        assertEquals(Classification.DEAD, classify(result, E));
        assertEquals(Classification.DEAD, classifyLine(result, D, 20));
    }

    @Test
    void workedExampleWithExcludedCaller() {
        ReachabilityAnalyzer.AnalysisResult result =
            analyze(List.of(A), List.of("symbol:demo.App::c()"), workedExample());

        assertEquals(Classification.EXCLUDED, classify(result, C));
        assertEquals(Classification.EXCLUDED, classifyLine(result, C, 10));
        assertEquals(Classification.DEAD, classify(result, D));
        assertEquals(Classification.DEAD, classify(result, E));
        assertEquals(Classification.UNREACHABLE_LOCAL, classifyLine(result, A, 3));
        assertTrue(result.reachability().findings().stream()
            .noneMatch(b -> b.owner().function().id().equals(C)));
    }

    @Test
    void callChainIsLiveWithWitness() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, call(1, B), work(2)),
            function(B, call(10, C), work(11)),
            function(C, work(20)));

        assertTrue(result.reachability().findings().isEmpty());
        assertEquals(List.of(A, B, C), result.reachability().witness(cfg(result, C)));
        assertEquals(List.of(A), result.reachability().witness(cfg(result, A)));
        assertEquals(EntryReason.DECLARED, result.reachability().seedOf(cfg(result, A)).reason());
        assertNull(result.reachability().seedOf(cfg(result, B)));
    }

    @Test
    void excludedFunctionStillPassesTraversalThrough() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(List.of(A), List.of("symbol:demo.App::c()"),
            function(A, call(1, C)),
            function(C, call(10, D)),
            function(D, work(20)));

        assertEquals(Classification.EXCLUDED, classify(result, C));
        assertEquals(Classification.LIVE, classify(result, D));
        assertEquals(List.of(A, C, D), result.reachability().witness(cfg(result, D)));
    }

    @Test
    void unresolvedCallIsAssumedToReturn() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, call(1, EXTERNAL), work(2)),
            function(B, work(10)));

        assertEquals(Classification.LIVE, classifyLine(result, A, 2));
        assertEquals(Classification.DEAD, classify(result, B));
        assertTrue(result.reachability().isLive(result.graph().unknownTarget()));
    }

    @Test
    void unresolvedCallNeverMakesUnrelatedFunctionLive() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, dynamicCall(1, "b"), callByName(2, "missing", 0)),
            function(B, work(10)));

        assertEquals(Classification.DEAD, classify(result, B));
    }

    @Test
    void codeAfterCallThatAlwaysRaisesIsUnreachable() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, call(1, B), work(2)),
            function(B, raise(10)));

        assertEquals(Classification.LIVE, classify(result, B));
        assertEquals(Classification.UNREACHABLE_LOCAL, classifyLine(result, A, 2));
    }

    @Test
    void recursionTerminates() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, ifThen(1, cond("more"), call(2, B)), work(3)),
            function(B, call(10, A), work(11)));

        assertTrue(result.reachability().findings().isEmpty());
        assertEquals(FunctionState.RESOLVED, result.reachability().state(cfg(result, A)));
        assertEquals(FunctionState.RESOLVED, result.reachability().state(cfg(result, B)));
    }

    @Test
    void unconditionalSelfRecursionNeverResumes() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A, function(A, call(1, A), work(2)));

        assertEquals(Classification.UNREACHABLE_LOCAL, classifyLine(result, A, 2));
    }

    @Test
    void catchIsLiveWhenTryBodyCanRaise() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, tryCatch(1, List.of(call(2, EXTERNAL)), List.of(work(3)), null), work(4)));

        assertTrue(result.reachability().findings().isEmpty());
    }

    @Test
    void catchIsUnreachableWhenTryBodyCannotRaise() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, tryCatch(1, List.of(work(2)), List.of(work(3)), null), work(4)));

        assertEquals(Classification.UNREACHABLE_LOCAL, classifyLine(result, A, 3));
        assertEquals(Classification.LIVE, classifyLine(result, A, 4));
    }

    @Test
    void finallyAfterReturnRunsButCodeAfterTryDoesNot() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(B,
            function(A, tryCatch(1, List.of(ret(2)), null, List.of(work(3))), work(4)),
            function(B, call(10, A), work(11)));

        assertEquals(Classification.LIVE, classifyLine(result, A, 3));
        assertEquals(Classification.UNREACHABLE_LOCAL, classifyLine(result, A, 4));
        // the return routed through finally still returns to the caller
        assertEquals(Classification.LIVE, classifyLine(result, B, 11));
    }

    @Test
    void finallyReRaiseReachesOuterHandler() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A,
                tryCatch(1,
                    List.of(tryCatch(2, List.of(call(3, B)), null, List.of(work(4)))),
                    List.of(work(5)), null),
                work(6)),
            function(B, raise(10)));

        assertEquals(Classification.LIVE, classifyLine(result, A, 4));
        assertEquals(Classification.LIVE, classifyLine(result, A, 5));
        assertEquals(Classification.LIVE, classifyLine(result, A, 6));
    }

    @Test
    void exceptionPassesInnerCatchToOuterHandler() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A,
                tryCatch(1,
                    List.of(tryCatch(2, List.of(call(3, B)), List.of(ret(4)), null)),
                    List.of(work(5)), null),
                work(6)),
            function(B, raise(10)));

        assertEquals(Classification.LIVE, classifyLine(result, A, 4));
        assertEquals(Classification.LIVE, classifyLine(result, A, 5));
        assertEquals(Classification.LIVE, classifyLine(result, A, 6));
        assertTrue(result.reachability().findings().isEmpty());
    }

    @Test
    void virtualCallReachesOverridersOnly() {
        String shape = "java::demo.Shape::area()";
        String square = "java::demo.Square::area()";
        String circle = "java::demo.Circle::area()";
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, call(1, shape), work(2)),
            function(shape, Set.of(FunctionTrait.ABSTRACT), List.of()),
            function(square, Set.of(), List.of(shape), work(10)),
            function(circle, Set.of(), List.of(), work(20)));

        assertEquals(Classification.LIVE, classify(result, square));
        assertEquals(Classification.DEAD, classify(result, circle));
        assertEquals(Classification.LIVE, classifyLine(result, A, 2));
    }

    @Test
    void referencedLambdaIsLive() {
        String lambda = "java::demo.App::lambda$0()";
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, ref(1, lambda), work(2)),
            function(lambda, Set.of(FunctionTrait.SYNTHETIC), List.of(), work(10)));

        assertEquals(Classification.LIVE, classify(result, lambda));
    }

    @Test
    void unanalyzedFunctionKeepsItsCalleesAndCallersAlive() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A, call(1, B), work(2)),
            function(B, unsupported(10), call(11, C)),
            function(C, work(20)));

        assertTrue(cfg(result, B).isFallback());
        assertEquals(Classification.LIVE, classify(result, B));
        assertEquals(Classification.LIVE, classify(result, C));
        assertEquals(Classification.LIVE, classifyLine(result, A, 2));
    }

    @Test
    void neverReachedFunctionStaysUnvisited() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A, function(A, work(1)), function(B, work(10)));

        assertEquals(FunctionState.UNVISITED, result.reachability().state(cfg(result, B)));
        assertTrue(result.reachability().witness(cfg(result, B)).isEmpty());
    }

    @Test
    void liveBlocksPropagateAlongEveryUnguardedEdge() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A,
            function(A,
                whileLoop(1, cond("more"),
                    ifElse(2, or(cond("x"), cond("y")), call(3, B), brk(4))),
                switchOf(5, true, caseOf(6, call(6, C)), defaultCase(7, ret(7))),
                tryCatch(8, List.of(call(9, EXTERNAL)), List.of(work(10)), List.of(work(11))),
                work(12)),
            function(B, ifThen(20, bool(false), work(21)), work(22)),
            function(C, call(30, D)),
            function(D, work(40)));

        ReachabilityResult reachability = result.reachability();
        for (ControlFlowGraph cfg : result.graph().functions()) {
            for (BasicBlock block : cfg.blocks()) {
                if (!reachability.isLive(block)) continue;
                for (Edge edge : block.successors()) {
                    if (edge.kind() != EdgeKind.RETURN_TO_CALLER && !edge.isGuarded()) {
                        assertTrue(reachability.isLive(edge.to()), edge.toString());
                    }
                }
                for (Edge call : block.callEdges()) {
                    assertTrue(reachability.isLive(call.to()), call.toString());
                }
            }
        }
        assertEquals(Classification.UNREACHABLE_LOCAL, classifyLine(result, B, 21));
        assertEquals(Classification.LIVE, classify(result, D));
    }

    @Test
    void rerunningOnSameGraphGivesSameClassifications() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A, workedExample());
        CallGraph graph = result.graph();

        SortedMap<String, Classification> first = new ReachabilityEngine().run(graph, result.entryPoints()).snapshot();
        SortedMap<String, Classification> second = new ReachabilityEngine().run(graph, result.entryPoints()).snapshot();
        assertEquals(first, second);
        assertEquals(result.reachability().snapshot(), first);
    }

    @Test
    void addingEntryPointNeverShrinksLiveSet() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A, workedExample());
        CallGraph graph = result.graph();
        List<EntryPoint> more = new ArrayList<>(result.entryPoints());
        more.add(new EntryPoint(graph.symbols().lookup(C), EntryReason.DECLARED));

        SortedMap<String, Classification> before = result.reachability().snapshot();
        SortedMap<String, Classification> after = new ReachabilityEngine().run(graph, more).snapshot();
        for (Map.Entry<String, Classification> e : before.entrySet()) {
            if (e.getValue() == Classification.LIVE) {
                assertEquals(Classification.LIVE, after.get(e.getKey()), e.getKey());
            }
        }
        assertEquals(Classification.LIVE, after.get(E + "#b0"));
    }

    @Test
    void addingCallEdgeNeverShrinksLiveFunctions() {
        ReachabilityAnalyzer.AnalysisResult before = analyze(A, workedExample());
        ReachabilityAnalyzer.AnalysisResult after = analyze(A,
            function(A, work(1), call(2, D), ret(2), work(3)),
            function(C, call(10, D), call(11, E)),
            function(D, work(20)),
            function(E, work(30)));

        for (String id : List.of(A, C, D, E)) {
            if (classify(before, id) == Classification.LIVE) {
                assertEquals(Classification.LIVE, classify(after, id), id);
            }
        }
        assertEquals(Classification.LIVE, classify(after, D));
    }

    @Test
    void buildThreadCountDoesNotChangeResult() {
        List<FunctionDecl> functions = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            String next = "java::demo.App::f" + (i + 1) + "()";
            functions.add(function("java::demo.App::f" + i + "()",
                ifElse(1, cond("c"), call(2, next), ret(3)),
                work(4),
                i % 7 == 0 ? raise(5) : work(5),
                work(6)));
        }
        FunctionDecl[] program = functions.toArray(new FunctionDecl[0]);
        AnalysisOptions options = AnalysisOptions.defaults().declaredOnly()
            .withEntryPoints(List.of("java::demo.App::f0()"));

        SortedMap<String, Classification> single = new ReachabilityAnalyzer()
            .analyze(List.of(unit(program)), options.withThreads(1)).reachability().snapshot();
        SortedMap<String, Classification> parallel = new ReachabilityAnalyzer()
            .analyze(List.of(unit(program)), options.withThreads(8)).reachability().snapshot();
        assertEquals(single, parallel);
    }

    @Test
    void cancelledRunStops() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AnalysisOptions options = AnalysisOptions.defaults()
            .withEntryPoints(List.of(A))
            .withCancellation(token);

        assertThrows(AnalysisCancelledException.class,
            () -> new ReachabilityAnalyzer().analyze(List.of(unit(workedExample())), options));
    }

    @Test
    void cancelledEngineStops() {
        ReachabilityAnalyzer.AnalysisResult result = analyze(A, workedExample());
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(AnalysisCancelledException.class,
            () -> new ReachabilityEngine(token).run(result.graph(), result.entryPoints()));
    }
}
