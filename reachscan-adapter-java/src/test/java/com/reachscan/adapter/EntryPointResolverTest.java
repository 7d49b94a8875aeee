package com.reachscan.adapter;

import com.reachscan.adapter.ast.FunctionDecl;
import com.reachscan.adapter.ast.FunctionTrait;
import com.reachscan.adapter.callgraph.CallGraph;
import com.reachscan.adapter.callgraph.CallGraphLinker;
import com.reachscan.adapter.cfg.CfgBuilder;
import com.reachscan.adapter.cfg.ControlFlowGraph;
import com.reachscan.adapter.reachability.AnalysisOptions;
import com.reachscan.adapter.reachability.EntryPoint;
import com.reachscan.adapter.reachability.EntryPointResolver;
import com.reachscan.adapter.reachability.EntryReason;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.reachscan.adapter.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class EntryPointResolverTest {

    private static CallGraph graph;

    @BeforeAll
    static void linkProgram() {
        List<FunctionDecl> functions = List.of(
            function("java::demo.App::main(String[])", Set.of(FunctionTrait.MAIN), List.of(), work(1)),
            function("java::demo.App::helper()", work(5)),
            exported("java::demo.Api::handle()", work(10)),
            function("java::demo.AppTest::checksTotals()", Set.of(FunctionTrait.TEST), List.of(), work(20)),
            function("java::demo.Registry::<clinit>()", Set.of(FunctionTrait.STATIC_INITIALIZER), List.of(), work(30)),
            function("java::demo.Task::run()", Set.of(FunctionTrait.OVERRIDES_EXTERNAL), List.of(), work(40)));
        CfgBuilder builder = new CfgBuilder();
        List<ControlFlowGraph> cfgs = new ArrayList<>();
        for (FunctionDecl fn : functions) cfgs.add(builder.build(fn));
        graph = new CallGraphLinker().link(cfgs);
    }

    private static Map<String, EntryReason> resolve(AnalysisOptions options) {
        Map<String, EntryReason> roots = new LinkedHashMap<>();
        for (EntryPoint entry : new EntryPointResolver(options).resolve(graph)) {
            roots.put(entry.id(), entry.reason());
        }
        return roots;
    }

    @Test
    void defaultPolicyRootsEveryAutomaticClass() {
        Map<String, EntryReason> roots = resolve(AnalysisOptions.defaults());

        assertEquals(EntryReason.MAIN, roots.get("java::demo.App::main(String[])"));
        assertEquals(EntryReason.EXPORTED, roots.get("java::demo.Api::handle()"));
        assertEquals(EntryReason.TEST, roots.get("java::demo.AppTest::checksTotals()"));
        assertEquals(EntryReason.STATIC_INITIALIZER, roots.get("java::demo.Registry::<clinit>()"));
        assertEquals(EntryReason.EXTERNAL_OVERRIDE, roots.get("java::demo.Task::run()"));
        assertFalse(roots.containsKey("java::demo.App::helper()"));
    }

    @Test
    void declaredOnlyKeepsMainAndStaticInitializers() {
        Map<String, EntryReason> roots = resolve(AnalysisOptions.defaults().declaredOnly());

        assertEquals(Set.of("java::demo.App::main(String[])", "java::demo.Registry::<clinit>()"), roots.keySet());
    }

    @Test
    void declaredRootAcceptsShortForms() {
        for (String form : List.of("java::demo.App::helper()", "demo.App::helper()", "demo.App::helper",
                "App::helper", "helper")) {
            Map<String, EntryReason> roots = resolve(AnalysisOptions.defaults().declaredOnly()
                .withEntryPoints(List.of(form)));
            assertEquals(EntryReason.DECLARED, roots.get("java::demo.App::helper()"), form);
        }
    }

    @Test
    void declaredReasonWinsOverAutomaticOne() {
        Map<String, EntryReason> roots = resolve(AnalysisOptions.defaults()
            .withEntryPoints(List.of("demo.Api::handle")));

        assertEquals(EntryReason.DECLARED, roots.get("java::demo.Api::handle()"));
    }

    @Test
    void unknownDeclaredRootIsIgnored() {
        Map<String, EntryReason> roots = resolve(AnalysisOptions.defaults().declaredOnly()
            .withEntryPoints(List.of("demo.Nowhere::run")));

        assertEquals(2, roots.size());
    }

    @Test
    void entryPointsAreSortedById() {
        List<EntryPoint> entries = new EntryPointResolver(AnalysisOptions.defaults()).resolve(graph);

        List<String> ids = entries.stream().map(EntryPoint::id).toList();
        List<String> sorted = new ArrayList<>(ids);
        sorted.sort(null);
        assertEquals(sorted, ids);
    }
}
