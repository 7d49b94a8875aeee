package com.reachscan.adapter;

import com.reachscan.adapter.ast.Ast;
import com.reachscan.adapter.ast.AstWalker;
import com.reachscan.adapter.ast.FunctionDecl;
import com.reachscan.adapter.ast.FunctionTrait;
import com.reachscan.adapter.ast.SourceUnit;
import com.reachscan.adapter.ast.Visibility;
import com.reachscan.adapter.reachability.AnalysisOptions;
import com.reachscan.adapter.reachability.Classification;
import com.reachscan.adapter.reachability.ReachabilityAnalyzer;
import com.reachscan.adapter.static_analysis.StaticAnalyzer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test: runs the front end on the inventory-service fixture.
 */
class StaticAnalyzerTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/inventory-service");

    private static final String PKG = "java::com.reachscan.fixture.";

    private static List<SourceUnit> units;
    private static Map<String, FunctionDecl> functions;

    @BeforeAll
    static void runAnalysis() {
        units = new StaticAnalyzer().analyze(FIXTURE_ROOT);
        functions = units.stream()
            .flatMap(u -> u.functions().stream())
            .collect(Collectors.toMap(FunctionDecl::id, Function.identity(), (a, b) -> a));
    }

    private static FunctionDecl fn(String id) {
        FunctionDecl fn = functions.get(id);
        assertNotNull(fn, "Function not found: " + id + " in " + functions.keySet());
        return fn;
    }

    private static List<Ast.CallExpr> calls(FunctionDecl fn) {
        List<Ast.CallExpr> calls = new ArrayList<>();
        AstWalker.forEachExpr(fn.body(), e -> {
            if (e instanceof Ast.CallExpr c) calls.add(c);
        });
        return calls;
    }

    @Test
    void everySourceFileBecomesUnitWithRelativePath() {
        List<String> paths = units.stream().map(SourceUnit::path).toList();
        assertEquals(List.of(
            "src/main/java/com/reachscan/fixture/Inventory.java",
            "src/main/java/com/reachscan/fixture/InventoryApp.java",
            "src/main/java/com/reachscan/fixture/legacy/OldImporter.java"), paths);
    }

    @Test
    void methodIdsUseErasedParameterTypes() {
        FunctionDecl restock = fn(PKG + "Inventory::restock(String, int)");
        assertEquals("restock", restock.name());
        assertEquals(2, restock.arity());
        assertEquals(PKG + "Inventory", restock.container());
        assertEquals(13, restock.location().line());
        fn(PKG + "Inventory::forEachItem(Consumer)");
    }

    @Test
    void mainIsRecognisedAndExported() {
        FunctionDecl main = fn(PKG + "InventoryApp::main(String[])");
        assertTrue(main.has(FunctionTrait.MAIN));
        assertEquals(Visibility.EXPORTED, main.visibility());
    }

    @Test
    void packagePrivateTypeMembersAreNotExported() {
        assertEquals(Visibility.INTERNAL, fn(PKG + "Inventory::total()").visibility());
        assertEquals(Visibility.INTERNAL, fn(PKG + "Inventory::legacyCount()").visibility());
    }

    @Test
    void syntheticInitializersAndDefaultConstructorExtracted() {
        assertTrue(fn(PKG + "Inventory::<clinit>()").has(FunctionTrait.STATIC_INITIALIZER));
        assertTrue(fn(PKG + "Inventory::<fields>()").has(FunctionTrait.SYNTHETIC));

        FunctionDecl ctor = fn(PKG + "Inventory::<init>()");
        assertTrue(ctor.has(FunctionTrait.SYNTHETIC));
        Ast.Stmt first = ctor.body().get(0);
        assertTrue(first instanceof Ast.ExprStmt s && s.expr() instanceof Ast.FunctionRefExpr ref
            && ref.target().equals(PKG + "Inventory::<fields>()"));
    }

    @Test
    void lambdaBecomesSyntheticFunctionReferencedFromEnclosingMethod() {
        FunctionDecl lambda = fn(PKG + "InventoryApp::lambda$1()");
        assertTrue(lambda.has(FunctionTrait.SYNTHETIC));
        assertEquals(PKG + "InventoryApp", lambda.container());

        List<String> refs = new ArrayList<>();
        AstWalker.forEachExpr(fn(PKG + "InventoryApp::main(String[])").body(), e -> {
            if (e instanceof Ast.FunctionRefExpr r) refs.add(r.target());
        });
        assertTrue(refs.contains(lambda.id()));
    }

    @Test
    void callsCarryResolvedTargets() {
        List<String> targets = calls(fn(PKG + "InventoryApp::main(String[])")).stream()
            .map(Ast.CallExpr::target)
            .toList();
        assertTrue(targets.contains(PKG + "Inventory::<init>()"));
        assertTrue(targets.contains(PKG + "Inventory::restock(String, int)"));
        assertTrue(targets.contains(PKG + "Inventory::total()"));
    }

    @Test
    void constantConditionIsFolded() {
        FunctionDecl restock = fn(PKG + "Inventory::restock(String, int)");
        Optional<Ast.IfStmt> traced = restock.body().stream()
            .filter(s -> s instanceof Ast.IfStmt)
            .map(s -> (Ast.IfStmt) s)
            .filter(s -> s.location().line() == 18)
            .findFirst();
        assertTrue(traced.isPresent());
        assertEquals(new Ast.BoolLiteral(false, traced.get().condition().location()), traced.get().condition());
    }

    @Test
    void throwingHelperBodyIsLowered() {
        FunctionDecl reject = fn(PKG + "Inventory::reject(String)");
        assertEquals(1, reject.body().size());
        assertTrue(reject.body().get(0) instanceof Ast.ThrowStmt);
    }

    @Test
    void sourceDirsOverrideLimitsParsing() {
        List<SourceUnit> legacyOnly = new StaticAnalyzer()
            .analyze(FIXTURE_ROOT, List.of("src/main/java/com/reachscan/fixture/legacy"), false);
        assertEquals(1, legacyOnly.size());
        assertEquals("src/main/java/com/reachscan/fixture/legacy/OldImporter.java", legacyOnly.get(0).path());
    }

    @Test
    void constructorsChainToSuperclassConstructor(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), "<project><modelVersion>4.0.0</modelVersion></project>");
        Path src = Files.createDirectories(tmp.resolve("src/main/java/demo"));
        Files.writeString(src.resolve("Shapes.java"), """
            package demo;

            class Base {
                Base() {
                    init();
                }

                private void init() {
                    System.out.println("base");
                }
            }

            class Sub extends Base {
                Sub() {
                    System.out.println("sub");
                }
            }

            class Root {
                Root() {
                    setup();
                }

                private void setup() {
                    System.out.println("root");
                }
            }

            class Leaf extends Root {
            }

            public class Shapes {
                public static void main(String[] args) {
                    new Sub();
                    new Leaf();
                }
            }
            """);

        List<SourceUnit> shapes = new StaticAnalyzer().analyze(tmp);
        Map<String, FunctionDecl> byId = shapes.stream()
            .flatMap(u -> u.functions().stream())
            .collect(Collectors.toMap(FunctionDecl::id, Function.identity(), (a, b) -> a));

        Ast.Stmt first = byId.get("java::demo.Sub::<init>()").body().get(0);
        assertTrue(first instanceof Ast.ExprStmt s && s.expr() instanceof Ast.CallExpr c
            && "java::demo.Base::<init>()".equals(c.target()), first.toString());

        AnalysisOptions options = AnalysisOptions.defaults().declaredOnly();
        ReachabilityAnalyzer.AnalysisResult result = new ReachabilityAnalyzer().analyze(shapes, options);
        for (String id : List.of("java::demo.Base::<init>()", "java::demo.Base::init()",
                "java::demo.Root::<init>()", "java::demo.Root::setup()", "java::demo.Leaf::<init>()")) {
            assertEquals(Classification.LIVE,
                result.reachability().classify(result.graph().symbols().lookup(id)), id);
        }
    }

    @Test
    void nullDereferenceAndUnboxingCanReachHandlers(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), "<project><modelVersion>4.0.0</modelVersion></project>");
        Path src = Files.createDirectories(tmp.resolve("src/main/java/demo"));
        Files.writeString(src.resolve("Holder.java"), """
            package demo;

            public class Holder {
                static final int LIMIT = 10;
                int value;

                public static int read(Holder holder) {
                    try {
                        return holder.value;
                    } catch (NullPointerException e) {
                        return -1;
                    }
                }

                public static int unbox(Integer boxed) {
                    try {
                        return boxed + 1;
                    } catch (NullPointerException e) {
                        return 0;
                    }
                }

                public static int limit() {
                    int n;
                    try {
                        n = Holder.LIMIT;
                    } catch (RuntimeException e) {
                        n = 0;
                    }
                    return n;
                }
            }
            """);

        List<SourceUnit> holder = new StaticAnalyzer().analyze(tmp);
        ReachabilityAnalyzer.AnalysisResult result =
            new ReachabilityAnalyzer().analyze(holder, AnalysisOptions.defaults());

        List<Integer> deadLines = result.reachability().findings().stream()
            .flatMap(b -> b.lines().stream())
            .sorted()
            .toList();
        // only the handler around the static field read is unreachable
        assertTrue(deadLines.contains(28), deadLines.toString());
        assertFalse(deadLines.contains(11), deadLines.toString());
        assertFalse(deadLines.contains(19), deadLines.toString());
    }

    @Test
    void syntaxErrorFailsTheRun(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), "<project><modelVersion>4.0.0</modelVersion></project>");
        Path src = Files.createDirectories(tmp.resolve("src/main/java/demo"));
        Files.writeString(src.resolve("Broken.java"), "package demo; class Broken { void f( { } }");

        assertThrows(StaticAnalyzer.SourceParseException.class, () -> new StaticAnalyzer().analyze(tmp));
    }
}
